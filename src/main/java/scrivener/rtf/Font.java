// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An entry of the font table.
 * <p>
 * Fonts are referenced from styles by identifier, for example {@code f1}.
 *
 * @param id      The identifier, {@code f} followed by a number.
 * @param family  The family classification.
 * @param name    The display name, such as {@code Times New Roman}.
 * @param pitch   The pitch: 0 for default, 1 for fixed, 2 for variable; {@code null} if not declared.
 * @param charset The character set number; {@code null} if not declared.
 */
public record Font(String id, FontFamily family, String name, @Nullable Integer pitch, @Nullable Integer charset) {
    /**
     * Validates the identifier and the pitch.
     */
    public Font {
        Identifiers.requireNumbered(id, "f");
        if (pitch != null && (pitch < 0 || pitch > 2)) {
            throw new IllegalArgumentException("Font pitch must be between 0 and 2, got " + pitch);
        }
    }

    /**
     * Returns a font with no pitch nor character set declared.
     */
    public static Font of(final String id, final FontFamily family, final String name) {
        return new Font(id, family, name, null, null);
    }

    /**
     * Renders the font table entry of this font, terminated by a newline.
     */
    public String tableEntry() {
        final var builder = new StringBuilder();
        builder.append("{\\").append(id).append('\\').append(family.controlWord());
        if (pitch != null) {
            builder.append("\\fprq").append(pitch);
        }
        if (charset != null) {
            builder.append("\\fcharset").append(charset);
        }
        builder.append(' ');
        RtfEncoder.encodeTo(builder, name);
        return builder.append(";}\n").toString();
    }
}
