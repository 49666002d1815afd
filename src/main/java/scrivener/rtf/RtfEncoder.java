// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

/**
 * Escapes arbitrary text for inclusion in RTF.
 * <p>
 * Backslashes, braces, control characters and everything above {@code U+007F} are written as {@code \\uN?}
 * escapes, where {@code N} is the UTF-16 code unit as a <em>signed</em> 16-bit number, as RTF requires. Characters
 * outside the Basic Multilingual Plane thus become two escapes, one per surrogate. The {@code ?} is the fallback
 * character for readers that don't understand {@code \\u}.
 */
public final class RtfEncoder {
    private RtfEncoder() {
    }

    /**
     * Returns the escaped form of the given text.
     * <p>
     * Text that needs no escaping is returned as is.
     */
    public static String encode(final String text) {
        if (findCharacterToEscape(text, 0) < 0) {
            return text;
        }
        final var builder = new StringBuilder(text.length() + 16);
        encodeTo(builder, text);
        return builder.toString();
    }

    /**
     * Appends the escaped form of the given text to the given builder.
     */
    public static void encodeTo(final StringBuilder builder, final String text) {
        int index = 0;
        int indexToEscape;
        while ((indexToEscape = findCharacterToEscape(text, index)) >= 0) {
            builder.append(text, index, indexToEscape);
            appendEscape(builder, text.charAt(indexToEscape));
            index = indexToEscape + 1;
        }
        builder.append(text, index, text.length());
    }

    /**
     * Returns {@code true} iff the given character cannot appear verbatim in RTF text.
     */
    public static boolean needsEscape(final char character) {
        return character < firstPrintable
            || character > lastAscii
            || character == '\\'
            || character == '{'
            || character == '}';
    }

    private static void appendEscape(final StringBuilder builder, final char character) {
        // RTF reads the parameter of the unicode control word as a signed 16-bit integer.
        final int value = (character < 0x8000) ? character : character - 0x10000;
        builder.append("\\u").append(value).append('?');
    }

    private static int findCharacterToEscape(final String text, final int startIndex) {
        final var length = text.length();
        for (int i = startIndex; i < length; i += 1) {
            if (needsEscape(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static final char firstPrintable = 0x20;
    private static final char lastAscii = 0x7F;
}
