// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The formatting a style applies. Every attribute is optional: {@code null} or {@code false} means the attribute is
 * not emitted, leaving it to the reader's default.
 * <p>
 * Lengths are in twips, font sizes in half-points.
 *
 * @param alignment    Paragraph alignment.
 * @param font         Identifier of a registered font, such as {@code f1}.
 * @param fontSize     Font size in half-points.
 * @param lineSpacing  Line spacing in twips, emitted as a multiple of single spacing.
 * @param spaceBefore  Space before the paragraph.
 * @param spaceAfter   Space after the paragraph.
 * @param keepWithNext Whether the paragraph is kept on the same page as the next one.
 * @param bold         Bold text.
 * @param italic       Italic text.
 * @param smallCaps    Small capitals.
 * @param caps         All capitals.
 * @param widowControl Widow and orphan control.
 * @param hyphenation  Automatic hyphenation.
 * @param direction    Paragraph direction.
 * @param color        Identifier of a registered color used for the text.
 * @param firstIndent  First-line indent, relative to the left indent.
 * @param leftIndent   Left indent.
 * @param rightIndent  Right indent.
 * @param language     Language code, such as 1027 for Catalan.
 */
public record StyleAttributes(
    @Nullable Alignment alignment,
    @Nullable String font,
    @Nullable Integer fontSize,
    @Nullable Integer lineSpacing,
    @Nullable Integer spaceBefore,
    @Nullable Integer spaceAfter,
    boolean keepWithNext,
    boolean bold,
    boolean italic,
    boolean smallCaps,
    boolean caps,
    @Nullable WidowControl widowControl,
    boolean hyphenation,
    @Nullable Direction direction,
    @Nullable String color,
    @Nullable Integer firstIndent,
    @Nullable Integer leftIndent,
    @Nullable Integer rightIndent,
    @Nullable Integer language
) {
    /**
     * Returns a new builder with no attributes set.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns attributes with nothing set.
     */
    public static StyleAttributes none() {
        return none;
    }

    /**
     * Appends the control words of every set attribute.
     * <p>
     * The order is fixed, so that the same style always produces the same bytes.
     */
    void appendTo(final StringBuilder builder) {
        if (alignment != null) {
            appendControlWord(builder, alignment.controlWord());
        }
        if (font != null) {
            appendControlWord(builder, font);
        }
        appendParameter(builder, "fs", fontSize);
        if (lineSpacing != null) {
            appendParameter(builder, "sl", lineSpacing);
            appendControlWord(builder, "slmult1");
        }
        appendParameter(builder, "sb", spaceBefore);
        appendParameter(builder, "sa", spaceAfter);
        appendFlag(builder, "keepn", keepWithNext);
        appendFlag(builder, "b", bold);
        appendFlag(builder, "i", italic);
        appendFlag(builder, "scaps", smallCaps);
        appendFlag(builder, "caps", caps);
        if (widowControl != null) {
            appendControlWord(builder, widowControl.controlWord());
        }
        appendFlag(builder, "hyphpar", hyphenation);
        if (direction != null) {
            appendControlWord(builder, direction.controlWord());
        }
        if (color != null) {
            builder.append("\\cf").append(color);
        }
        appendParameter(builder, "fi", firstIndent);
        appendParameter(builder, "li", leftIndent);
        appendParameter(builder, "ri", rightIndent);
        appendParameter(builder, "lang", language);
    }

    private static void appendControlWord(final StringBuilder builder, final String controlWord) {
        builder.append('\\').append(controlWord);
    }

    private static void appendFlag(final StringBuilder builder, final String controlWord, final boolean value) {
        if (value) {
            appendControlWord(builder, controlWord);
        }
    }

    private static void appendParameter(
        final StringBuilder builder,
        final String controlWord,
        final @Nullable Integer value
    ) {
        if (value != null) {
            builder.append('\\').append(controlWord).append(value.intValue());
        }
    }

    private static final StyleAttributes none = new Builder().build();

    /**
     * A builder of {@link StyleAttributes}. Setters return the builder.
     */
    public static final class Builder {
        private Builder() {
        }

        public Builder alignment(final Alignment value) {
            alignment = value;
            return this;
        }

        public Builder font(final String fontId) {
            font = fontId;
            return this;
        }

        public Builder fontSize(final int halfPoints) {
            fontSize = halfPoints;
            return this;
        }

        public Builder lineSpacing(final int twips) {
            lineSpacing = twips;
            return this;
        }

        public Builder spaceBefore(final int twips) {
            spaceBefore = twips;
            return this;
        }

        public Builder spaceAfter(final int twips) {
            spaceAfter = twips;
            return this;
        }

        public Builder keepWithNext() {
            keepWithNext = true;
            return this;
        }

        public Builder bold() {
            bold = true;
            return this;
        }

        public Builder italic() {
            italic = true;
            return this;
        }

        public Builder smallCaps() {
            smallCaps = true;
            return this;
        }

        public Builder caps() {
            caps = true;
            return this;
        }

        public Builder widowControl(final WidowControl value) {
            widowControl = value;
            return this;
        }

        public Builder hyphenation() {
            hyphenation = true;
            return this;
        }

        public Builder direction(final Direction value) {
            direction = value;
            return this;
        }

        public Builder color(final String colorId) {
            color = colorId;
            return this;
        }

        public Builder firstIndent(final int twips) {
            firstIndent = twips;
            return this;
        }

        public Builder leftIndent(final int twips) {
            leftIndent = twips;
            return this;
        }

        public Builder rightIndent(final int twips) {
            rightIndent = twips;
            return this;
        }

        public Builder language(final int code) {
            language = code;
            return this;
        }

        public StyleAttributes build() {
            return new StyleAttributes(
                alignment,
                font,
                fontSize,
                lineSpacing,
                spaceBefore,
                spaceAfter,
                keepWithNext,
                bold,
                italic,
                smallCaps,
                caps,
                widowControl,
                hyphenation,
                direction,
                color,
                firstIndent,
                leftIndent,
                rightIndent,
                language
            );
        }

        private @Nullable Alignment alignment = null;
        private @Nullable String font = null;
        private @Nullable Integer fontSize = null;
        private @Nullable Integer lineSpacing = null;
        private @Nullable Integer spaceBefore = null;
        private @Nullable Integer spaceAfter = null;
        private boolean keepWithNext = false;
        private boolean bold = false;
        private boolean italic = false;
        private boolean smallCaps = false;
        private boolean caps = false;
        private @Nullable WidowControl widowControl = null;
        private boolean hyphenation = false;
        private @Nullable Direction direction = null;
        private @Nullable String color = null;
        private @Nullable Integer firstIndent = null;
        private @Nullable Integer leftIndent = null;
        private @Nullable Integer rightIndent = null;
        private @Nullable Integer language = null;
    }
}
