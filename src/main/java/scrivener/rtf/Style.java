// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

import java.util.function.UnaryOperator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An entry of the style sheet.
 * <p>
 * A style is declared once in the style sheet with {@link #tableEntry()}, and its formatting is repeated through
 * {@link #applyMarkup()} every time a paragraph or footnote uses it.
 * <p>
 * Instances are immutable and are created with {@link #builder(String, String)}.
 */
public final class Style {
    private Style(final Builder builder) {
        id = builder.id;
        name = builder.name;
        basedOn = (builder.basedOn != null) ? builder.basedOn : builder.id;
        next = (builder.next != null) ? builder.next : builder.id;
        attributes = builder.attributes;
    }

    /**
     * Returns a new builder of a style with the given identifier, such as {@code s21}, and human-readable name.
     * <p>
     * Both the base style and the next style default to the style itself.
     */
    public static Builder builder(final String id, final String name) {
        return new Builder(Identifiers.requireNumbered(id, "s"), name);
    }

    /**
     * Retrieves the identifier of this style.
     */
    public String id() {
        return id;
    }

    /**
     * Retrieves the human-readable name of this style.
     */
    public String name() {
        return name;
    }

    /**
     * Retrieves the identifier of the style this style is based on.
     */
    public String basedOn() {
        return basedOn;
    }

    /**
     * Retrieves the identifier of the style applied to the paragraph following one of this style.
     */
    public String next() {
        return next;
    }

    /**
     * Retrieves the formatting attributes of this style.
     */
    public StyleAttributes attributes() {
        return attributes;
    }

    /**
     * Renders the formatting emitted whenever this style is used: the style reference, every set attribute, and a
     * single trailing space.
     */
    public String applyMarkup() {
        final var builder = new StringBuilder();
        appendApplyMarkup(builder);
        return builder.toString();
    }

    /**
     * Renders the style sheet entry of this style, terminated by a newline.
     */
    public String tableEntry() {
        final var builder = new StringBuilder();
        builder.append("{\\").append(id)
            .append("\\sbasedon").append(Identifiers.number(basedOn))
            .append("\\snext").append(Identifiers.number(next));
        appendApplyMarkup(builder);
        RtfEncoder.encodeTo(builder, name);
        return builder.append(";}\n").toString();
    }

    @Override
    public String toString() {
        return "Style[" + id + ", " + name + ']';
    }

    private void appendApplyMarkup(final StringBuilder builder) {
        builder.append('\\').append(id);
        attributes.appendTo(builder);
        builder.append(' ');
    }

    private final String id;
    private final String name;
    private final String basedOn;
    private final String next;
    private final StyleAttributes attributes;

    /**
     * A builder of {@link Style}s.
     */
    public static final class Builder {
        private Builder(final String id, final String name) {
            this.id = id;
            this.name = name;
        }

        /**
         * Sets the style this style is based on.
         */
        public Builder basedOn(final String styleId) {
            basedOn = Identifiers.requireNumbered(styleId, "s");
            return this;
        }

        /**
         * Sets the style applied to the paragraph following one of this style.
         */
        public Builder next(final String styleId) {
            next = Identifiers.requireNumbered(styleId, "s");
            return this;
        }

        /**
         * Sets the formatting attributes.
         */
        public Builder attributes(final StyleAttributes value) {
            attributes = value;
            return this;
        }

        /**
         * Sets the formatting attributes by configuring a fresh {@link StyleAttributes.Builder}.
         */
        public Builder attributes(final UnaryOperator<StyleAttributes.Builder> configuration) {
            attributes = configuration.apply(StyleAttributes.builder()).build();
            return this;
        }

        public Style build() {
            return new Style(this);
        }

        private final String id;
        private final String name;
        private @Nullable String basedOn = null;
        private @Nullable String next = null;
        private StyleAttributes attributes = StyleAttributes.none();
    }
}
