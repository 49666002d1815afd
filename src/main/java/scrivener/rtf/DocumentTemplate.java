// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import scrivener.util.condition.ConditionContext;

/**
 * The resource tables shared by documents: fonts, colors and styles, plus the default paragraph and footnote styles.
 * <p>
 * Templates are immutable once built, so any number of {@link Document}s, on any number of threads, can use the same
 * template. Tables keep registration order, which is the order they're declared in the output.
 */
public final class DocumentTemplate {
    private DocumentTemplate(final Builder builder) {
        fonts = List.copyOf(builder.fonts.values());
        colors = List.copyOf(builder.colors.values());
        styles = List.copyOf(builder.styles.values());
        paragraphStyle = resolveDefault(builder, builder.paragraphStyle);
        footnoteStyle = resolveDefault(builder, builder.footnoteStyle);
    }

    /**
     * Returns a new, empty template builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder initialized with every resource of this template, to derive a template with more resources.
     */
    public Builder toBuilder() {
        final var builder = new Builder();
        fonts.forEach(builder::font);
        colors.forEach(builder::color);
        styles.forEach(builder::style);
        return builder.paragraphStyle(paragraphStyle.id()).footnoteStyle(footnoteStyle.id());
    }

    public List<Font> fonts() {
        return fonts;
    }

    public List<Color> colors() {
        return colors;
    }

    public List<Style> styles() {
        return styles;
    }

    /**
     * Returns the style with the given identifier, or {@code null} if there's none.
     */
    public @Nullable Style findStyle(final String id) {
        for (final var style : styles) {
            if (style.id().equals(id)) {
                return style;
            }
        }
        return null;
    }

    /**
     * Returns the style used when a paragraph or footnote asks for no style, or for one that doesn't exist.
     */
    public Style defaultStyle(final StyleKind kind) {
        return switch (kind) {
            case PARAGRAPH -> paragraphStyle;
            case FOOTNOTE -> footnoteStyle;
        };
    }

    private static Style resolveDefault(final Builder builder, final @Nullable String id) {
        if (builder.styles.isEmpty()) {
            throw new IllegalStateException("A document template needs at least one style");
        }
        if (id == null) {
            return builder.styles.values().iterator().next();
        }
        final var style = builder.styles.get(id);
        if (style == null) {
            throw new IllegalStateException("Default style " + id + " is not registered");
        }
        return style;
    }

    private final List<Font> fonts;
    private final List<Color> colors;
    private final List<Style> styles;
    private final Style paragraphStyle;
    private final Style footnoteStyle;

    /**
     * A builder of {@link DocumentTemplate}s.
     * <p>
     * Registering a resource under an identifier that's already taken replaces the earlier resource, keeping its
     * position in the table.
     */
    public static final class Builder {
        private Builder() {
        }

        /**
         * Registers a font.
         */
        public Builder font(final Font font) {
            fonts.put(font.id(), font);
            return this;
        }

        /**
         * Registers a color.
         * <p>
         * RTF refers to colors by table position, so a new color's identifier must be its position: {@code 1} for the
         * first color, {@code 2} for the second, and so on. Re-registering an identifier replaces that color.
         *
         * @throws IllegalArgumentException if the color is new and its identifier isn't the next position.
         */
        public Builder color(final Color color) {
            if (!colors.containsKey(color.id())) {
                final var position = String.valueOf(colors.size() + 1);
                if (!color.id().equals(position)) {
                    throw new IllegalArgumentException(
                        "Color \"" + color.id() + "\" would be at position " + position + " of the color table"
                    );
                }
            }
            colors.put(color.id(), color);
            return this;
        }

        /**
         * Registers a style.
         * <p>
         * The base and next styles must be the style itself or already registered, and so must the font and color
         * the style refers to; a dangling reference is signaled as a fatal {@link StyleReferenceCondition}. So is a
         * reference that would close a cycle through a replaced style: apart from a style referring to itself, style
         * references never form cycles.
         */
        public Builder style(final Style style) {
            checkStyleReference(style, style.basedOn());
            checkStyleReference(style, style.next());
            final var attributes = style.attributes();
            final var font = attributes.font();
            if (font != null && !fonts.containsKey(font)) {
                throw ConditionContext.error(new StyleReferenceCondition(style.id(), "font", font));
            }
            final var color = attributes.color();
            if (color != null && !colors.containsKey(color)) {
                throw ConditionContext.error(new StyleReferenceCondition(style.id(), "color", color));
            }
            styles.put(style.id(), style);
            return this;
        }

        /**
         * Sets the default paragraph style. Defaults to the first registered style.
         */
        public Builder paragraphStyle(final String styleId) {
            paragraphStyle = styleId;
            return this;
        }

        /**
         * Sets the default footnote style. Defaults to the first registered style.
         */
        public Builder footnoteStyle(final String styleId) {
            footnoteStyle = styleId;
            return this;
        }

        /**
         * Builds the template.
         *
         * @throws IllegalStateException if no style is registered, or a default style is not registered.
         */
        public DocumentTemplate build() {
            return new DocumentTemplate(this);
        }

        private void checkStyleReference(final Style style, final String referencedId) {
            if (referencedId.equals(style.id())) {
                return;
            }
            if (!styles.containsKey(referencedId) || reaches(referencedId, style.id())) {
                throw ConditionContext.error(new StyleReferenceCondition(style.id(), "style", referencedId));
            }
        }

        // Only possible when a style is replaced: the old version may be referenced by the styles it now refers to.
        private boolean reaches(final String fromId, final String targetId) {
            final var pending = new ArrayDeque<String>();
            final var seen = new HashSet<String>();
            pending.add(fromId);
            while (!pending.isEmpty()) {
                final var id = pending.remove();
                if (id.equals(targetId)) {
                    return true;
                }
                final var style = styles.get(id);
                if (style != null && seen.add(id)) {
                    pending.add(style.basedOn());
                    pending.add(style.next());
                }
            }
            return false;
        }

        private final LinkedHashMap<String, Font> fonts = new LinkedHashMap<>();
        private final LinkedHashMap<String, Color> colors = new LinkedHashMap<>();
        private final LinkedHashMap<String, Style> styles = new LinkedHashMap<>();
        private @Nullable String paragraphStyle = null;
        private @Nullable String footnoteStyle = null;
    }
}
