// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The initial settings of a {@link Document}.
 *
 * @param title                The document title, stored in the info group.
 * @param author               The document author, stored in the info group.
 * @param filename             The base name of the file the document is saved to, without extension; {@code null}
 *                             to use the title.
 * @param defaultLanguage      The default language code.
 * @param asianDefaultLanguage The default language code for Asian and right-to-left text.
 * @param paragraphStyle       The default paragraph style; {@code null} to use the template's.
 * @param footnoteStyle        The default footnote style; {@code null} to use the template's.
 * @param layout               The initial page layout.
 * @param footnoteOptions      The initial footnote settings.
 * @param verbose              Whether authoring steps are signaled as {@link AuthoringNoticeCondition}s.
 */
public record DocumentOptions(
    String title,
    String author,
    @Nullable String filename,
    int defaultLanguage,
    int asianDefaultLanguage,
    @Nullable String paragraphStyle,
    @Nullable String footnoteStyle,
    PageLayout layout,
    FootnoteOptions footnoteOptions,
    boolean verbose
) {
    /**
     * Returns the default options: title {@code Document Title}, author {@code author}, Catalan as the default
     * language, Hebrew as the Asian default language, A4 paper, default footnote settings, not verbose.
     */
    public static DocumentOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the file name to use, falling back to the title.
     */
    public String effectiveFilename() {
        return (filename != null) ? filename : title;
    }

    /**
     * A builder of {@link DocumentOptions}, starting from the defaults.
     */
    public static final class Builder {
        private Builder() {
        }

        public Builder title(final String value) {
            title = value;
            return this;
        }

        public Builder author(final String value) {
            author = value;
            return this;
        }

        public Builder filename(final String value) {
            filename = value;
            return this;
        }

        public Builder defaultLanguage(final int value) {
            defaultLanguage = value;
            return this;
        }

        public Builder asianDefaultLanguage(final int value) {
            asianDefaultLanguage = value;
            return this;
        }

        public Builder paragraphStyle(final String styleId) {
            paragraphStyle = styleId;
            return this;
        }

        public Builder footnoteStyle(final String styleId) {
            footnoteStyle = styleId;
            return this;
        }

        public Builder layout(final PageLayout value) {
            layout = value;
            return this;
        }

        public Builder footnoteOptions(final FootnoteOptions value) {
            footnoteOptions = value;
            return this;
        }

        public Builder verbose(final boolean value) {
            verbose = value;
            return this;
        }

        public DocumentOptions build() {
            return new DocumentOptions(
                title,
                author,
                filename,
                defaultLanguage,
                asianDefaultLanguage,
                paragraphStyle,
                footnoteStyle,
                layout,
                footnoteOptions,
                verbose
            );
        }

        private String title = "Document Title";
        private String author = "author";
        private @Nullable String filename = null;
        private int defaultLanguage = catalan;
        private int asianDefaultLanguage = hebrew;
        private @Nullable String paragraphStyle = null;
        private @Nullable String footnoteStyle = null;
        private PageLayout layout = LayoutPreset.A4.layout();
        private FootnoteOptions footnoteOptions = FootnoteOptions.defaults();
        private boolean verbose = false;

        private static final int catalan = 1027;
        private static final int hebrew = 1037;
    }
}
