// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

/**
 * A request to change the page layout of a {@link Document}: an optional preset plus optional per-field overrides.
 * <p>
 * Every length is a literal as accepted by {@link Twips#parse(String)}; the empty string means "not given". The empty
 * preset name means no preset.
 *
 * @param preset       The preset name, or the empty string.
 * @param height       The paper height.
 * @param width        The paper width.
 * @param topMargin    The top margin.
 * @param bottomMargin The bottom margin.
 * @param leftMargin   The left margin.
 * @param rightMargin  The right margin.
 */
public record PageLayoutRequest(
    String preset,
    String height,
    String width,
    String topMargin,
    String bottomMargin,
    String leftMargin,
    String rightMargin
) {
    /**
     * Returns a builder of a request with nothing given.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a request for the given preset alone.
     */
    public static PageLayoutRequest preset(final String presetName) {
        return builder().preset(presetName).build();
    }

    /**
     * A builder of {@link PageLayoutRequest}s.
     */
    public static final class Builder {
        private Builder() {
        }

        public Builder preset(final String value) {
            preset = value;
            return this;
        }

        public Builder height(final String value) {
            height = value;
            return this;
        }

        public Builder width(final String value) {
            width = value;
            return this;
        }

        public Builder topMargin(final String value) {
            topMargin = value;
            return this;
        }

        public Builder bottomMargin(final String value) {
            bottomMargin = value;
            return this;
        }

        public Builder leftMargin(final String value) {
            leftMargin = value;
            return this;
        }

        public Builder rightMargin(final String value) {
            rightMargin = value;
            return this;
        }

        /**
         * Sets all four margins at once.
         */
        public Builder margins(final String value) {
            return topMargin(value).bottomMargin(value).leftMargin(value).rightMargin(value);
        }

        public PageLayoutRequest build() {
            return new PageLayoutRequest(preset, height, width, topMargin, bottomMargin, leftMargin, rightMargin);
        }

        private String preset = "";
        private String height = "";
        private String width = "";
        private String topMargin = "";
        private String bottomMargin = "";
        private String leftMargin = "";
        private String rightMargin = "";
    }
}
