// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

/**
 * The font family classification RTF readers use to pick a substitute when a font is missing.
 */
public enum FontFamily {
    NIL("fnil"),
    ROMAN("froman"),
    SWISS("fswiss"),
    MODERN("fmodern"),
    SCRIPT("fscript"),
    DECOR("fdecor"),
    TECH("ftech"),
    BIDI("fbidi");

    FontFamily(final String controlWord) {
        this.controlWord = controlWord;
    }

    /**
     * Returns the control word, without the leading backslash, declaring this family in the font table.
     */
    public String controlWord() {
        return controlWord;
    }

    private final String controlWord;
}
