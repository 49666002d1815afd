// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

/**
 * The numbering style of automatic footnote anchors.
 */
public enum FootnoteNumbering {
    /**
     * 1, 2, 3, …
     */
    ARABIC("ftnnar"),
    /**
     * a, b, c, …
     */
    LOWERCASE_ALPHA("ftnnalc"),
    /**
     * A, B, C, …
     */
    UPPERCASE_ALPHA("ftnnauc"),
    /**
     * i, ii, iii, …
     */
    LOWERCASE_ROMAN("ftnnrlc"),
    /**
     * I, II, III, …
     */
    UPPERCASE_ROMAN("ftnnruc");

    FootnoteNumbering(final String controlWord) {
        this.controlWord = controlWord;
    }

    String controlWord() {
        return controlWord;
    }

    private final String controlWord;
}
