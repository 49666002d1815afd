// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

/**
 * Where footnotes are placed on the page.
 */
public enum FootnotePosition {
    /**
     * Right below the last line of text.
     */
    BELOW_TEXT("ftntj"),
    /**
     * At the bottom of the page.
     */
    BOTTOM_OF_PAGE("ftnbj");

    FootnotePosition(final String controlWord) {
        this.controlWord = controlWord;
    }

    String controlWord() {
        return controlWord;
    }

    private final String controlWord;
}
