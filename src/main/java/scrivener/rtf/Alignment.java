// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

/**
 * Paragraph alignment.
 */
public enum Alignment {
    CENTER("qc"),
    JUSTIFIED("qj"),
    LEFT("ql"),
    RIGHT("qr");

    Alignment(final String controlWord) {
        this.controlWord = controlWord;
    }

    String controlWord() {
        return controlWord;
    }

    private final String controlWord;
}
