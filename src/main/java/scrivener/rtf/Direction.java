// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

/**
 * Paragraph text direction.
 */
public enum Direction {
    RIGHT_TO_LEFT("rtlpar"),
    LEFT_TO_RIGHT("ltrpar");

    Direction(final String controlWord) {
        this.controlWord = controlWord;
    }

    String controlWord() {
        return controlWord;
    }

    private final String controlWord;
}
