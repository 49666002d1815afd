// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

/**
 * Widow and orphan control of a paragraph.
 */
public enum WidowControl {
    ENABLED("widctlpar"),
    DISABLED("nowidctlpar");

    WidowControl(final String controlWord) {
        this.controlWord = controlWord;
    }

    String controlWord() {
        return controlWord;
    }

    private final String controlWord;
}
