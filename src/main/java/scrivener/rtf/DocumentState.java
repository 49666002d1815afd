// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

/**
 * What a {@link Document} currently has open.
 */
public enum DocumentState {
    NO_PARAGRAPH,
    PARAGRAPH_OPEN,
    FOOTNOTE_OPEN,
    /**
     * A footnote is open but no paragraph hosts it. Only reachable by opening a footnote with no paragraph open.
     */
    STRAY_FOOTNOTE_OPEN,
}
