// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

/**
 * What a style is being looked up for, which determines the default used when the lookup fails.
 */
public enum StyleKind {
    PARAGRAPH,
    FOOTNOTE,
}
