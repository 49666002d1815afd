// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Incremental assembly of RTF documents.
 * <p>
 * A {@link scrivener.rtf.DocumentTemplate} holds the font table, color table and style sheet; any number of
 * {@link scrivener.rtf.Document}s can be authored against one template. A document accumulates body markup as
 * paragraphs, inline runs and footnotes are added, and {@link scrivener.rtf.Serializer} turns it into the final RTF
 * text. All text is escaped by {@link scrivener.rtf.RtfEncoder}, so the output is always plain ASCII.
 */
@NonNullByDefault
package scrivener.rtf;

import scrivener.util.annotation.NonNullByDefault;
