// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The command line program, which writes a sample document.
 */
@NonNullByDefault
package scrivener.cli;

import scrivener.util.annotation.NonNullByDefault;
