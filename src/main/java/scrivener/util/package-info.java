// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Assorted utilities that don't fit anywhere else.
 */
@NonNullByDefault
package scrivener.util;

import scrivener.util.annotation.NonNullByDefault;
