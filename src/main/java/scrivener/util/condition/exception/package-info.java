// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Conditions wrapping Java exceptions.
 */
@NonNullByDefault
package scrivener.util.condition.exception;

import scrivener.util.annotation.NonNullByDefault;
