// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Common Lisp-inspired condition and restart system.
 * <p>
 * Everything the engine wants to tell its caller about, from a mistyped style name to a failed write, is a
 * {@link scrivener.util.condition.Condition}. Handlers see conditions before the stack unwinds, so a command line
 * front end can print a warning and carry on, or print an error and unwind to a restart of its choosing.
 */
@NonNullByDefault
package scrivener.util.condition;

import scrivener.util.annotation.NonNullByDefault;
