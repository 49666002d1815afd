// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

import scrivener.util.condition.Condition;

/**
 * A purely informational condition describing an authoring step, such as a paragraph being opened.
 * <p>
 * Only signaled by documents created with {@link DocumentOptions#verbose()} set. Never fatal.
 */
public final class AuthoringNoticeCondition extends Condition {
    AuthoringNoticeCondition(final String message) {
        super(message);
    }
}
