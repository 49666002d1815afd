// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

import scrivener.util.condition.Condition;

/**
 * A condition type indicating that a length literal such as {@code 2.5cm} could not be parsed.
 */
public final class LengthParseErrorCondition extends Condition {
    LengthParseErrorCondition(final String literal, final String reason) {
        super("Length impossible to parse: \"" + literal + '"');
        this.literal = literal;
        this.reason = reason;
    }

    /**
     * Retrieves the literal that failed to parse.
     */
    public String literal() {
        return literal;
    }

    @Override
    public String detailedMessage() {
        return message() + "\nReason: " + reason + "\nAccepted forms: \"\", <integer twips>, <number>cm, <number>mm, "
            + "<number>in";
    }

    private final String literal;
    private final String reason;
}
