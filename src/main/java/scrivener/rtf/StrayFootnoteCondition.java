// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

import scrivener.util.condition.Condition;

/**
 * A condition type indicating that a footnote was opened while no paragraph was open.
 * <p>
 * The footnote is written anyway, but the resulting RTF is malformed. Not fatal.
 */
public final class StrayFootnoteCondition extends Condition {
    StrayFootnoteCondition() {
        super("Footnote opened outside of a paragraph");
    }

    @Override
    public String detailedMessage() {
        return message() + "\nThe output will not be well-formed RTF; open a paragraph before adding footnotes.";
    }
}
