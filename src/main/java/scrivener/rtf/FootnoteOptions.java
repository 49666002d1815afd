// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

/**
 * Document-wide footnote settings.
 *
 * @param position           Where footnotes go on the page.
 * @param restartEachPage    Whether numbering restarts on every page.
 * @param restartEachSection Whether numbering restarts in every section.
 * @param numbering          The numbering style.
 */
public record FootnoteOptions(
    FootnotePosition position,
    boolean restartEachPage,
    boolean restartEachSection,
    FootnoteNumbering numbering
) {
    /**
     * Returns the default options: bottom of the page, no restarts, arabic numbers.
     */
    public static FootnoteOptions defaults() {
        return defaults;
    }

    /**
     * Returns a copy of these options with the given position.
     */
    public FootnoteOptions withPosition(final FootnotePosition value) {
        return new FootnoteOptions(value, restartEachPage, restartEachSection, numbering);
    }

    /**
     * Returns a copy of these options with the given restart settings.
     */
    public FootnoteOptions withRestarts(final boolean eachPage, final boolean eachSection) {
        return new FootnoteOptions(position, eachPage, eachSection, numbering);
    }

    /**
     * Returns a copy of these options with the given numbering style.
     */
    public FootnoteOptions withNumbering(final FootnoteNumbering value) {
        return new FootnoteOptions(position, restartEachPage, restartEachSection, value);
    }

    String markup() {
        final var builder = new StringBuilder();
        builder.append('\\').append(position.controlWord());
        if (restartEachPage) {
            builder.append("\\ftnrstpg");
        }
        if (restartEachSection) {
            builder.append("\\ftnrestart");
        }
        builder.append('\\').append(numbering.controlWord()).append('\n');
        return builder.toString();
    }

    private static final FootnoteOptions defaults =
        new FootnoteOptions(FootnotePosition.BOTTOM_OF_PAGE, false, false, FootnoteNumbering.ARABIC);
}
