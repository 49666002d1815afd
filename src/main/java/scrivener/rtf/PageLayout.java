// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

/**
 * Paper size and margins, all in twips.
 *
 * @param height       The paper height.
 * @param width        The paper width.
 * @param topMargin    The top margin.
 * @param bottomMargin The bottom margin.
 * @param leftMargin   The left margin.
 * @param rightMargin  The right margin.
 */
public record PageLayout(
    int height,
    int width,
    int topMargin,
    int bottomMargin,
    int leftMargin,
    int rightMargin
) {
    /**
     * Returns a human-readable description of this layout, one value per line.
     */
    public String describe() {
        return "Layout in twips:\n"
            + " Paper height: " + height + '\n'
            + " Paper width: " + width + '\n'
            + " Top margin: " + topMargin + '\n'
            + " Bottom margin: " + bottomMargin + '\n'
            + " Left margin: " + leftMargin + '\n'
            + " Right margin: " + rightMargin;
    }

    String markup() {
        return "\\paperh" + height
            + "\\paperw" + width
            + "\\margl" + leftMargin
            + "\\margr" + rightMargin
            + "\\margt" + topMargin
            + "\\margb" + bottomMargin
            + '\n';
    }
}
