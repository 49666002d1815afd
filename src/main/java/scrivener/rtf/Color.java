// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

/**
 * An entry of the color table.
 * <p>
 * RTF refers to colors by their position in the table, with 0 being the reader's default color, so the identifier
 * of a color is the position it's registered at, starting from 1; {@link DocumentTemplate.Builder#color(Color)}
 * checks this.
 *
 * @param id    The identifier, a number used in {@code \cf} references.
 * @param red   The red component, 0–255.
 * @param green The green component, 0–255.
 * @param blue  The blue component, 0–255.
 */
public record Color(String id, int red, int green, int blue) {
    /**
     * Validates the components.
     */
    public Color {
        if (id.isEmpty() || !id.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new IllegalArgumentException("Color identifier must be a number, got \"" + id + '"');
        }
        checkComponent("red", red);
        checkComponent("green", green);
        checkComponent("blue", blue);
    }

    /**
     * Renders the color table entry of this color, terminated by a newline.
     */
    public String tableEntry() {
        return "\\red" + red + "\\green" + green + "\\blue" + blue + ";\n";
    }

    private static void checkComponent(final String name, final int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("Color component " + name + " must be between 0 and 255, got " + value);
        }
    }
}
