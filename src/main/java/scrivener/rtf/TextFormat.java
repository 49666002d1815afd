// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

import java.util.regex.Pattern;

/**
 * Character formatting of an inline run of text, as the control words opening the run's group.
 *
 * @param controlWords The control words, each with its leading backslash, such as {@code \i\b}.
 */
public record TextFormat(String controlWords) {
    /**
     * Returns the format consisting of a single control word, given without the backslash, such as {@code ul} for
     * underline.
     * <p>
     * The shorthands {@code bi} and {@code ib} mean bold italic.
     *
     * @throws IllegalArgumentException if the keyword is not a valid RTF control word.
     */
    public static TextFormat keyword(final String keyword) {
        if (keyword.equals("bi") || keyword.equals("ib")) {
            return BOLD_ITALIC;
        }
        if (!controlWordPattern.matcher(keyword).matches()) {
            throw new IllegalArgumentException("Not an RTF control word: \"" + keyword + '"');
        }
        return new TextFormat("\\" + keyword);
    }

    public static final TextFormat BOLD = new TextFormat("\\b");
    public static final TextFormat ITALIC = new TextFormat("\\i");
    public static final TextFormat BOLD_ITALIC = new TextFormat("\\i\\b");
    public static final TextFormat SUBSCRIPT = new TextFormat("\\sub");
    public static final TextFormat SUPERSCRIPT = new TextFormat("\\super");
    public static final TextFormat SMALL_CAPS = new TextFormat("\\scaps");

    private static final Pattern controlWordPattern = Pattern.compile("[a-zA-Z]+(?:-?[0-9]+)?");
}
