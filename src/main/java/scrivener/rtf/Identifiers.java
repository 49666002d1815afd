// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

import java.util.regex.Pattern;

// Font and style identifiers double as RTF control words (\f1, \s21), so they're a letter prefix and a number.
final class Identifiers {
    private Identifiers() {
    }

    static String requireNumbered(final String identifier, final String prefix) {
        if (!identifier.startsWith(prefix) || !digits.matcher(identifier.substring(prefix.length())).matches()) {
            throw new IllegalArgumentException(
                "Identifier \"" + identifier + "\" is not of the form " + prefix + "<number>"
            );
        }
        return identifier;
    }

    static String number(final String identifier) {
        int start = 0;
        while (start < identifier.length() && !Character.isDigit(identifier.charAt(start))) {
            start += 1;
        }
        return identifier.substring(start);
    }

    private static final Pattern digits = Pattern.compile("[0-9]+");
}
