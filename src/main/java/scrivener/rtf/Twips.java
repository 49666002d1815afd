// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

import java.util.regex.Pattern;
import scrivener.util.condition.ConditionContext;

/**
 * Conversions between twips, the unit RTF measures page geometry in, and human units.
 * <p>
 * A twip is a twentieth of a point: there are 1440 twips to an inch.
 */
public final class Twips {
    private Twips() {
    }

    /**
     * Parses a length literal into twips.
     * <p>
     * Accepted forms:
     * <ul>
     * <li>the empty string, meaning "not given", which yields {@link #unset},
     * <li>a string of decimal digits, taken to be twips already,
     * <li>a decimal number followed by {@code cm}, {@code mm} or {@code in}, rounded to the nearest twip.
     * </ul>
     * Anything else is signaled as a fatal {@link LengthParseErrorCondition}. Unit suffixes are case-sensitive.
     */
    public static int parse(final String literal) {
        if (literal.isEmpty()) {
            return unset;
        }
        if (isAllDigits(literal)) {
            try {
                return Integer.parseInt(literal);
            } catch (final NumberFormatException e) {
                throw ConditionContext.error(new LengthParseErrorCondition(literal, "value out of range"));
            }
        }
        if (literal.length() <= suffixLength) {
            throw ConditionContext.error(new LengthParseErrorCondition(literal, "no unit suffix"));
        }
        final var body = literal.substring(0, literal.length() - suffixLength);
        final var suffix = literal.substring(literal.length() - suffixLength);
        final var number = parseNumber(literal, body);
        final double twips = switch (suffix) {
            case "cm" -> number * perCentimeter;
            case "mm" -> number * perCentimeter / 10;
            case "in" -> number * perInch;
            default -> throw ConditionContext.error(
                new LengthParseErrorCondition(literal, "unknown unit suffix \"" + suffix + '"')
            );
        };
        return roundToTwips(literal, twips);
    }

    /**
     * Returns the given number of centimeters in twips, rounded to the nearest twip.
     */
    public static int fromCentimeters(final double centimeters) {
        return (int) Math.rint(centimeters * perCentimeter);
    }

    /**
     * Returns the given number of inches in twips, rounded to the nearest twip.
     */
    public static int fromInches(final double inches) {
        return (int) Math.rint(inches * perInch);
    }

    /**
     * Returns the given number of twips in centimeters.
     */
    public static double toCentimeters(final int twips) {
        return twips / perCentimeter;
    }

    /**
     * Returns the given number of twips in inches.
     */
    public static double toInches(final int twips) {
        return twips / (double) perInch;
    }

    private static boolean isAllDigits(final String string) {
        final var length = string.length();
        for (int i = 0; i < length; i += 1) {
            final var character = string.charAt(i);
            if (character < '0' || character > '9') {
                return false;
            }
        }
        return true;
    }

    private static double parseNumber(final String literal, final String body) {
        if (!numberPattern.matcher(body).matches()) {
            throw ConditionContext.error(new LengthParseErrorCondition(literal, "\"" + body + "\" is not a number"));
        }
        return Double.parseDouble(body);
    }

    private static int roundToTwips(final String literal, final double twips) {
        // Halves round to even.
        final var rounded = Math.rint(twips);
        if (rounded > Integer.MAX_VALUE || rounded < Integer.MIN_VALUE) {
            throw ConditionContext.error(new LengthParseErrorCondition(literal, "value out of range"));
        }
        return (int) rounded;
    }

    /**
     * The value {@link #parse(String)} returns for the empty literal. Page geometry treats every negative value as
     * "keep the current one".
     */
    public static final int unset = -1;

    /**
     * The number of twips in a centimeter.
     */
    public static final double perCentimeter = 566.929133858;

    /**
     * The number of twips in an inch.
     */
    public static final int perInch = 1440;

    private static final int suffixLength = 2;
    private static final Pattern numberPattern = Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");
}
