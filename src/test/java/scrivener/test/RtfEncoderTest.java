// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.test;

import java.util.ArrayList;
import java.util.regex.Pattern;
import scrivener.rtf.RtfEncoder;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

final class RtfEncoderTest {
    @ParameterizedTest
    @ValueSource(strings = {"", "Hello", "A sentence, with punctuation: 'quotes' & (parens)!", "~\u007F"})
    void printableAsciiPassesThrough(final String text) {
        assertThat(RtfEncoder.encode(text)).isSameAs(text);
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = '|', value = {
        "\\|\\u92?",
        "{|\\u123?",
        "}|\\u125?",
        "café|caf\\u233?",
        "À|\\u192?",
        "«|\\u171?",
        "א|\\u1488?",
        "\u7FFF|\\u32767?",
        "\u8000|\\u-32768?",
        "\uFFFF|\\u-1?",
    })
    void escapesUseSignedCodeUnits(final String text, final String expected) {
        assertThat(RtfEncoder.encode(text)).isEqualTo(expected);
    }

    @Test
    void controlCharactersAreEscaped() {
        assertThat(RtfEncoder.encode("a\tb\nc\u0000")).isEqualTo("a\\u9?b\\u10?c\\u0?");
        assertThat(RtfEncoder.needsEscape('\u001F')).isTrue();
        assertThat(RtfEncoder.needsEscape(' ')).isFalse();
        assertThat(RtfEncoder.needsEscape('\u007F')).isFalse();
        assertThat(RtfEncoder.needsEscape('\u0080')).isTrue();
    }

    @Test
    void supplementaryCharactersBecomeSurrogatePairs() {
        assertThat(RtfEncoder.encode("𝄞")).isEqualTo("\\u-10188?\\u-8930?");
        assertThat(RtfEncoder.encode("x😀y")).isEqualTo("x\\u-10179?\\u-8704?y");
    }

    @Test
    void codePointsCanBeRecovered() {
        final var text = "Àvia diu: «{café}» \\ ψυχή שָׁלוֹם 𝄞";
        final var encoded = RtfEncoder.encode(text);
        assertThat(encoded.chars()).allMatch(c -> c >= 0x20 && c <= 0x7F);
        assertThat(decode(encoded)).isEqualTo(text);
    }

    @Test
    void encodeToAppends() {
        final var builder = new StringBuilder("{");
        RtfEncoder.encodeTo(builder, "a}b");
        assertThat(builder).hasToString("{a\\u125?b");
    }

    private static String decode(final String encoded) {
        final var matcher = escapePattern.matcher(encoded);
        final var units = new ArrayList<Character>();
        int index = 0;
        while (matcher.find()) {
            encoded.substring(index, matcher.start()).chars().forEach(c -> units.add((char) c));
            units.add((char) (Integer.parseInt(matcher.group(1)) & 0xFFFF));
            index = matcher.end();
        }
        encoded.substring(index).chars().forEach(c -> units.add((char) c));
        final var builder = new StringBuilder();
        units.forEach(builder::append);
        return builder.toString();
    }

    private static final Pattern escapePattern = Pattern.compile("\\\\u(-?[0-9]+)\\?");
}
