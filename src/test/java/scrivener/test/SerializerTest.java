// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.test;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.regex.Pattern;
import scrivener.rtf.Color;
import scrivener.rtf.Document;
import scrivener.rtf.DocumentOptions;
import scrivener.rtf.DocumentTemplate;
import scrivener.rtf.Font;
import scrivener.rtf.FontFamily;
import scrivener.rtf.FootnoteNumbering;
import scrivener.rtf.FootnoteOptions;
import scrivener.rtf.FootnotePosition;
import scrivener.rtf.Serializer;
import scrivener.rtf.StandardTemplate;
import scrivener.rtf.Style;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class SerializerTest {
    @Test
    void matchesReference() throws IOException {
        final var document = createSample();
        final var writer = new StringWriter();
        Serializer.serialize(writer, document, creationTime);
        final var reference = Files.readString(referenceFilePath, StandardCharsets.UTF_8);
        assertThat(writer).hasToString(reference);
    }

    @Test
    void reassemblingIsStable() {
        final var document = createSample();
        final var first = String.join("", Serializer.assemble(document, creationTime));
        final var second = String.join("", Serializer.assemble(document, creationTime));
        assertThat(second).isEqualTo(first);
        assertThat(document.isParagraphOpen()).isFalse();
    }

    @Test
    void emptyDocument() {
        final var template = DocumentTemplate.builder()
            .color(new Color("1", 0, 0, 255))
            .style(Style.builder("s0", "Plain").build())
            .build();
        final var options = DocumentOptions.builder()
            .title("Título")
            .author("A{B}")
            .defaultLanguage(1033)
            .asianDefaultLanguage(1041)
            .footnoteOptions(FootnoteOptions.defaults()
                .withPosition(FootnotePosition.BELOW_TEXT)
                .withRestarts(true, true)
                .withNumbering(FootnoteNumbering.LOWERCASE_ROMAN))
            .build();
        final var document = new Document(template, options);
        document.setLayout("digest");
        final var output = String.join("", Serializer.assemble(document, LocalDateTime.of(1999, 12, 31, 23, 59)));
        assertThat(output).isEqualTo(
            "{\\rtf1\\ansi\\deflang1033\\adeflang1041\n"
                + "{\\fonttbl\n}\n"
                + "{\\colortbl\n;\n\\red0\\green0\\blue255;\n}\n"
                + "{\\stylesheet\n{\\s0\\sbasedon0\\snext0\\s0 Plain;}\n}\n"
                + "{\\*\\generator scrivener_0.1.0}\n"
                + "{\\info\n{\\title T\\u237?tulo}\n{\\author A\\u123?B\\u125?}\n"
                + "{\\creatim\\yr1999\\mo12\\dy31\\hr23\\min59}\n}\n"
                + "\\paperh12240\\paperw7920\\margl567\\margr862\\margt1151\\margb720\n"
                + "\\ftntj\\ftnrstpg\\ftnrestart\\ftnnrlc\n"
                + "\\par }"
        );
    }

    @Test
    void defaultFontIsFirstRegistered() {
        final var template = DocumentTemplate.builder()
            .font(Font.of("f4", FontFamily.ROMAN, "Gentium"))
            .font(Font.of("f0", FontFamily.NIL, "Times New Roman"))
            .style(Style.builder("s0", "Plain").build())
            .build();
        final var output = String.join("", Serializer.assemble(new Document(template), creationTime));
        assertThat(output).startsWith(
            "{\\rtf1\\ansi\\deff4\\deflang1027\\adeflang1037\n{\\fonttbl\n{\\f4\\froman Gentium;}\n"
        );
    }

    @Test
    void generatorNameCarriesProjectVersion() throws IOException {
        final var pom = Files.readString(Path.of("pom.xml"), StandardCharsets.UTF_8);
        final var matcher = Pattern.compile("<artifactId>scrivener</artifactId>\\s*<version>([^<]+)</version>")
            .matcher(pom);
        assertThat(matcher.find()).isTrue();
        assertThat(Serializer.generatorName).isEqualTo("scrivener_" + matcher.group(1));
    }

    @Test
    void openContentIsClosed() {
        final var document = new Document(StandardTemplate.get());
        document.openParagraph("Unfinished");
        document.openFootnote("note");
        final var output = String.join("", Serializer.assemble(document, creationTime));
        assertThat(output).endsWith("note}}\n\\par}\n\\par }");
    }

    // Must stay in sync with the reference file.
    private static Document createSample() {
        final var options = DocumentOptions.builder()
            .title("My Document Title")
            .author("Myself")
            .build();
        final var document = new Document(StandardTemplate.get(), options);
        document.setLayout("A4");
        document.openParagraph("This text starts a paragraph.");
        document.addText(" This text continues the paragraph, note the space before 'This'.");
        document.openFootnote("The text of a footnote.", "", "*");
        document.openParagraph("A new paragraph begins. Former note and paragraph are automatically closed.");
        document.openFootnote("This is the text of the second footnote.");
        document.addText(" I'm adding text to the second footnote.");
        document.closeFootnote();
        document.addText(" Now I'm adding text to the second paragraph. I had to close the note manually.");
        document.addText(" Àvia diu: «{café}» \\ 𝄞");
        return document;
    }

    private static final LocalDateTime creationTime = LocalDateTime.of(2022, 3, 4, 5, 6);
    private static final Path referenceFilePath = Path.of("src", "test", "resources", "reference", "sample.rtf");
}
