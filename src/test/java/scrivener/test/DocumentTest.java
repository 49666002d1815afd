// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.test;

import java.time.LocalDateTime;
import java.util.Random;
import java.util.stream.LongStream;
import scrivener.rtf.AuthoringNoticeCondition;
import scrivener.rtf.Document;
import scrivener.rtf.DocumentOptions;
import scrivener.rtf.DocumentState;
import scrivener.rtf.LayoutPreset;
import scrivener.rtf.LengthParseErrorCondition;
import scrivener.rtf.PageLayout;
import scrivener.rtf.PageLayoutRequest;
import scrivener.rtf.Serializer;
import scrivener.rtf.StandardTemplate;
import scrivener.rtf.StrayFootnoteCondition;
import scrivener.rtf.StyleKind;
import scrivener.rtf.StyleNotFoundCondition;
import scrivener.rtf.TextFormat;
import scrivener.rtf.UnknownLayoutCondition;
import scrivener.util.condition.Condition;
import scrivener.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

final class DocumentTest {
    static LongStream provideSeeds() {
        return new Random().longs(8);
    }

    @Test
    void paragraphWithInlineFormatting() {
        final var document = new Document(StandardTemplate.get());
        document.openParagraph("Hello");
        document.bold("World");
        document.closeParagraph();
        assertThat(document.bodyMarkup()).isEqualTo("{\\pard \\s0\\qj Hello{\\b World}\\par}\n");
        assertThat(document.state()).isEqualTo(DocumentState.NO_PARAGRAPH);
    }

    @Test
    void formattedRuns() {
        final var document = new Document(StandardTemplate.get());
        document.openParagraph();
        document.italic("a");
        document.subscript("b");
        document.superscript("c");
        document.smallCaps("d");
        document.addText("e", TextFormat.BOLD_ITALIC);
        document.addText("{f}", TextFormat.keyword("ul"));
        assertThat(document.bodyMarkup())
            .isEqualTo("{\\pard \\s0\\qj {\\i a}{\\sub b}{\\super c}{\\scaps d}{\\i\\b e}{\\ul \\u123?f\\u125?}");
    }

    @Test
    void textFormatKeywords() {
        assertThat(TextFormat.keyword("bi")).isEqualTo(TextFormat.BOLD_ITALIC);
        assertThat(TextFormat.keyword("ib")).isEqualTo(TextFormat.BOLD_ITALIC);
        assertThat(TextFormat.keyword("b").controlWords()).isEqualTo("\\b");
        assertThat(TextFormat.keyword("expnd-4").controlWords()).isEqualTo("\\expnd-4");
        assertThatIllegalArgumentException().isThrownBy(() -> TextFormat.keyword(""));
        assertThatIllegalArgumentException().isThrownBy(() -> TextFormat.keyword("b i"));
        assertThatIllegalArgumentException().isThrownBy(() -> TextFormat.keyword("\\b"));
    }

    @Test
    void openingParagraphClosesPreviousOnce() {
        final var document = new Document(StandardTemplate.get());
        document.openParagraph("One");
        document.openParagraph("Two", "s21");
        document.closeParagraph();
        document.closeParagraph();
        assertThat(document.bodyMarkup()).isEqualTo(
            "{\\pard \\s0\\qj One\\par}\n"
                + "{\\pard \\s21\\qj\\f1\\fs24\\lang1024 Two\\par}\n"
        );
    }

    @Test
    void closingNothingDoesNothing() {
        final var document = new Document(StandardTemplate.get());
        document.closeFootnote();
        document.closeParagraph();
        assertThat(document.bodyMarkup()).isEmpty();
        assertThat(document.state()).isEqualTo(DocumentState.NO_PARAGRAPH);
    }

    @Test
    void footnotesCloseWithTheirParagraph() {
        final var document = new Document(StandardTemplate.get());
        document.openParagraph("First.");
        document.openFootnote("Custom anchor.", "", "*");
        assertThat(document.state()).isEqualTo(DocumentState.FOOTNOTE_OPEN);
        document.openParagraph("Second.");
        document.openFootnote("Numbered.");
        document.addText(" More.");
        document.closeFootnote();
        assertThat(document.state()).isEqualTo(DocumentState.PARAGRAPH_OPEN);
        document.addText(" Back.");
        document.closeParagraph();
        final var note = "\\pard\\plain \\s23\\qj\\f1\\fs18\\fi-227\\li227 ";
        assertThat(document.bodyMarkup()).isEqualTo(
            "{\\pard \\s0\\qj First.{\\super *{\\footnote *" + note + "Custom anchor.}}\n"
                + "\\par}\n"
                + "{\\pard \\s0\\qj Second.{\\super \\chftn{\\footnote \\chftn" + note + "Numbered. More.}}\n"
                + " Back.\\par}\n"
        );
    }

    @Test
    void openingFootnoteClosesPreviousFootnote() {
        final var document = new Document(StandardTemplate.get());
        document.openParagraph("P");
        document.openFootnote("a", "s26");
        document.openFootnote("b", "s29", "{");
        assertThat(document.bodyMarkup()).isEqualTo(
            "{\\pard \\s0\\qj P"
                + "{\\super \\chftn{\\footnote \\chftn\\pard\\plain \\s26\\qj\\f1\\fs20\\fi-227\\li227\\lang1027 a}}\n"
                + "{\\super \\u123?{\\footnote \\u123?\\pard\\plain "
                + "\\s29\\qj\\f1\\fs20\\hyphpar\\fi-227\\li227\\lang1040 b"
        );
        final var output = String.join("", Serializer.assemble(document, LocalDateTime.of(2022, 1, 1, 0, 0)));
        assertThat(output).endsWith("lang1040 b}}\n\\par}\n\\par }");
        assertThat(document.state()).isEqualTo(DocumentState.NO_PARAGRAPH);
    }

    @Test
    void strayFootnoteIsFlagged() {
        final var document = new Document(StandardTemplate.get());
        final var conditions = Conditions.collect(StrayFootnoteCondition.class, () -> document.openFootnote("x"));
        assertThat(conditions).hasSize(1);
        assertThat(document.state()).isEqualTo(DocumentState.STRAY_FOOTNOTE_OPEN);
        document.closeFootnote();
        assertThat(document.state()).isEqualTo(DocumentState.NO_PARAGRAPH);
        assertThat(document.bodyMarkup()).startsWith("{\\super \\chftn{\\footnote").endsWith("x}}\n");
    }

    @ParameterizedTest
    @MethodSource("provideSeeds")
    void randomAuthoringKeepsStructureBalanced(final long seed) {
        final var random = new Random(seed);
        final var document = new Document(StandardTemplate.get());
        // Footnotes are only opened inside paragraphs here, so the footnote state implies the paragraph state.
        for (int i = 0; i < 500; i += 1) {
            switch (random.nextInt(6)) {
                case 0 -> document.openParagraph("p" + i, random.nextBoolean() ? "" : "s21");
                case 1 -> document.closeParagraph();
                case 2 -> {
                    if (document.isParagraphOpen()) {
                        document.openFootnote("n" + i);
                    }
                }
                case 3 -> document.closeFootnote();
                case 4 -> document.addText(" t" + i);
                default -> document.bold("b" + i);
            }
            assertThat(!document.isFootnoteOpen() || document.isParagraphOpen()).isTrue();
            assertThat(document.state()).isNotEqualTo(DocumentState.STRAY_FOOTNOTE_OPEN);
        }
        document.closeParagraph();
        final var body = document.bodyMarkup();
        int depth = 0;
        for (int i = 0; i < body.length(); i += 1) {
            final var character = body.charAt(i);
            if (character == '{') {
                depth += 1;
            } else if (character == '}') {
                depth -= 1;
                assertThat(depth).isNotNegative();
            }
        }
        assertThat(depth).isZero();
        assertThat(countOccurrences(body, "{\\pard ")).isEqualTo(countOccurrences(body, "\\par}\n"));
    }

    @Test
    void unknownStylesFallBackToDefaults() {
        final var document = new Document(StandardTemplate.get());
        final var conditions = Conditions.collect(StyleNotFoundCondition.class, () -> {
            document.openParagraph("x", "s99");
            document.openFootnote("y", "nope");
            document.openParagraph("z", "");
        });
        assertThat(conditions).hasSize(2);
        assertThat(conditions.get(0).requestedId()).isEqualTo("s99");
        assertThat(conditions.get(0).kind()).isEqualTo(StyleKind.PARAGRAPH);
        assertThat(conditions.get(0).message()).isEqualTo("Style \"s99\" not found. Defaulting to \"s0\".");
        assertThat(conditions.get(1).fallback().id()).isEqualTo("s23");
        assertThat(document.bodyMarkup()).startsWith("{\\pard \\s0\\qj x{\\super \\chftn{\\footnote \\chftn\\pard\\plain \\s23");
    }

    @Test
    void defaultStylesCanBeChanged() {
        final var options = DocumentOptions.builder().paragraphStyle("s21").footnoteStyle("s99").build();
        final var conditions = Conditions.collect(StyleNotFoundCondition.class, () -> {
            final var document = new Document(StandardTemplate.get(), options);
            assertThat(document.defaultStyle(StyleKind.PARAGRAPH).id()).isEqualTo("s21");
            assertThat(document.defaultStyle(StyleKind.FOOTNOTE).id()).isEqualTo("s23");
            document.setDefaultStyle("s27", StyleKind.PARAGRAPH);
            document.setDefaultStyle("s404", StyleKind.FOOTNOTE);
            assertThat(document.defaultStyle(StyleKind.PARAGRAPH).id()).isEqualTo("s27");
            assertThat(document.defaultStyle(StyleKind.FOOTNOTE).id()).isEqualTo("s23");
        });
        assertThat(conditions).extracting(StyleNotFoundCondition::requestedId).containsExactly("s99", "s404");
    }

    @Test
    void defaultLayoutIsA4() {
        final var document = new Document(StandardTemplate.get());
        assertThat(document.layout()).isEqualTo(new PageLayout(16838, 11906, 1134, 1134, 1134, 1134));
        assertThat(document.layout()).isEqualTo(LayoutPreset.A4.layout());
        assertThat(document.layout().describe()).contains(" Paper height: 16838\n", " Right margin: 1134");
    }

    @Test
    void presetsApply() {
        final var document = new Document(StandardTemplate.get());
        document.setLayout("royal");
        assertThat(document.layout()).isEqualTo(new PageLayout(13262, 8827, 1152, 720, 864, 864));
        document.setLayout("LAS");
        assertThat(document.layout()).isEqualTo(new PageLayout(13606, 9638, 1587, 1417, 1134, 1134));
        document.setLayout("");
        assertThat(document.layout()).isEqualTo(LayoutPreset.LAS.layout());
    }

    @Test
    void explicitLengthsOverridePreset() {
        final var document = new Document(StandardTemplate.get());
        document.setLayout(PageLayoutRequest.builder().preset("B5").topMargin("1in").rightMargin("500").build());
        assertThat(document.layout()).isEqualTo(new PageLayout(14173, 9978, 1440, 1417, 1134, 500));
        document.setLayout(PageLayoutRequest.builder().width("10cm").margins("5mm").build());
        assertThat(document.layout()).isEqualTo(new PageLayout(14173, 5669, 283, 283, 283, 283));
    }

    @Test
    void unknownPresetIsFatal() {
        final var document = new Document(StandardTemplate.get());
        assertThatExceptionOfType(UnhandledErrorError.class)
            .isThrownBy(() -> document.setLayout("Letter"))
            .satisfies(error -> {
                assertThat(error.condition()).isInstanceOf(UnknownLayoutCondition.class);
                assertThat(error.condition().detailedMessage()).contains("A4, B5, A5, royal, digest, LAS");
            });
        assertThat(document.layout()).isEqualTo(LayoutPreset.A4.layout());
    }

    @Test
    void malformedLengthLeavesLayoutUnchanged() {
        final var document = new Document(StandardTemplate.get());
        document.setLayout("A5");
        assertThatExceptionOfType(UnhandledErrorError.class)
            .isThrownBy(() -> document.setLayout(
                PageLayoutRequest.builder().preset("B5").height("20cm").leftMargin("2pt").build()
            ))
            .satisfies(error -> assertThat(error.condition()).isInstanceOf(LengthParseErrorCondition.class));
        assertThat(document.layout()).isEqualTo(LayoutPreset.A5.layout());
    }

    @Test
    void verboseDocumentsNarrate() {
        final var options = DocumentOptions.builder().title("Notes").verbose(true).build();
        final var notices = Conditions.collect(AuthoringNoticeCondition.class, () -> {
            final var document = new Document(StandardTemplate.get(), options);
            document.openParagraph("Hi");
            document.openFootnote("note");
            document.closeParagraph();
        });
        assertThat(notices).extracting(Condition::message).containsExactly(
            "Document created with title \"Notes\".",
            "Open paragraph: Hi",
            "Open footnote: note",
            "Close footnote.",
            "Close paragraph."
        );
    }

    @Test
    void quietDocumentsSignalNothing() {
        final var conditions = Conditions.collect(() -> {
            final var document = new Document(StandardTemplate.get());
            document.openParagraph("Hi");
            document.openFootnote("note");
            document.setLayout("digest");
            document.closeParagraph();
        });
        assertThat(conditions).isEmpty();
    }

    @Test
    void optionsDefaults() {
        final var document = new Document(StandardTemplate.get());
        assertThat(document.title()).isEqualTo("Document Title");
        assertThat(document.author()).isEqualTo("author");
        assertThat(document.filename()).isEqualTo("Document Title");
        assertThat(document.defaultLanguage()).isEqualTo(1027);
        assertThat(document.asianDefaultLanguage()).isEqualTo(1037);
        assertThat(DocumentOptions.builder().title("T").filename("out").build().effectiveFilename()).isEqualTo("out");
    }

    private static int countOccurrences(final String haystack, final String needle) {
        int count = 0;
        for (int index = haystack.indexOf(needle); index >= 0; index = haystack.indexOf(needle, index + 1)) {
            count += 1;
        }
        return count;
    }
}
