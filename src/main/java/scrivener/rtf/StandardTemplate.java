// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

/**
 * The built-in template: a handful of book fonts, three colors, and styles for body text, titles and footnotes in
 * Catalan, Hebrew, Greek and Italian.
 * <p>
 * The default paragraph style is {@code s0}, the default footnote style {@code s23}.
 */
public final class StandardTemplate {
    private StandardTemplate() {
    }

    /**
     * Returns the built-in template.
     */
    public static DocumentTemplate get() {
        return Holder.template;
    }

    private static DocumentTemplate create() {
        return DocumentTemplate.builder()
            .font(Font.of("f0", FontFamily.NIL, "Times New Roman"))
            .font(Font.of("f1", FontFamily.NIL, "Linux Libertine"))
            .font(Font.of("f2", FontFamily.NIL, "SBL BibLit"))
            .font(Font.of("f3", FontFamily.SWISS, "Linux Biolinum"))
            .color(new Color("1", 128, 128, 128))
            .color(new Color("2", 128, 64, 0))
            .color(new Color("3", 255, 255, 255))
            .style(Style.builder("s0", "Default")
                .attributes(a -> a.alignment(Alignment.JUSTIFIED))
                .build())
            .style(Style.builder("s21", "Normal").basedOn("s0")
                .attributes(a -> a.alignment(Alignment.JUSTIFIED).font("f1").fontSize(24).language(neutral))
                .build())
            .style(Style.builder("s22", "Normal hebreu").basedOn("s21")
                .attributes(a -> a.alignment(Alignment.JUSTIFIED).font("f2").fontSize(24)
                    .direction(Direction.RIGHT_TO_LEFT).language(hebrew))
                .build())
            .style(Style.builder("s23", "Nota").basedOn("s21")
                .attributes(a -> noteIndents(a.alignment(Alignment.JUSTIFIED).font("f1").fontSize(18)))
                .build())
            .style(Style.builder("s24", "Nota hebreu").basedOn("s23")
                .attributes(a -> a.alignment(Alignment.JUSTIFIED).font("f2").fontSize(22).language(1307))
                .build())
            .style(Style.builder("s25", "Estil_Titols").basedOn("s21")
                .attributes(a -> a.alignment(Alignment.CENTER).font("f1").fontSize(28).spaceBefore(1132)
                    .spaceAfter(566).keepWithNext().bold().language(ancientGreek))
                .build())
            .style(Style.builder("s26", "Nota normal").basedOn("s23")
                .attributes(a -> noteIndents(a.alignment(Alignment.JUSTIFIED).font("f1").fontSize(20))
                    .language(catalan))
                .build())
            .style(Style.builder("s27", "Normal grec").basedOn("s21")
                .attributes(a -> a.alignment(Alignment.JUSTIFIED).font("f1").fontSize(24).lineSpacing(276)
                    .hyphenation().language(ancientGreek))
                .build())
            // Hidden titles: tiny white text, for entries that only exist for the reader's navigation pane.
            .style(Style.builder("s28", "Estil_Titols_Amagats").basedOn("s0")
                .attributes(a -> a.alignment(Alignment.LEFT).font("f1").fontSize(4).keepWithNext().color("3")
                    .language(ancientGreek))
                .build())
            .style(Style.builder("s29", "Nota italia").basedOn("s23")
                .attributes(a -> noteIndents(a.alignment(Alignment.JUSTIFIED).font("f1").fontSize(20))
                    .hyphenation().language(italian))
                .build())
            .paragraphStyle("s0")
            .footnoteStyle("s23")
            .build();
    }

    // Hanging indent of 4mm, so that footnote text lines up after the number.
    private static StyleAttributes.Builder noteIndents(final StyleAttributes.Builder attributes) {
        return attributes.firstIndent(-227).leftIndent(227);
    }

    private static final int neutral = 1024;
    private static final int catalan = 1027;
    private static final int hebrew = 1037;
    private static final int italian = 1040;
    private static final int ancientGreek = 1609;

    private static final class Holder {
        private static final DocumentTemplate template = create();
    }
}
