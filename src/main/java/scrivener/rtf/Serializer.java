// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

import java.io.IOException;
import java.io.Writer;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import scrivener.util.Trace;

/**
 * The document-to-RTF serializer.
 * <p>
 * The output consists of, in order: the prolog with the default languages, the font table, the color table, the style
 * sheet, the generator tag, the info group, the page geometry, the footnote settings, the body, and the final
 * paragraph mark closing the document group.
 */
public final class Serializer {
    private Serializer(final Document document) {
        this.document = document;
    }

    /**
     * Serializes the given document to RTF, writing the output to the given {@link Writer}.
     * <p>
     * The open paragraph and footnote, if any, are closed first. The creation time is recorded in the info group.
     * Any {@link IOException}s thrown by the writer are allowed to propagate.
     */
    public static void serialize(
        final Writer writer,
        final Document document,
        final LocalDateTime creationTime
    ) throws IOException {
        final var lines = assemble(document, creationTime);
        for (final var line : lines) {
            writer.write(line);
        }
    }

    /**
     * Assembles the RTF of the given document without writing it anywhere.
     * <p>
     * The open paragraph and footnote, if any, are closed first. Concatenating the returned fragments yields the
     * whole document. Assembling a document again without authoring anything in between yields the same fragments.
     */
    public static List<String> assemble(final Document document, final LocalDateTime creationTime) {
        try (final var trace = new Trace(() -> "Serializing document \"" + document.title() + '"')) {
            trace.use();
            document.closeParagraph();
            final var serializer = new Serializer(document);
            serializer.emitHeader();
            serializer.emitInfo(creationTime);
            serializer.emitFormatting();
            serializer.emit(document.bodyMarkup());
            serializer.emit("\\par }");
            return serializer.lines;
        }
    }

    private void emitHeader() {
        final var template = document.template();
        final var fonts = template.fonts();
        // The first font is the default one; a template without fonts declares none.
        emit(fonts.isEmpty() ? "{\\rtf1\\ansi" : "{\\rtf1\\ansi\\deff" + Identifiers.number(fonts.get(0).id()));
        emit("\\deflang" + document.defaultLanguage() + "\\adeflang" + document.asianDefaultLanguage() + '\n');

        emit("{\\fonttbl\n");
        fonts.forEach(font -> emit(font.tableEntry()));
        emit("}\n");

        // Entry 0 is left empty: it stands for the reader's default color.
        emit("{\\colortbl\n");
        emit(";\n");
        template.colors().forEach(color -> emit(color.tableEntry()));
        emit("}\n");

        emit("{\\stylesheet\n");
        template.styles().forEach(style -> emit(style.tableEntry()));
        emit("}\n");

        emit("{\\*\\generator " + generatorName + "}\n");
    }

    private void emitInfo(final LocalDateTime creationTime) {
        emit("{\\info\n");
        emit("{\\title ");
        emit(RtfEncoder.encode(document.title()));
        emit("}\n");
        emit("{\\author ");
        emit(RtfEncoder.encode(document.author()));
        emit("}\n");
        emit(String.format(
            Locale.ROOT,
            "{\\creatim\\yr%04d\\mo%02d\\dy%02d\\hr%02d\\min%02d}\n",
            creationTime.getYear(),
            creationTime.getMonthValue(),
            creationTime.getDayOfMonth(),
            creationTime.getHour(),
            creationTime.getMinute()
        ));
        emit("}\n");
    }

    private void emitFormatting() {
        emit(document.layout().markup());
        emit(document.footnoteOptions().markup());
    }

    private void emit(final String fragment) {
        lines.add(fragment);
    }

    /**
     * The name this program identifies itself with in the generator tag.
     * <p>
     * The version part must match the project version in {@code pom.xml}.
     */
    public static final String generatorName = "scrivener_0.1.0";

    private final Document document;
    private final ArrayList<String> lines = new ArrayList<>();
}
