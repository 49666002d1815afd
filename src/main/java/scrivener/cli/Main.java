// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.cli;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.LocalDateTime;
import scrivener.rtf.Document;
import scrivener.rtf.DocumentFiles;
import scrivener.rtf.DocumentOptions;
import scrivener.rtf.StandardTemplate;
import scrivener.util.condition.ConditionContext;
import scrivener.util.condition.Handler;

/**
 * Writes a sample document showing off paragraphs, inline formatting and footnotes.
 * <p>
 * Usage: {@code scrivener <output directory>}.
 */
public final class Main {
    private Main() {
    }

    @SuppressWarnings("UseOfSystemOutOrSystemErr")
    public static void main(final String[] args) {
        System.exit(run(args, System.err));
    }

    /**
     * Runs the program with the given arguments, reporting to the given stream.
     *
     * @return The process exit code.
     */
    public static int run(final String[] args, final PrintStream err) {
        if (args.length != 1) {
            err.println("Exactly one argument <output directory> expected");
            return ExitCode.USAGE.value;
        }
        final var outputDirectory = Path.of(args[0]);
        try (final var handler = new Handler(new FallbackHandler(err))) {
            handler.use();
            final var exitCode = ConditionContext.withRestart("abort-process", restart -> {
                final var path = DocumentFiles.write(createSample(), outputDirectory, LocalDateTime.now());
                err.println("Wrote " + path);
                return ExitCode.SUCCESS;
            });
            return ((exitCode != null) ? exitCode : ExitCode.ERROR).value;
        }
    }

    static Document createSample() {
        final var options = DocumentOptions.builder()
            .title("My Document Title")
            .author("Myself")
            .verbose(true)
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
        return document;
    }

    private enum ExitCode {
        SUCCESS(0),
        ERROR(1),
        USAGE(64);

        ExitCode(final int value) {
            this.value = value;
        }

        private final int value;
    }
}
