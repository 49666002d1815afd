// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import scrivener.util.Trace;
import scrivener.util.condition.ConditionContext;
import scrivener.util.condition.exception.IOExceptionCondition;

/**
 * Saving documents to RTF files.
 */
public final class DocumentFiles {
    private DocumentFiles() {
    }

    /**
     * Serializes the given document into {@code <filename>.rtf} in the given directory, using the document's own file
     * name.
     *
     * @return The path of the written file.
     * @see #write(Document, Path, String, LocalDateTime)
     */
    public static Path write(final Document document, final Path directory, final LocalDateTime creationTime) {
        return write(document, directory, document.filename(), creationTime);
    }

    /**
     * Serializes the given document into {@code <filename>.rtf} in the given directory, replacing any existing file.
     * <p>
     * I/O errors are signaled as fatal {@link IOExceptionCondition}s.
     *
     * @return The path of the written file.
     */
    public static Path write(
        final Document document,
        final Path directory,
        final String filename,
        final LocalDateTime creationTime
    ) {
        final var path = directory.resolve(filename + extension);
        try (final var trace = new Trace(() -> "Saving RTF to " + path)) {
            trace.use();
            // The output is pure ASCII after escaping.
            try (final var writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                Serializer.serialize(writer, document, creationTime);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
        }
        return path;
    }

    /**
     * The extension of RTF files, including the dot.
     */
    public static final String extension = ".rtf";
}
