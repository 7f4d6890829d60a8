package com.raredisease.prioritization.export;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes ranked diseases in one output format.
 */
public interface PriorityExporter {

    /**
     * Writes the justifications, in the order given, to the writer. The writer is
     * flushed but not closed.
     *
     * @throws UncheckedIOException if writing fails
     */
    ExportResult export(List<EntityJustification> ranked, Writer writer);

    default ExportResult export(List<EntityJustification> ranked, Path path) {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            return export(ranked, writer);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + getFormat() + " export to " + path, e);
        }
    }

    /**
     * Format produced by this exporter, e.g. "csv" or "json".
     */
    String getFormat();
}
