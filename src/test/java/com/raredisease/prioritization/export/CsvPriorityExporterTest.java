package com.raredisease.prioritization.export;

import com.raredisease.prioritization.core.model.Criterion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvPriorityExporterTest {

    private final CsvPriorityExporter exporter =
            new CsvPriorityExporter(List.of(Criterion.PREVALENCE, Criterion.THERAPIES));

    @Test
    @DisplayName("Writes header and one row per disease in rank order")
    void writesTable() {
        StringWriter out = new StringWriter();

        ExportResult result = exporter.export(ExportFixtures.ranking(), out);

        assertEquals(List.of(
                "rank,entity_id,name,prevalence,therapies,final_score",
                "1,ORPHA:558,Marfan syndrome,5.0000,10.0000,7.5000",
                "2,ORPHA:79,\"Phenylketonuria, classic\",,2.0000,0.5000"), out.toString().lines().toList());
        assertEquals(new ExportResult("csv", 2), result);
    }

    @Test
    @DisplayName("Escapes quotes and separators")
    void escaping() {
        assertEquals("plain", CsvPriorityExporter.csvEscape("plain"));
        assertEquals("\"a, b\"", CsvPriorityExporter.csvEscape("a, b"));
        assertEquals("\"say \"\"hi\"\"\"", CsvPriorityExporter.csvEscape("say \"hi\""));
        assertEquals("", CsvPriorityExporter.csvEscape(null));
    }

    @Test
    @DisplayName("Writes to a file")
    void writesFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("ranking.csv");

        exporter.export(ExportFixtures.ranking(), file);

        assertEquals(3, Files.readAllLines(file, StandardCharsets.UTF_8).size());
    }

    @Test
    @DisplayName("Write failures surface as UncheckedIOException")
    void writeFailure() {
        Writer broken = new Writer() {
            @Override
            public void write(char[] buffer, int off, int len) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };

        assertThrows(UncheckedIOException.class, () -> exporter.export(ExportFixtures.ranking(), broken));
    }
}
