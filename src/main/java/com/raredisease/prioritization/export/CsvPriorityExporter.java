package com.raredisease.prioritization.export;

import com.raredisease.prioritization.core.model.Criterion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Ranked table in CSV, one row per disease, one column per criterion.
 *
 * <pre>
 * rank,entity_id,name,prevalence,therapies,final_score
 * 1,ORPHA:558,Marfan syndrome,5.0000,10.0000,7.5000
 * </pre>
 *
 * A criterion without a score leaves its cell empty.
 */
public class CsvPriorityExporter implements PriorityExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvPriorityExporter.class);

    private final List<Criterion> columns;

    public CsvPriorityExporter(List<Criterion> columns) {
        this.columns = List.copyOf(columns);
    }

    @Override
    public ExportResult export(List<EntityJustification> ranked, Writer writer) {
        try {
            List<String> header = new ArrayList<>(List.of("rank", "entity_id", "name"));
            columns.forEach(c -> header.add(c.key()));
            header.add("final_score");
            writer.write(String.join(",", header));
            writer.write('\n');

            for (EntityJustification entity : ranked) {
                List<String> row = new ArrayList<>();
                row.add(String.valueOf(entity.rank()));
                row.add(csvEscape(entity.entityId()));
                row.add(csvEscape(entity.name()));
                for (Criterion criterion : columns) {
                    Optional<CriterionJustification> justification = entity.criterion(criterion.key());
                    row.add(justification.filter(CriterionJustification::hasScore)
                            .map(j -> number(j.normalizedScore()))
                            .orElse(""));
                }
                row.add(number(entity.finalScore()));
                writer.write(String.join(",", row));
                writer.write('\n');
            }
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("CSV export failed", e);
        }
        ExportResult result = new ExportResult(getFormat(), ranked.size());
        log.info("export.completed result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    private static String number(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
