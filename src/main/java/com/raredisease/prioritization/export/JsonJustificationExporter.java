package com.raredisease.prioritization.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;

/**
 * Per-disease justification records as a JSON array, in rank order.
 */
public class JsonJustificationExporter implements PriorityExporter {
    private static final Logger log = LoggerFactory.getLogger(JsonJustificationExporter.class);

    private final ObjectMapper objectMapper;

    public JsonJustificationExporter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public JsonJustificationExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ExportResult export(List<EntityJustification> ranked, Writer writer) {
        try {
            writer.write(objectMapper.writeValueAsString(ranked));
            writer.flush();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize justifications: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("JSON export failed", e);
        }
        ExportResult result = new ExportResult(getFormat(), ranked.size());
        log.info("export.completed result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "json";
    }
}
