package com.raredisease.prioritization.export;

/**
 * Result of an export.
 *
 * @param format        format written, e.g. "csv"
 * @param totalEntities number of diseases written
 */
public record ExportResult(String format, long totalEntities) {

    @Override
    public String toString() {
        return "ExportResult{format=" + format + ", entities=" + totalEntities + '}';
    }
}
