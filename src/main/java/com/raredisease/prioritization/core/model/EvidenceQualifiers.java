package com.raredisease.prioritization.core.model;

/**
 * Quality attributes of an evidence record. These, and only these, drive the
 * reliability score.
 *
 * @param validationStatus  validation status at the source registry
 * @param sourceType        kind of source behind the figure
 * @param qualification     whether a value accompanies the class
 * @param measurementType   how the figure was measured
 * @param geographicArea    country or region the figure applies to; blank or
 *                          {@value #WORLDWIDE} means global
 */
public record EvidenceQualifiers(
        ValidationStatus validationStatus,
        SourceType sourceType,
        DataQualification qualification,
        MeasurementType measurementType,
        String geographicArea
) {
    public static final String WORLDWIDE = "Worldwide";

    public EvidenceQualifiers {
        validationStatus = validationStatus != null ? validationStatus : ValidationStatus.UNKNOWN;
        sourceType = sourceType != null ? sourceType : SourceType.NONE;
        qualification = qualification != null ? qualification : DataQualification.NONE;
        measurementType = measurementType != null ? measurementType : MeasurementType.UNSPECIFIED;
        geographicArea = geographicArea != null ? geographicArea.trim() : "";
    }

    /**
     * Qualifiers with every attribute unknown.
     */
    public static EvidenceQualifiers unspecified() {
        return new EvidenceQualifiers(null, null, null, null, null);
    }

    public boolean isGlobal() {
        return geographicArea.isEmpty() || WORLDWIDE.equalsIgnoreCase(geographicArea);
    }

    public EvidenceQualifiers withGeographicArea(String area) {
        return new EvidenceQualifiers(validationStatus, sourceType, qualification, measurementType, area);
    }

    public EvidenceQualifiers withMeasurementType(MeasurementType type) {
        return new EvidenceQualifiers(validationStatus, sourceType, qualification, type, geographicArea);
    }
}
