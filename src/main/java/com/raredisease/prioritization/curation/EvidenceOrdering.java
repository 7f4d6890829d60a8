package com.raredisease.prioritization.curation;

import com.raredisease.prioritization.core.model.EvidenceRecord;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Deterministic "best record first" ordering: highest reliability, then most recent
 * observation (undated records last), then source name.
 */
public final class EvidenceOrdering {

    public static final Comparator<EvidenceRecord> BEST_FIRST =
            Comparator.comparingDouble(EvidenceRecord::getReliabilityScore).reversed()
                    .thenComparing(EvidenceRecord::getObservedAt,
                            Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
                    .thenComparing(EvidenceRecord::getSource);

    private EvidenceOrdering() {
    }

    public static Optional<EvidenceRecord> best(Collection<EvidenceRecord> records) {
        return records.stream().min(BEST_FIRST);
    }
}
