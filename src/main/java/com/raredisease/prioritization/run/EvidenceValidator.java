package com.raredisease.prioritization.run;

import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.EvidenceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Drops malformed records from a fetched batch before it is persisted.
 *
 * <p>A record is malformed when it is null, has no source, has no value, or
 * carries a raw amount that is not a finite non-negative number.</p>
 */
public class EvidenceValidator {
    private static final Logger log = LoggerFactory.getLogger(EvidenceValidator.class);

    public Result validate(String entityId, Criterion criterion, List<EvidenceRecord> batch) {
        List<EvidenceRecord> valid = new ArrayList<>(batch.size());
        int dropped = 0;
        for (EvidenceRecord record : batch) {
            Optional<String> problem = problem(record);
            if (problem.isPresent()) {
                dropped++;
                log.warn("evidence.dropped entityId={} criterion={} reason={} record={}",
                        entityId, criterion.key(), problem.get(), record);
            } else {
                valid.add(record);
            }
        }
        return new Result(valid, dropped);
    }

    /**
     * Why a record is malformed, or empty if it is well formed.
     */
    Optional<String> problem(EvidenceRecord record) {
        if (record == null) {
            return Optional.of("null record");
        }
        if (record.getSource() == null || record.getSource().isBlank()) {
            return Optional.of("missing source");
        }
        if (record.getValue() == null || record.getValue().isBlank()) {
            return Optional.of("missing value");
        }
        if (record.getAmount().isPresent()) {
            double amount = record.getAmount().getAsDouble();
            if (!Double.isFinite(amount) || amount < 0.0) {
                return Optional.of("invalid amount " + amount);
            }
        }
        return Optional.empty();
    }

    /**
     * Outcome of validating one batch.
     *
     * @param valid   well-formed records, in batch order
     * @param dropped number of malformed records removed
     */
    public record Result(List<EvidenceRecord> valid, int dropped) {
        public Result {
            valid = List.copyOf(valid);
        }

        public boolean allMalformed() {
            return valid.isEmpty() && dropped > 0;
        }
    }
}
