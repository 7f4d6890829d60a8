package com.raredisease.prioritization.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One attempt to fetch evidence for a (disease, criterion) key.
 * Written once by the run manager and never modified or deleted.
 *
 * @param entityId        the disease id
 * @param criterion       the criterion fetched
 * @param runNumber       1-based, contiguous per key
 * @param status          outcome of the attempt
 * @param evidence        scored evidence; empty unless {@link RunStatus#SUCCESS_NONEMPTY}
 * @param error           failure description; null unless {@link RunStatus#FAILED}
 * @param droppedRecords  number of malformed records discarded from the batch
 * @param timestamp       when the attempt finished
 */
public record RunRecord(
        String entityId,
        Criterion criterion,
        int runNumber,
        RunStatus status,
        List<EvidenceRecord> evidence,
        String error,
        int droppedRecords,
        Instant timestamp
) {
    public RunRecord {
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(criterion, "criterion is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        if (runNumber < 1) {
            throw new IllegalArgumentException("runNumber must be >= 1, got " + runNumber);
        }
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
        if (status == RunStatus.SUCCESS_NONEMPTY && evidence.isEmpty()) {
            throw new IllegalArgumentException("SUCCESS_NONEMPTY run must carry evidence");
        }
        if (status != RunStatus.SUCCESS_NONEMPTY && !evidence.isEmpty()) {
            throw new IllegalArgumentException(status + " run must not carry evidence");
        }
    }

    public static RunRecord nonEmpty(String entityId, Criterion criterion, int runNumber,
                                     List<EvidenceRecord> evidence, int droppedRecords, Instant timestamp) {
        return new RunRecord(entityId, criterion, runNumber, RunStatus.SUCCESS_NONEMPTY,
                evidence, null, droppedRecords, timestamp);
    }

    public static RunRecord empty(String entityId, Criterion criterion, int runNumber, Instant timestamp) {
        return new RunRecord(entityId, criterion, runNumber, RunStatus.SUCCESS_EMPTY,
                List.of(), null, 0, timestamp);
    }

    public static RunRecord failed(String entityId, Criterion criterion, int runNumber,
                                   String error, int droppedRecords, Instant timestamp) {
        return new RunRecord(entityId, criterion, runNumber, RunStatus.FAILED,
                List.of(), error, droppedRecords, timestamp);
    }

    public boolean isSuccessful() {
        return status == RunStatus.SUCCESS_NONEMPTY;
    }

    @Override
    public String toString() {
        return "RunRecord{" +
                "entityId='" + entityId + '\'' +
                ", criterion=" + criterion +
                ", run=" + runNumber +
                ", status=" + status +
                ", evidence=" + evidence.size() +
                (error != null ? ", error='" + error + '\'' : "") +
                '}';
    }
}
