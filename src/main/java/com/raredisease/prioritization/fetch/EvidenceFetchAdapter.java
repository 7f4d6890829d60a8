package com.raredisease.prioritization.fetch;

import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.EvidenceRecord;

import java.util.List;

/**
 * Boundary to the external evidence sources (registry clients, scrapers, web-search
 * agents). Implementations return already-typed records; the core never parses
 * third-party payloads.
 *
 * <p>Contract:</p>
 * <ul>
 *   <li>a non-empty list is a successful fetch with evidence;</li>
 *   <li>an empty list is a successful fetch that found nothing;</li>
 *   <li>{@link EvidenceFetchException} signals a failure worth retrying.</li>
 * </ul>
 *
 * <p>Calls may block on network I/O for a long time. Callers bound them with the
 * configured fetch timeout; an implementation should react to thread interruption
 * so a timed-out call can be abandoned.</p>
 */
@FunctionalInterface
public interface EvidenceFetchAdapter {

    List<EvidenceRecord> fetch(String entityId, Criterion criterion);
}
