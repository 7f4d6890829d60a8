package com.raredisease.prioritization.core.model;

/**
 * Kind of source backing an evidence record.
 */
public enum SourceType {
    /** Peer-reviewed or primary literature (e.g. a PMID reference). */
    PEER_REVIEWED,
    /** Expert opinion only. */
    EXPERT_OPINION,
    NONE
}
