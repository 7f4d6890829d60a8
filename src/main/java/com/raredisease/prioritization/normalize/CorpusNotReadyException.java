package com.raredisease.prioritization.normalize;

/**
 * Thrown when normalization is attempted before the corpus statistics it depends
 * on were computed, or for a disease outside the corpus they were computed for.
 */
public class CorpusNotReadyException extends IllegalStateException {

    public CorpusNotReadyException(String message) {
        super(message);
    }
}
