package com.raredisease.prioritization.fetch;

/**
 * Raised by a fetch adapter when evidence could not be obtained: network errors,
 * unparseable payloads, upstream rate limiting. An empty result is not an error
 * and must be returned as an empty list instead.
 */
public class EvidenceFetchException extends RuntimeException {

    public EvidenceFetchException(String message) {
        super(message);
    }

    public EvidenceFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
