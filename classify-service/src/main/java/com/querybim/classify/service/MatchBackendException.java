package com.querybim.classify.service;

/**
 * The similarity-search backend call failed; no query of the batch can be reconciled.
 */
public class MatchBackendException extends RuntimeException {
    public MatchBackendException(String message) {
        super(message);
    }

    public MatchBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
