package com.querybim.classify.service;

/**
 * The inbound batch is malformed; raised before any external call is made.
 */
public class InvalidBatchRequestException extends RuntimeException {
    private final String error;
    private final String details;

    public InvalidBatchRequestException(String error) {
        this(error, null);
    }

    public InvalidBatchRequestException(String error, String details) {
        super(details == null ? error : error + ": " + details);
        this.error = error;
        this.details = details;
    }

    public String getError() {
        return error;
    }

    public String getDetails() {
        return details;
    }
}
