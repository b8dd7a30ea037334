package com.sprintreport.infrastructure.upstream;

/**
 * The issue tracker or source control host failed or timed out.
 */
public class UpstreamFetchException extends RuntimeException {

    private final String operation;

    public UpstreamFetchException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public UpstreamFetchException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
