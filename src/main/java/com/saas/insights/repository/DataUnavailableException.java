package com.saas.insights.repository;

/**
 * Every read stage for an operation failed; the backing store could not answer.
 */
public class DataUnavailableException extends RuntimeException {

    private final String operation;

    public DataUnavailableException(String operation, Throwable cause) {
        super("Data unavailable for " + operation, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
