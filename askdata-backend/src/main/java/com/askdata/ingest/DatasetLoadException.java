package com.askdata.ingest;

/**
 * Thrown when an uploaded or configured file cannot be turned into a dataset.
 */
public class DatasetLoadException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public DatasetLoadException(String message) {
        super(message);
    }

    /**
     * Create a new exception with a cause.
     *
     * @param message error message
     * @param cause underlying error
     */
    public DatasetLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
