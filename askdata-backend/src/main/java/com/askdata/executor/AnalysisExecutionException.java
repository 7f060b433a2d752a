package com.askdata.executor;

/**
 * Thrown when a plan cannot run against the dataset: no rows, a stale plan or a missing column.
 *
 * <p>The message is shown to the user verbatim.
 */
public class AnalysisExecutionException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public AnalysisExecutionException(String message) {
        super(message);
    }
}
