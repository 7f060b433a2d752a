package com.askdata.job;

/**
 * Thrown when a job id is unknown to the session.
 */
public class JobNotFoundException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public JobNotFoundException(String message) {
        super(message);
    }
}
