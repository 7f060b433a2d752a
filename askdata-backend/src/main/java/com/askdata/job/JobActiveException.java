package com.askdata.job;

/**
 * Thrown when a session already has a pending or running job.
 */
public class JobActiveException extends RuntimeException {
    private final String activeJobId;

    /**
     * Create a new exception.
     *
     * @param message error message
     * @param activeJobId id of the job still in progress
     */
    public JobActiveException(String message, String activeJobId) {
        super(message);
        this.activeJobId = activeJobId;
    }

    public String getActiveJobId() {
        return activeJobId;
    }
}
