package com.askdata.history;

/**
 * Thrown when a history entry id is unknown to the session.
 */
public class HistoryEntryNotFoundException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public HistoryEntryNotFoundException(String message) {
        super(message);
    }
}
