package com.askdata.service;

/**
 * Thrown when a session id is unknown or the session has expired.
 */
public class SessionNotFoundException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public SessionNotFoundException(String message) {
        super(message);
    }
}
