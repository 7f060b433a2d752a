package com.askdata.job;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of an analysis job: {@code pending -> running -> completed | error}.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    ERROR;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }

    public boolean canTransitionTo(JobStatus next) {
        switch (this) {
            case PENDING:
                return next == RUNNING || next == ERROR;
            case RUNNING:
                return next == COMPLETED || next == ERROR;
            default:
                return false;
        }
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
