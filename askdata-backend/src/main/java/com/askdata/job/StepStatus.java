package com.askdata.job;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of one pipeline step: {@code pending -> running -> completed | error}, or
 * {@code pending -> skipped}.
 */
public enum StepStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    ERROR,
    SKIPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR || this == SKIPPED;
    }

    public boolean canTransitionTo(StepStatus next) {
        switch (this) {
            case PENDING:
                return next == RUNNING || next == SKIPPED;
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
