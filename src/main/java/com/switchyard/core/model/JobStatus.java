package com.switchyard.core.model;

import java.util.Locale;

/**
 * Lifecycle of a queued job. Transitions only move forward:
 * {@code QUEUED -> PROCESSING -> COMPLETED | QUEUED (retry) | FAILED}.
 * Operators may move a {@code FAILED} job back to {@code QUEUED}.
 */
public enum JobStatus {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isActive() {
        return this == QUEUED || this == PROCESSING;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobStatus fromString(String value) {
        return JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
