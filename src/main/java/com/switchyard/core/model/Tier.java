package com.switchyard.core.model;

import java.util.Locale;

/**
 * Complexity classification of a tool. Drives timeout, cache TTL,
 * execution strategy and queue priority.
 */
public enum Tier {
    /** Always local, no tier deadline. */
    SIMPLE(10),
    /** Local with a deadline, remote fallback, queue as last resort. */
    MEDIUM(5),
    /** Remote only; queued while offline. */
    COMPLEX(1);

    private final int defaultPriority;

    Tier(int defaultPriority) {
        this.defaultPriority = defaultPriority;
    }

    public int defaultPriority() {
        return defaultPriority;
    }

    /** Lower-case key used in configuration and API responses. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a tier name case-insensitively.
     *
     * @throws IllegalArgumentException if the name is not a known tier
     */
    public static Tier fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Tier must not be blank");
        }
        return Tier.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
