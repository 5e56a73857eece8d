package com.switchyard.core.model;

import java.util.Locale;

/**
 * Where an invocation was served from.
 */
public enum Route {
    LOCAL,
    REMOTE,
    CACHE,
    QUEUE;

    /** Lower-case key used in metrics tags and exports. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
