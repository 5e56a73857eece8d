package com.switchyard.core.model;

import java.time.Duration;

/**
 * Immutable registration of a tool, created once at startup.
 *
 * @param name         unique tool name
 * @param tier         complexity tier
 * @param localTimeout deadline for local execution; {@code null} when the tier has none
 * @param cacheTtl     how long a successful result stays fresh
 * @param priority     queue priority for deferred invocations (higher runs first)
 */
public record ToolDescriptor(
    String name,
    Tier tier,
    Duration localTimeout,
    Duration cacheTtl,
    int priority
) {

    public boolean hasLocalTimeout() {
        return localTimeout != null && !localTimeout.isZero() && !localTimeout.isNegative();
    }
}
