package com.switchyard.core.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached tool result.
 *
 * @param fingerprint  cache key
 * @param payload      opaque result
 * @param storedAt     when the result was cached
 * @param ttl          freshness window
 * @param sizeEstimate approximate footprint in bytes
 */
public record CacheEntry(
    String fingerprint,
    Object payload,
    Instant storedAt,
    Duration ttl,
    long sizeEstimate
) {

    /** Fresh while {@code now - storedAt <= ttl}. */
    public boolean isFresh(Instant now) {
        return !now.isAfter(storedAt.plus(ttl));
    }
}
