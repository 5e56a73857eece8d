package com.switchyard.core.cache;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory result cache keyed by request fingerprint.
 * <p>
 * Entries carry their own TTL; a stale entry is reported as a miss even while it
 * is still physically present. When an insert pushes the cache past its entry or
 * byte budget, expired entries are dropped first and then the least recently used
 * fresh entries until the cache is back under budget. A background sweep also
 * reclaims expired entries periodically.
 * <p>
 * All operations hold a single lock for the duration of an in-memory map update only.
 */
@Service
public class ResultCache {

    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    /** Access-ordered: iteration starts at the least recently used entry. */
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>(64, 0.75f, true);
    private final ReentrantLock lock = new ReentrantLock();
    private final CacheProperties properties;
    private final Clock clock;
    private long totalBytes;

    private ScheduledExecutorService sweeper;

    public ResultCache(CacheProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    void startSweeper() {
        long interval = properties.getSweepIntervalSeconds();
        if (interval <= 0) {
            log.info("Cache sweep disabled");
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cache-sweeper");
            t.setDaemon(true);
            return t;
        });
        sweeper.scheduleAtFixedRate(this::sweepQuietly, interval, interval, TimeUnit.SECONDS);
        log.info("Cache sweep scheduled every {}s (maxEntries={}, maxBytes={})",
                interval, properties.getMaxEntries(), properties.getMaxBytes());
    }

    @PreDestroy
    void stopSweeper() {
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
    }

    public Optional<CacheEntry> get(String fingerprint) {
        lock.lock();
        try {
            CacheEntry entry = entries.get(fingerprint);
            if (entry == null) {
                return Optional.empty();
            }
            if (!entry.isFresh(clock.instant())) {
                log.debug("Cache entry {} is stale", fingerprint);
                return Optional.empty();
            }
            return Optional.of(entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Inserts or overwrites an entry, then evicts until the cache is within budget.
     *
     * @return {@code false} when the payload alone exceeds the byte budget and was not stored
     */
    public boolean put(String fingerprint, Object payload, Duration ttl) {
        long size = Fingerprints.estimateSize(payload);
        if (size > properties.getMaxBytes()) {
            log.warn("Result for {} is {} bytes, larger than the cache budget of {} bytes; not cached",
                    fingerprint, size, properties.getMaxBytes());
            return false;
        }
        Instant now = clock.instant();
        lock.lock();
        try {
            CacheEntry previous = entries.remove(fingerprint);
            if (previous != null) {
                totalBytes -= previous.sizeEstimate();
            }
            entries.put(fingerprint, new CacheEntry(fingerprint, payload, now, ttl, size));
            totalBytes += size;
            if (overBudget()) {
                removeExpired(now);
                evictLeastRecentlyUsed();
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean invalidate(String fingerprint) {
        lock.lock();
        try {
            CacheEntry removed = entries.remove(fingerprint);
            if (removed == null) {
                return false;
            }
            totalBytes -= removed.sizeEstimate();
            log.debug("Invalidated cache entry {}", fingerprint);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean invalidate(String tool, Map<String, Object> parameters) {
        return invalidate(Fingerprints.of(tool, parameters));
    }

    /**
     * Removes all expired entries.
     *
     * @return number of entries removed
     */
    public int sweepExpired() {
        lock.lock();
        try {
            return removeExpired(clock.instant());
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
            totalBytes = 0;
        } finally {
            lock.unlock();
        }
        log.info("Cache cleared");
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public long totalBytes() {
        lock.lock();
        try {
            return totalBytes;
        } finally {
            lock.unlock();
        }
    }

    private boolean overBudget() {
        return entries.size() > properties.getMaxEntries() || totalBytes > properties.getMaxBytes();
    }

    private int removeExpired(Instant now) {
        int removed = 0;
        Iterator<CacheEntry> it = entries.values().iterator();
        while (it.hasNext()) {
            CacheEntry entry = it.next();
            if (!entry.isFresh(now)) {
                it.remove();
                totalBytes -= entry.sizeEstimate();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Removed {} expired cache entries", removed);
        }
        return removed;
    }

    private void evictLeastRecentlyUsed() {
        Iterator<CacheEntry> it = entries.values().iterator();
        while (overBudget() && it.hasNext()) {
            CacheEntry eldest = it.next();
            it.remove();
            totalBytes -= eldest.sizeEstimate();
            log.debug("Evicted least recently used cache entry {}", eldest.fingerprint());
        }
    }

    private void sweepQuietly() {
        try {
            int removed = sweepExpired();
            if (removed > 0) {
                log.info("Cache sweep removed {} expired entries", removed);
            }
        } catch (RuntimeException e) {
            log.warn("Cache sweep failed: {}", e.getMessage(), e);
        }
    }
}
