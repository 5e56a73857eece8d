package com.switchyard.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process delivery of queue job lifecycle events.
 * <p>
 * Job watchers see the events of one job and are dropped once that job reaches a
 * terminal event (completed, failed or removed), so a caller that forgets to
 * unsubscribe does not leak. Global listeners see every event until they unsubscribe.
 * A listener that throws is logged and skipped; publishing never fails.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<String, List<Consumer<RouterEvent>>> watchers = new ConcurrentHashMap<>();
    private final List<Consumer<RouterEvent>> listeners = new CopyOnWriteArrayList<>();

    public void publish(RouterEvent event) {
        log.debug("{} {} ({})", event.eventType(), event.jobId(), event.tool());

        List<Consumer<RouterEvent>> jobWatchers = event.isTerminal()
                ? watchers.remove(event.jobId())
                : watchers.get(event.jobId());
        if (jobWatchers != null) {
            jobWatchers.forEach(w -> deliver(w, event));
        }
        listeners.forEach(l -> deliver(l, event));
    }

    /**
     * Watches one job until its terminal event.
     *
     * @return a handle to stop watching early
     */
    public Subscription subscribe(String jobId, Consumer<RouterEvent> consumer) {
        watchers.computeIfAbsent(jobId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> watchers.computeIfPresent(jobId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    public Subscription subscribeAll(Consumer<RouterEvent> consumer) {
        listeners.add(consumer);
        return () -> listeners.remove(consumer);
    }

    /** Number of live watchers for a job. */
    public int watcherCount(String jobId) {
        List<Consumer<RouterEvent>> jobWatchers = watchers.get(jobId);
        return jobWatchers == null ? 0 : jobWatchers.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static void deliver(Consumer<RouterEvent> consumer, RouterEvent event) {
        try {
            consumer.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} for job {}: {}", event.eventType(), event.jobId(), e.getMessage(), e);
        }
    }
}
