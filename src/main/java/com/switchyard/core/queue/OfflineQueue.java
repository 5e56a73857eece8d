package com.switchyard.core.queue;

import com.switchyard.core.connectivity.ConnectivityMonitor;
import com.switchyard.core.events.EventBus;
import com.switchyard.core.events.RouterEvent;
import com.switchyard.core.logging.MdcContext;
import com.switchyard.core.metrics.PerformanceMonitor;
import com.switchyard.core.metrics.SwitchyardMetrics;
import com.switchyard.core.model.ErrorKind;
import com.switchyard.core.model.InvocationRequest;
import com.switchyard.core.model.JobStatus;
import com.switchyard.core.model.QueueStatus;
import com.switchyard.core.model.QueuedJob;
import com.switchyard.core.model.RouterException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable, priority-ordered queue of deferred invocations.
 * <p>
 * Jobs are drained by {@link #drain()}, which runs periodically, on demand and whenever
 * connectivity comes back. Only one drain pass runs at a time; a pass started while another
 * is active returns immediately. Due jobs are processed in {@code (priority DESC, createdAt ASC)}
 * order, at most {@code workers} at a time.
 * <p>
 * A failed attempt is retried after {@code base * 2^attempts} (capped) until {@code maxAttempts}
 * is reached, at which point the job is marked {@link JobStatus#FAILED} and stays there until an
 * operator retries or clears it. An attempt that cannot reach the backend puts the job back
 * without consuming an attempt and ends the pass.
 * <p>
 * Job records are only written here. Each state transition is a single store upsert under a
 * short lock that is never held while a job runs.
 */
@Service
public class OfflineQueue {

    private static final Logger log = LoggerFactory.getLogger(OfflineQueue.class);

    private static final Comparator<QueuedJob> DRAIN_ORDER =
            Comparator.comparingInt(QueuedJob::priority).reversed()
                    .thenComparing(QueuedJob::createdAt)
                    .thenComparing(QueuedJob::id);

    private final JobStore store;
    private final QueueProperties properties;
    private final ConnectivityMonitor connectivity;
    private final PerformanceMonitor monitor;
    private final SwitchyardMetrics metrics;
    private final EventBus eventBus;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private volatile Instant lastSyncAttempt;
    private volatile Instant lastSuccessfulSync;

    private volatile JobHandler handler;
    private ConnectivityMonitor.Subscription connectivitySubscription;

    public OfflineQueue(JobStore store, QueueProperties properties, ConnectivityMonitor connectivity,
                        PerformanceMonitor monitor, SwitchyardMetrics metrics, EventBus eventBus,
                        Clock clock) {
        this.store = store;
        this.properties = properties;
        this.connectivity = connectivity;
        this.monitor = monitor;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.clock = clock;

        var workerCount = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(1, properties.getWorkers()), r -> {
            Thread t = new Thread(r, "queue-worker-" + workerCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "queue-sync");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Sets the component that runs job attempts. Until a handler is registered,
     * drain passes are skipped.
     */
    public void registerHandler(JobHandler handler) {
        this.handler = handler;
    }

    @PostConstruct
    public void start() {
        int recovered = recoverInterrupted();
        if (recovered > 0) {
            log.info("Recovered {} interrupted jobs back to queued", recovered);
        }
        connectivitySubscription = connectivity.addListener(online -> {
            if (online) {
                log.info("Connectivity restored, draining offline queue");
                requestDrain();
            }
        });
        long interval = properties.getSyncIntervalSeconds();
        if (interval > 0) {
            scheduler.scheduleWithFixedDelay(this::drainQuietly, interval, interval, TimeUnit.SECONDS);
        }
        refreshDepth();
        log.info("Offline queue started (store={}, workers={}, maxAttempts={}, syncInterval={}s, capacity={})",
                store.describe(), properties.getWorkers(), properties.getMaxAttempts(), interval,
                properties.getCapacity());
    }

    @PreDestroy
    public void stop() {
        if (connectivitySubscription != null) {
            connectivitySubscription.unsubscribe();
        }
        scheduler.shutdownNow();
        workers.shutdownNow();
        log.info("Offline queue stopped");
    }

    // ── Enqueue ──────────────────────────────────────────────────────────

    /**
     * Adds a job for the request, or returns the id of an equivalent job that is
     * already queued or processing.
     *
     * @throws QueueFullException if a new job would exceed the configured capacity
     */
    public String enqueue(InvocationRequest request, int priority) {
        QueuedJob job;
        lock.lock();
        try {
            Optional<QueuedJob> existing = store.findActiveByFingerprint(request.fingerprint());
            if (existing.isPresent()) {
                log.info("Request for {} already queued as job {}", request.tool(), existing.get().id());
                return existing.get().id();
            }
            Map<JobStatus, Integer> counts = store.countByStatus();
            int pending = counts.get(JobStatus.QUEUED) + counts.get(JobStatus.PROCESSING);
            if (pending >= properties.getCapacity()) {
                throw new QueueFullException(properties.getCapacity());
            }
            job = QueuedJob.create(UUID.randomUUID().toString(), request, priority,
                    properties.getMaxAttempts(), clock.instant());
            store.upsert(job);
        } finally {
            lock.unlock();
        }

        log.info("Queued job {} for {} (priority {})", job.id(), job.tool(), priority);
        metrics.recordQueueEvent("queued");
        publish(RouterEvent.JOB_QUEUED, job, Map.of("priority", priority));
        refreshDepth();
        return job.id();
    }

    // ── Drain ────────────────────────────────────────────────────────────

    /**
     * Schedules a drain pass on the sync thread and returns immediately.
     *
     * @return {@code false} if the queue has been stopped
     */
    public boolean requestDrain() {
        try {
            scheduler.execute(this::drainQuietly);
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Drain request rejected, queue is stopped");
            return false;
        }
    }

    /**
     * Runs one drain pass on the calling thread.
     *
     * @return number of jobs completed in this pass; {@code 0} if another pass was
     *         already running, the queue is offline or no handler is registered
     */
    public int drain() {
        JobHandler current = handler;
        if (current == null) {
            log.warn("No job handler registered; skipping drain");
            return 0;
        }
        if (!draining.compareAndSet(false, true)) {
            log.debug("Drain already in progress");
            return 0;
        }
        int completed = 0;
        try {
            lastSyncAttempt = clock.instant();
            if (!connectivity.isOnline()) {
                log.debug("Offline; skipping drain");
                return 0;
            }
            Instant now = clock.instant();
            List<QueuedJob> due = store.findByStatus(JobStatus.QUEUED).stream()
                    .filter(j -> j.isDue(now))
                    .sorted(DRAIN_ORDER)
                    .toList();
            if (due.isEmpty()) {
                return 0;
            }
            log.info("Draining {} due jobs", due.size());

            int batchSize = Math.max(1, properties.getWorkers());
            for (int i = 0; i < due.size(); i += batchSize) {
                if (!connectivity.isOnline()) {
                    log.info("Connectivity lost; stopping drain with {} jobs left", due.size() - i);
                    break;
                }
                List<QueuedJob> batch = due.subList(i, Math.min(i + batchSize, due.size()));
                List<AttemptResult> results = runBatch(current, batch);
                completed += (int) results.stream().filter(r -> r == AttemptResult.COMPLETED).count();
                if (results.contains(AttemptResult.UNREACHABLE)) {
                    log.warn("Backend unreachable; stopping drain");
                    break;
                }
            }
            if (completed > 0) {
                lastSuccessfulSync = clock.instant();
                monitor.recordSync(lastSuccessfulSync);
            }
            return completed;
        } finally {
            draining.set(false);
            refreshDepth();
        }
    }

    private List<AttemptResult> runBatch(JobHandler current, List<QueuedJob> batch) {
        if (batch.size() == 1) {
            return List.of(process(current, batch.get(0)));
        }
        List<Callable<AttemptResult>> tasks = new ArrayList<>();
        for (QueuedJob job : batch) {
            tasks.add(() -> process(current, job));
        }
        List<Future<AttemptResult>> futures;
        try {
            futures = workers.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of(AttemptResult.UNREACHABLE);
        }
        List<AttemptResult> results = new ArrayList<>();
        for (Future<AttemptResult> future : futures) {
            try {
                results.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                results.add(AttemptResult.UNREACHABLE);
            } catch (ExecutionException e) {
                log.error("Queue worker failed unexpectedly", e.getCause());
                results.add(AttemptResult.SKIPPED);
            }
        }
        return results;
    }

    AttemptResult process(JobHandler current, QueuedJob candidate) {
        QueuedJob started;
        lock.lock();
        try {
            Optional<QueuedJob> latest = store.findById(candidate.id());
            if (latest.isEmpty() || latest.get().status() != JobStatus.QUEUED) {
                return AttemptResult.SKIPPED;
            }
            started = latest.get().startAttempt(clock.instant());
            store.upsert(started);
        } finally {
            lock.unlock();
        }

        MdcContext.setJob(started.id(), started.tool(), started.fingerprint());
        AttemptResult outcome = null;
        try {
            publish(RouterEvent.JOB_STARTED, started, Map.of("attempt", started.attempts() + 1));
            log.info("Processing job {} (attempt {}/{})", started.id(), started.attempts() + 1,
                    started.maxAttempts());
            outcome = attempt(current, started);
            return outcome;
        } catch (JobStoreException e) {
            log.warn("Could not save outcome of job {}: {}", started.id(), e.getMessage());
            outcome = restore(started);
            return outcome;
        } finally {
            if (outcome == null) {
                // the handler threw an Error; never leave the job in PROCESSING
                restore(started);
            }
            MdcContext.clear();
        }
    }

    private AttemptResult attempt(JobHandler current, QueuedJob started) {
        Object result;
        try {
            result = current.handle(started);
        } catch (RouterException e) {
            if (e.kind() == ErrorKind.REMOTE_UNREACHABLE) {
                return release(started, e);
            }
            return recordFailure(started, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Job {} threw {}", started.id(), e.toString(), e);
            return recordFailure(started, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        return recordSuccess(started, result);
    }

    /**
     * Puts a job whose attempt could not be recorded back to {@code QUEUED} without
     * consuming an attempt, so the next drain runs it again.
     */
    private AttemptResult restore(QueuedJob started) {
        try {
            if (writeIfPresent(started.release(clock.instant()))) {
                log.warn("Job {} returned to queue after an unrecorded attempt", started.id());
            }
        } catch (RuntimeException e) {
            log.error("Job {} stays in processing until restart: {}", started.id(), e.getMessage(), e);
        }
        return AttemptResult.SKIPPED;
    }

    private AttemptResult recordSuccess(QueuedJob started, Object result) {
        QueuedJob done = started.complete(result, clock.instant());
        if (!writeIfPresent(done)) {
            return AttemptResult.SKIPPED;
        }
        processed.incrementAndGet();
        succeeded.incrementAndGet();
        metrics.recordQueueEvent("completed");
        publish(RouterEvent.JOB_COMPLETED, done, Map.of("attempts", done.attempts()));
        log.info("Job {} completed after {} attempts", done.id(), done.attempts());
        return AttemptResult.COMPLETED;
    }

    private AttemptResult recordFailure(QueuedJob started, String error) {
        Instant now = clock.instant();
        int attempts = started.attempts() + 1;
        processed.incrementAndGet();
        if (attempts >= started.maxAttempts()) {
            QueuedJob dead = started.fail(error, now);
            if (!writeIfPresent(dead)) {
                return AttemptResult.SKIPPED;
            }
            failed.incrementAndGet();
            metrics.recordQueueEvent("failed");
            var payload = new LinkedHashMap<String, Object>();
            payload.put("attempts", dead.attempts());
            payload.put("error", String.valueOf(error));
            payload.put("kind", ErrorKind.QUEUE_EXHAUSTED.name());
            publish(RouterEvent.JOB_FAILED, dead, payload);
            log.error("Job {} failed permanently after {} attempts: {}", dead.id(), dead.attempts(), error);
            return AttemptResult.FAILED;
        }

        Duration delay = backoff(attempts);
        QueuedJob retry = started.retryLater(error, now.plus(delay), now);
        if (!writeIfPresent(retry)) {
            return AttemptResult.SKIPPED;
        }
        metrics.recordQueueEvent("retried");
        var payload = new LinkedHashMap<String, Object>();
        payload.put("attempts", retry.attempts());
        payload.put("error", String.valueOf(error));
        payload.put("next_attempt_at", retry.nextAttemptAt().toString());
        publish(RouterEvent.JOB_RETRY_SCHEDULED, retry, payload);
        log.warn("Job {} attempt {}/{} failed, retrying in {}ms: {}", retry.id(), attempts,
                retry.maxAttempts(), delay.toMillis(), error);
        return AttemptResult.RETRY;
    }

    private AttemptResult release(QueuedJob started, RouterException e) {
        writeIfPresent(started.release(clock.instant()));
        log.warn("Job {} could not reach backend, returned to queue: {}", started.id(), e.getMessage());
        return AttemptResult.UNREACHABLE;
    }

    /**
     * Persists an attempt's outcome unless an operator removed the job meanwhile.
     */
    private boolean writeIfPresent(QueuedJob job) {
        lock.lock();
        try {
            if (store.findById(job.id()).isEmpty()) {
                log.info("Job {} was removed while processing; discarding outcome", job.id());
                return false;
            }
            store.upsert(job);
            return true;
        } finally {
            lock.unlock();
        }
    }

    Duration backoff(int attempts) {
        long base = properties.getBaseBackoffMs();
        int shift = Math.min(Math.max(attempts, 0), 30);
        long delay = base << shift;
        if (delay < 0 || delay > properties.getMaxBackoffMs()) {
            delay = properties.getMaxBackoffMs();
        }
        return Duration.ofMillis(delay);
    }

    private void drainQuietly() {
        try {
            drain();
        } catch (RuntimeException e) {
            log.error("Drain pass failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Returns jobs left in {@code PROCESSING} by a previous run to {@code QUEUED}.
     */
    int recoverInterrupted() {
        int recovered = 0;
        lock.lock();
        try {
            Instant now = clock.instant();
            for (QueuedJob job : store.findByStatus(JobStatus.PROCESSING)) {
                store.upsert(job.release(now));
                recovered++;
            }
        } finally {
            lock.unlock();
        }
        return recovered;
    }

    // ── Operator actions ─────────────────────────────────────────────────

    /**
     * Moves a failed job back to queued with a fresh attempt budget.
     *
     * @throws JobNotFoundException     if no such job exists
     * @throws IllegalJobStateException if the job has not failed, or an equivalent job is already active
     */
    public QueuedJob retryJob(String jobId) {
        QueuedJob reset;
        lock.lock();
        try {
            QueuedJob job = store.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            reset = resetFailed(job);
        } finally {
            lock.unlock();
        }
        log.info("Job {} re-queued by operator", jobId);
        metrics.recordQueueEvent("queued");
        publish(RouterEvent.JOB_QUEUED, reset, Map.of("retry", true));
        refreshDepth();
        if (connectivity.isOnline()) {
            requestDrain();
        }
        return reset;
    }

    /**
     * Re-queues every failed job that has no active equivalent.
     *
     * @return number of jobs re-queued
     */
    public int retryAllFailed() {
        List<QueuedJob> reset = new ArrayList<>();
        lock.lock();
        try {
            for (QueuedJob job : store.findByStatus(JobStatus.FAILED)) {
                try {
                    reset.add(resetFailed(job));
                } catch (IllegalJobStateException e) {
                    log.info("Not retrying job {}: {}", job.id(), e.getMessage());
                }
            }
        } finally {
            lock.unlock();
        }
        for (QueuedJob job : reset) {
            metrics.recordQueueEvent("queued");
            publish(RouterEvent.JOB_QUEUED, job, Map.of("retry", true));
        }
        log.info("Re-queued {} failed jobs", reset.size());
        refreshDepth();
        if (!reset.isEmpty() && connectivity.isOnline()) {
            requestDrain();
        }
        return reset.size();
    }

    private QueuedJob resetFailed(QueuedJob job) {
        if (job.status() != JobStatus.FAILED) {
            throw new IllegalJobStateException("Job " + job.id() + " is " + job.status().key()
                    + "; only failed jobs can be retried");
        }
        Optional<QueuedJob> active = store.findActiveByFingerprint(job.fingerprint());
        if (active.isPresent()) {
            throw new IllegalJobStateException("Equivalent job " + active.get().id() + " is already "
                    + active.get().status().key());
        }
        QueuedJob reset = job.resetForRetry(clock.instant());
        store.upsert(reset);
        return reset;
    }

    /**
     * Deletes a job in any status. A job removed while processing keeps running,
     * but its outcome is discarded.
     *
     * @throws JobNotFoundException if no such job exists
     */
    public void removeJob(String jobId) {
        QueuedJob removed;
        lock.lock();
        try {
            removed = store.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            store.delete(jobId);
        } finally {
            lock.unlock();
        }
        log.info("Job {} removed ({})", jobId, removed.status().key());
        metrics.recordQueueEvent("removed");
        publish(RouterEvent.JOB_REMOVED, removed, Map.of("status", removed.status().key()));
        refreshDepth();
    }

    public int clearCompleted() {
        return clear(JobStatus.COMPLETED);
    }

    public int clearFailed() {
        return clear(JobStatus.FAILED);
    }

    private int clear(JobStatus status) {
        int deleted;
        lock.lock();
        try {
            deleted = store.deleteByStatus(status);
        } finally {
            lock.unlock();
        }
        log.info("Cleared {} {} jobs", deleted, status.key());
        return deleted;
    }

    // ── Queries ──────────────────────────────────────────────────────────

    public QueueStatus status() {
        Map<JobStatus, Integer> counts = store.countByStatus();
        return new QueueStatus(counts.get(JobStatus.QUEUED), counts.get(JobStatus.PROCESSING),
                counts.get(JobStatus.COMPLETED), counts.get(JobStatus.FAILED));
    }

    public QueueStats stats() {
        return new QueueStats(status(), processed.get(), succeeded.get(), failed.get(),
                lastSyncAttempt, lastSuccessfulSync, draining.get());
    }

    /**
     * @param status only jobs in this status, or all jobs when {@code null}
     */
    public List<QueuedJob> listJobs(JobStatus status) {
        return status == null ? store.findAll() : store.findByStatus(status);
    }

    public Optional<QueuedJob> getJob(String jobId) {
        return store.findById(jobId);
    }

    public boolean isDraining() {
        return draining.get();
    }

    public String storeDescription() {
        return store.describe();
    }

    private void refreshDepth() {
        try {
            monitor.updateQueueDepth(status().pending());
        } catch (JobStoreException e) {
            log.warn("Could not read queue depth: {}", e.getMessage());
        }
    }

    private void publish(String type, QueuedJob job, Map<String, Object> payload) {
        eventBus.publish(new RouterEvent(type, job.id(), job.tool(), payload, clock.instant()));
    }

    enum AttemptResult {
        COMPLETED,
        RETRY,
        FAILED,
        UNREACHABLE,
        SKIPPED
    }
}
