package com.switchyard.core.queue;

import com.switchyard.core.model.JobStatus;
import com.switchyard.core.model.QueuedJob;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable record store for {@link QueuedJob}s.
 * <p>
 * Every write is an atomic single-record upsert; implementations throw
 * {@link JobStoreException} when the underlying storage fails.
 */
public interface JobStore {

    void upsert(QueuedJob job);

    Optional<QueuedJob> findById(String id);

    List<QueuedJob> findAll();

    /**
     * @return {@code true} if a record was deleted
     */
    boolean delete(String id);

    /** Short human-readable description of where jobs are stored. */
    String describe();

    default List<QueuedJob> findByStatus(JobStatus status) {
        return findAll().stream().filter(j -> j.status() == status).toList();
    }

    default Optional<QueuedJob> findActiveByFingerprint(String fingerprint) {
        return findAll().stream()
                .filter(j -> j.status().isActive() && j.fingerprint().equals(fingerprint))
                .findFirst();
    }

    /**
     * @return number of records deleted
     */
    default int deleteByStatus(JobStatus status) {
        int deleted = 0;
        for (QueuedJob job : findByStatus(status)) {
            if (delete(job.id())) {
                deleted++;
            }
        }
        return deleted;
    }

    default Map<JobStatus, Integer> countByStatus() {
        var counts = new EnumMap<JobStatus, Integer>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0);
        }
        for (QueuedJob job : findAll()) {
            counts.merge(job.status(), 1, Integer::sum);
        }
        return counts;
    }
}
