package com.switchyard.core.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchyard.core.model.QueuedJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Stores each job as {@code <id>.json} in a directory.
 * <p>
 * Writes go to a temporary file which is then moved over the target, so a crash
 * never leaves a half-written record. All records are loaded into memory by
 * {@link #load()} and reads are served from there.
 */
public class FileJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(FileJobStore.class);

    private static final String SUFFIX = ".json";
    private static final Pattern SAFE_ID = Pattern.compile("^[A-Za-z0-9_-]{1,128}$");

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final ConcurrentHashMap<String, QueuedJob> jobs = new ConcurrentHashMap<>();

    public FileJobStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    /**
     * Creates the directory if needed and reads every job file in it.
     * Unreadable files are logged and skipped.
     *
     * @return number of jobs loaded
     */
    public int load() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new JobStoreException("Cannot create job directory " + directory, e);
        }
        jobs.clear();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                try {
                    QueuedJob job = objectMapper.readValue(file.toFile(), QueuedJob.class);
                    jobs.put(job.id(), job);
                } catch (IOException e) {
                    log.warn("Skipping unreadable job file {}: {}", file.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new JobStoreException("Cannot list job directory " + directory, e);
        }
        log.info("Loaded {} jobs from {}", jobs.size(), directory);
        return jobs.size();
    }

    @Override
    public void upsert(QueuedJob job) {
        Path target = fileFor(job.id());
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            objectMapper.writeValue(tmp.toFile(), job);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new JobStoreException("Failed to write job " + job.id(), e);
        }
        jobs.put(job.id(), job);
    }

    @Override
    public Optional<QueuedJob> findById(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public List<QueuedJob> findAll() {
        var all = new ArrayList<>(jobs.values());
        all.sort(Comparator.comparing(QueuedJob::createdAt).thenComparing(QueuedJob::id));
        return all;
    }

    @Override
    public boolean delete(String id) {
        if (jobs.remove(id) == null) {
            return false;
        }
        try {
            Files.deleteIfExists(fileFor(id));
        } catch (IOException e) {
            throw new JobStoreException("Failed to delete job " + id, e);
        }
        return true;
    }

    @Override
    public String describe() {
        return "file:" + directory;
    }

    private Path fileFor(String id) {
        if (id == null || !SAFE_ID.matcher(id).matches()) {
            throw new IllegalArgumentException("Invalid job id: " + id);
        }
        return directory.resolve(id + SUFFIX);
    }
}
