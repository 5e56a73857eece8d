package com.switchyard.core.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchyard.core.model.JobStatus;
import com.switchyard.core.model.QueuedJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * PostgreSQL-backed {@link JobStore}.
 * <p>
 * One row per job in {@code switchyard_jobs}; parameters and results are stored
 * as JSON text. The table is created by {@link #createTables()}.
 */
public class JdbcJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobStore.class);

    static final String TABLE_NAME = "switchyard_jobs";

    private static final String COLUMNS =
            "id, fingerprint, tool, parameters, priority, created_at, attempts, max_attempts, "
            + "status, last_error, next_attempt_at, updated_at, result";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id              VARCHAR(64) PRIMARY KEY,
                fingerprint     VARCHAR(64) NOT NULL,
                tool            VARCHAR(64) NOT NULL,
                parameters      TEXT NOT NULL,
                priority        INTEGER NOT NULL,
                created_at      TIMESTAMPTZ NOT NULL,
                attempts        INTEGER NOT NULL,
                max_attempts    INTEGER NOT NULL,
                status          VARCHAR(16) NOT NULL,
                last_error      TEXT,
                next_attempt_at TIMESTAMPTZ,
                updated_at      TIMESTAMPTZ NOT NULL,
                result          TEXT
            )
            """.formatted(TABLE_NAME);

    private static final String CREATE_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS %s_status_idx ON %s (status, priority DESC, created_at ASC)
            """.formatted(TABLE_NAME, TABLE_NAME);

    private static final String UPSERT_SQL = """
            INSERT INTO %s (%s)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (id)
            DO UPDATE SET attempts = EXCLUDED.attempts,
                          max_attempts = EXCLUDED.max_attempts,
                          status = EXCLUDED.status,
                          last_error = EXCLUDED.last_error,
                          next_attempt_at = EXCLUDED.next_attempt_at,
                          updated_at = EXCLUDED.updated_at,
                          result = EXCLUDED.result
            """.formatted(TABLE_NAME, COLUMNS);

    private static final String SELECT_BY_ID_SQL = """
            SELECT %s FROM %s WHERE id = ?
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_ALL_SQL = """
            SELECT %s FROM %s ORDER BY created_at ASC, id ASC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_BY_STATUS_SQL = """
            SELECT %s FROM %s WHERE status = ? ORDER BY created_at ASC, id ASC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_ACTIVE_BY_FINGERPRINT_SQL = """
            SELECT %s FROM %s
            WHERE fingerprint = ? AND status IN ('QUEUED', 'PROCESSING')
            ORDER BY created_at ASC
            LIMIT 1
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String COUNT_BY_STATUS_SQL = """
            SELECT status, COUNT(*) AS n FROM %s GROUP BY status
            """.formatted(TABLE_NAME);

    private static final String DELETE_BY_ID_SQL = """
            DELETE FROM %s WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String DELETE_BY_STATUS_SQL = """
            DELETE FROM %s WHERE status = ?
            """.formatted(TABLE_NAME);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcJobStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
    }

    /**
     * Creates the job table and its status index if they do not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement table = conn.prepareStatement(CREATE_TABLE_SQL);
             PreparedStatement index = conn.prepareStatement(CREATE_INDEX_SQL)) {
            table.execute();
            index.execute();
            log.info("Job table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void upsert(QueuedJob job) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            stmt.setString(1, job.id());
            stmt.setString(2, job.fingerprint());
            stmt.setString(3, job.tool());
            stmt.setString(4, toJson(job.parameters() == null ? Map.of() : job.parameters()));
            stmt.setInt(5, job.priority());
            setInstant(stmt, 6, job.createdAt());
            stmt.setInt(7, job.attempts());
            stmt.setInt(8, job.maxAttempts());
            stmt.setString(9, job.status().name());
            stmt.setString(10, job.lastError());
            setInstant(stmt, 11, job.nextAttemptAt());
            setInstant(stmt, 12, job.updatedAt());
            stmt.setString(13, job.result() == null ? null : toJson(job.result()));
            stmt.executeUpdate();
            log.debug("Saved job '{}' ({})", job.id(), job.status());
        } catch (SQLException e) {
            throw new JobStoreException("Failed to save job " + job.id(), e);
        }
    }

    @Override
    public Optional<QueuedJob> findById(String id) {
        List<QueuedJob> found = query(SELECT_BY_ID_SQL, id);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public List<QueuedJob> findAll() {
        return query(SELECT_ALL_SQL, null);
    }

    @Override
    public List<QueuedJob> findByStatus(JobStatus status) {
        return query(SELECT_BY_STATUS_SQL, status.name());
    }

    @Override
    public Optional<QueuedJob> findActiveByFingerprint(String fingerprint) {
        List<QueuedJob> found = query(SELECT_ACTIVE_BY_FINGERPRINT_SQL, fingerprint);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public boolean delete(String id) {
        return update(DELETE_BY_ID_SQL, id) > 0;
    }

    @Override
    public int deleteByStatus(JobStatus status) {
        return update(DELETE_BY_STATUS_SQL, status.name());
    }

    @Override
    public Map<JobStatus, Integer> countByStatus() {
        var counts = new EnumMap<JobStatus, Integer>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0);
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COUNT_BY_STATUS_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                counts.put(JobStatus.valueOf(rs.getString("status")), rs.getInt("n"));
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to count jobs", e);
        }
        return counts;
    }

    @Override
    public String describe() {
        return "jdbc:" + TABLE_NAME;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private List<QueuedJob> query(String sql, String param) {
        List<QueuedJob> jobs = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (param != null) {
                stmt.setString(1, param);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    jobs.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to query jobs", e);
        }
        return jobs;
    }

    private int update(String sql, String param) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, param);
            int rows = stmt.executeUpdate();
            log.debug("Deleted {} job rows", rows);
            return rows;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to delete jobs", e);
        }
    }

    private QueuedJob fromResultSet(ResultSet rs) throws SQLException {
        String resultJson = rs.getString("result");
        return new QueuedJob(
                rs.getString("id"),
                rs.getString("fingerprint"),
                rs.getString("tool"),
                fromJson(rs.getString("parameters"), MAP_TYPE),
                rs.getInt("priority"),
                getInstant(rs, "created_at"),
                rs.getInt("attempts"),
                rs.getInt("max_attempts"),
                JobStatus.valueOf(rs.getString("status")),
                rs.getString("last_error"),
                getInstant(rs, "next_attempt_at"),
                getInstant(rs, "updated_at"),
                resultJson == null ? null : fromJson(resultJson, new TypeReference<Object>() {}));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize job data", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize job data", e);
        }
    }

    /** Binds as {@code timestamptz} in UTC, independent of the JVM and session time zones. */
    private static void setInstant(PreparedStatement stmt, int index, Instant instant) throws SQLException {
        stmt.setObject(index, instant == null ? null : instant.atOffset(ZoneOffset.UTC), Types.TIMESTAMP_WITH_TIMEZONE);
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }
}
