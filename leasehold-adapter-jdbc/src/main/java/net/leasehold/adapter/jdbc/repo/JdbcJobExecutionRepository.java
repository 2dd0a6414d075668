package net.leasehold.adapter.jdbc.repo;

import com.fasterxml.jackson.databind.JsonNode;
import net.leasehold.adapter.jdbc.TxContext;
import net.leasehold.adapter.jdbc.mapper.JsonColumns;
import net.leasehold.adapter.jdbc.mapper.RowMappers;
import net.leasehold.core.model.JobExecution;
import net.leasehold.core.spi.JobExecutionRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.leasehold.adapter.jdbc.JdbcUtil.setMillis;
import static net.leasehold.adapter.jdbc.JdbcUtil.setInstant;

public final class JdbcJobExecutionRepository implements JobExecutionRepository {
    private final DataSource ds;

    public JdbcJobExecutionRepository(DataSource ds) {
        this.ds = ds;
    }

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public void insert(JobExecution e) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_JOB_EXECUTION
                (ID, JOB_ID, STATUS, STARTED_AT, COMPLETED_AT, DURATION_MS, RESULT, ERROR, RETRY_COUNT, INSTANCE_ID, METADATA)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """)) {
            ps.setString(1, e.id());
            ps.setString(2, e.jobId());
            ps.setString(3, e.status().code());
            setInstant(ps, 4, e.startedAt());
            setInstant(ps, 5, e.completedAt());
            setMillis(ps, 6, e.duration());
            ps.setString(7, JsonColumns.write(e.result()));
            ps.setString(8, e.error());
            ps.setInt(9, e.retryCount());
            ps.setString(10, e.instanceId());
            ps.setString(11, JsonColumns.writeMetadata(e.metadata()));
            ps.executeUpdate();
        }
    }

    /** 종결은 RUNNING 에서 한 번만. 리스 만료로 먼저 TIMED_OUT 처리됐으면 덮어쓰지 않는다 */
    @Override
    public boolean finish(String id, JobExecution.Status status, Instant completedAt, Duration duration,
                          JsonNode result, String error) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_JOB_EXECUTION
               SET STATUS       = ?,
                   COMPLETED_AT = ?,
                   DURATION_MS  = ?,
                   RESULT       = ?,
                   ERROR        = ?
             WHERE ID = ?
               AND STATUS = 'RUNNING'
        """)) {
            ps.setString(1, status.code());
            setInstant(ps, 2, completedAt);
            setMillis(ps, 3, duration);
            ps.setString(4, JsonColumns.write(result));
            ps.setString(5, error);
            ps.setString(6, id);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public int updateRetryCount(String id, int retryCount) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_JOB_EXECUTION
               SET RETRY_COUNT = ?
             WHERE ID = ?
               AND STATUS = 'RUNNING'
        """)) {
            ps.setInt(1, retryCount);
            ps.setString(2, id);
            return ps.executeUpdate();
        }
    }

    @Override
    public Optional<JobExecution> findById(String id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_JOB_EXECUTION WHERE ID = ?")) {
            ps.setString(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toExecution(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<JobExecution> findByJob(String jobId, int limit) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT *
            FROM   TB_JOB_EXECUTION
            WHERE  JOB_ID = ?
            ORDER BY STARTED_AT DESC, ID DESC
            FETCH FIRST ? ROWS ONLY
        """)) {
            ps.setString(1, jobId);
            ps.setInt(2, limit);
            try (var rs = ps.executeQuery()) {
                List<JobExecution> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toExecution(rs));
                return out;
            }
        }
    }

    @Override
    public int deleteFinishedOlderThan(Instant threshold) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            DELETE FROM TB_JOB_EXECUTION
             WHERE STATUS IN ('SUCCEEDED', 'FAILED', 'TIMED_OUT', 'CANCELLED')
               AND COMPLETED_AT < ?
        """)) {
            setInstant(ps, 1, threshold);
            return ps.executeUpdate();
        }
    }
}
