package net.leasehold.adapter.jdbc.repo;

import net.leasehold.adapter.jdbc.TxContext;
import net.leasehold.adapter.jdbc.mapper.JsonColumns;
import net.leasehold.adapter.jdbc.mapper.RowMappers;
import net.leasehold.core.model.ScheduledJob;
import net.leasehold.core.spi.JobRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static net.leasehold.adapter.jdbc.JdbcUtil.setMillis;
import static net.leasehold.adapter.jdbc.JdbcUtil.setInstant;
import static net.leasehold.adapter.jdbc.JdbcUtil.yn;

public final class JdbcJobRepository implements JobRepository {
    private final DataSource ds;

    public JdbcJobRepository(DataSource ds) {
        this.ds = ds;
    }

    // === utils ===
    private Connection mustConn() {
        return TxContext.require();
    }

    // === interface impl ===

    @Override
    public Optional<ScheduledJob> findById(String id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_JOB WHERE ID = ?")) {
            ps.setString(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toJob(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public Optional<ScheduledJob> findByIdForUpdate(String id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_JOB WHERE ID = ? FOR UPDATE")) {
            ps.setString(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toJob(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public Optional<ScheduledJob> findByName(String name) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_JOB WHERE NAME = ?")) {
            ps.setString(1, name);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toJob(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<ScheduledJob> findAll() throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_JOB ORDER BY NAME");
             var rs = ps.executeQuery()) {
            List<ScheduledJob> out = new ArrayList<>();
            while (rs.next()) out.add(RowMappers.toJob(rs));
            return out;
        }
    }

    /** 살아있는(LEASE_EXPIRES_AT >= now) ACQUIRED 락이 있는 잡은 제외. 만료된 락은 후보로 남겨 takeover 대상이 된다 */
    @Override
    public List<ScheduledJob> findDueCandidates(Instant now, int limit) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT  j.*
            FROM    TB_JOB j
            WHERE   j.ENABLED = 'Y'
              AND   j.NEXT_DUE_AT IS NOT NULL
              AND   j.NEXT_DUE_AT <= ?
              AND   NOT EXISTS (
                        SELECT 1
                        FROM   TB_JOB_LOCK l
                        WHERE  l.JOB_ID = j.ID
                          AND  l.STATUS = 'ACQUIRED'
                          AND  l.LEASE_EXPIRES_AT >= ?
                    )
            ORDER BY j.PRIORITY DESC, j.NEXT_DUE_AT ASC, j.ID ASC
            FETCH FIRST ? ROWS ONLY
        """)) {
            setInstant(ps, 1, now);
            setInstant(ps, 2, now);
            ps.setInt(3, limit);
            try (var rs = ps.executeQuery()) {
                List<ScheduledJob> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toJob(rs));
                return out;
            }
        }
    }

    @Override
    public Set<String> findDistinctKinds() throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT DISTINCT KIND FROM TB_JOB ORDER BY KIND");
             var rs = ps.executeQuery()) {
            Set<String> out = new LinkedHashSet<>();
            while (rs.next()) out.add(rs.getString(1));
            return out;
        }
    }

    @Override
    public void insert(ScheduledJob job) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_JOB
                (ID, NAME, DESCRIPTION, KIND, SCHEDULE, PARAMETERS, ENABLED, MAX_RETRIES, TIMEOUT_MS,
                 PRIORITY, TAGS, METADATA, CREATED_BY, NEXT_DUE_AT, CREATED_AT, UPDATED_AT)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """)) {
            ps.setString(1, job.id());
            int i = bindDefinition(ps, 2, job);
            ps.setString(i++, job.createdBy());
            setInstant(ps, i++, job.nextDueAt());
            setInstant(ps, i++, job.createdAt());
            setInstant(ps, i, job.updatedAt());
            ps.executeUpdate();
        }
    }

    @Override
    public int update(ScheduledJob job) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_JOB
               SET NAME        = ?,
                   DESCRIPTION = ?,
                   KIND        = ?,
                   SCHEDULE    = ?,
                   PARAMETERS  = ?,
                   ENABLED     = ?,
                   MAX_RETRIES = ?,
                   TIMEOUT_MS  = ?,
                   PRIORITY    = ?,
                   TAGS        = ?,
                   METADATA    = ?,
                   NEXT_DUE_AT = ?,
                   UPDATED_AT  = ?
             WHERE ID = ?
        """)) {
            int i = bindDefinition(ps, 1, job);
            setInstant(ps, i++, job.nextDueAt());
            setInstant(ps, i++, job.updatedAt());
            ps.setString(i, job.id());
            return ps.executeUpdate();
        }
    }

    @Override
    public boolean advanceCursor(String id, Instant expectedDueAt, Instant nextDueAt, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_JOB
               SET NEXT_DUE_AT = ?,
                   UPDATED_AT  = ?
             WHERE ID = ?
               AND NEXT_DUE_AT = ?
        """)) {
            setInstant(ps, 1, nextDueAt);
            setInstant(ps, 2, now);
            ps.setString(3, id);
            setInstant(ps, 4, expectedDueAt);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public int setEnabled(String id, boolean enabled, Instant nextDueAt, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_JOB
               SET ENABLED     = ?,
                   NEXT_DUE_AT = ?,
                   UPDATED_AT  = ?
             WHERE ID = ?
        """)) {
            ps.setString(1, yn(enabled));
            setInstant(ps, 2, nextDueAt);
            setInstant(ps, 3, now);
            ps.setString(4, id);
            return ps.executeUpdate();
        }
    }

    @Override
    public int delete(String id) throws Exception {
        try (var ps = mustConn().prepareStatement("DELETE FROM TB_JOB WHERE ID = ?")) {
            ps.setString(1, id);
            return ps.executeUpdate();
        }
    }

    // NAME..METADATA 11개 컬럼 바인딩, 다음 인덱스 반환
    private static int bindDefinition(PreparedStatement ps, int i, ScheduledJob job) throws SQLException {
        ps.setString(i++, job.name());
        ps.setString(i++, job.description());
        ps.setString(i++, job.kind());
        ps.setString(i++, job.schedule());
        ps.setString(i++, JsonColumns.write(job.parameters()));
        ps.setString(i++, yn(job.enabled()));
        ps.setInt(i++, job.maxRetries());
        setMillis(ps, i++, job.timeout());
        ps.setInt(i++, job.priority());
        ps.setString(i++, JsonColumns.writeTags(job.tags()));
        ps.setString(i++, JsonColumns.writeMetadata(job.metadata()));
        return i;
    }
}
