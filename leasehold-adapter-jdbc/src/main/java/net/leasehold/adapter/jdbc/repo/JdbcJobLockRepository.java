package net.leasehold.adapter.jdbc.repo;

import net.leasehold.adapter.jdbc.JdbcUtil;
import net.leasehold.adapter.jdbc.TxContext;
import net.leasehold.adapter.jdbc.mapper.RowMappers;
import net.leasehold.core.model.JobLock;
import net.leasehold.core.model.LockStats;
import net.leasehold.core.spi.JobLockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.leasehold.adapter.jdbc.JdbcUtil.setInstant;

/**
 * TB_JOB_LOCK 접근.
 * JOB_ID 당 ACQUIRED 1건은 DB 유니크 인덱스(STATUS='ACQUIRED' 범위)가 강제한다.
 */
public final class JdbcJobLockRepository implements JobLockRepository {
    private static final Logger log = LoggerFactory.getLogger(JdbcJobLockRepository.class);

    private final DataSource ds;

    public JdbcJobLockRepository(DataSource ds) {
        this.ds = ds;
    }

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public boolean lockJobRow(String jobId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT ID FROM TB_JOB WHERE ID = ? FOR UPDATE")) {
            ps.setString(1, jobId);
            try (var rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public Optional<JobLock> findActive(String jobId) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT * FROM TB_JOB_LOCK WHERE JOB_ID = ? AND STATUS = 'ACQUIRED'
        """)) {
            ps.setString(1, jobId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toLock(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public Optional<JobLock> findById(String lockId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_JOB_LOCK WHERE ID = ?")) {
            ps.setString(1, lockId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toLock(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public boolean insertIfNoneActive(JobLock lock) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_JOB_LOCK
                (ID, JOB_ID, EXECUTION_ID, INSTANCE_ID, LOCKED_AT, LEASE_EXPIRES_AT, STATUS, RELEASED_AT)
            VALUES (?, ?, ?, ?, ?, ?, 'ACQUIRED', NULL)
        """)) {
            ps.setString(1, lock.id());
            ps.setString(2, lock.jobId());
            ps.setString(3, lock.executionId());
            ps.setString(4, lock.instanceId());
            setInstant(ps, 5, lock.lockedAt());
            setInstant(ps, 6, lock.leaseExpiresAt());
            ps.executeUpdate();
            return true;
        } catch (SQLException e) {
            if (!JdbcUtil.isConflict(e)) throw e;
            log.debug("active lock insert for job {} rejected by store: {}", lock.jobId(), e.getMessage());
            return false;
        }
    }

    @Override
    public boolean markExpired(String lockId, Instant now) throws Exception {
        return finalizeAcquired(lockId, "EXPIRED", now);
    }

    @Override
    public boolean release(String lockId, Instant now) throws Exception {
        return finalizeAcquired(lockId, "RELEASED", now);
    }

    @Override
    public boolean renew(String lockId, Instant now, Instant newExpiry) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_JOB_LOCK
               SET LEASE_EXPIRES_AT = ?
             WHERE ID = ?
               AND STATUS = 'ACQUIRED'
               AND LEASE_EXPIRES_AT >= ?
        """)) {
            setInstant(ps, 1, newExpiry);
            ps.setString(2, lockId);
            setInstant(ps, 3, now);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public List<JobLock> findExpired(Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT *
            FROM   TB_JOB_LOCK
            WHERE  STATUS = 'ACQUIRED'
              AND  LEASE_EXPIRES_AT < ?
            ORDER BY LEASE_EXPIRES_AT
        """)) {
            setInstant(ps, 1, now);
            try (var rs = ps.executeQuery()) {
                List<JobLock> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toLock(rs));
                return out;
            }
        }
    }

    @Override
    public int deleteFinishedOlderThan(Instant threshold) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            DELETE FROM TB_JOB_LOCK
             WHERE STATUS IN ('RELEASED', 'EXPIRED')
               AND LOCKED_AT < ?
        """)) {
            setInstant(ps, 1, threshold);
            return ps.executeUpdate();
        }
    }

    @Override
    public LockStats stats() throws Exception {
        long acquired = 0, released = 0, expired = 0;
        try (var ps = mustConn().prepareStatement("""
            SELECT STATUS, COUNT(*) AS CNT FROM TB_JOB_LOCK GROUP BY STATUS
        """); var rs = ps.executeQuery()) {
            while (rs.next()) {
                long n = rs.getLong("CNT");
                switch (JobLock.Status.from(rs.getString("STATUS"))) {
                    case ACQUIRED -> acquired = n;
                    case RELEASED -> released = n;
                    case EXPIRED -> expired = n;
                    default -> { }
                }
            }
        }
        return new LockStats(acquired, released, expired);
    }

    // ACQUIRED → RELEASED | EXPIRED, 한 번만
    private boolean finalizeAcquired(String lockId, String status, Instant now) throws SQLException {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_JOB_LOCK
               SET STATUS      = ?,
                   RELEASED_AT = ?
             WHERE ID = ?
               AND STATUS = 'ACQUIRED'
        """)) {
            ps.setString(1, status);
            setInstant(ps, 2, now);
            ps.setString(3, lockId);
            return ps.executeUpdate() == 1;
        }
    }
}
