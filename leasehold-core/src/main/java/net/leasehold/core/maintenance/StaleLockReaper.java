package net.leasehold.core.maintenance;

import net.leasehold.core.model.JobExecution;
import net.leasehold.core.model.JobLock;
import net.leasehold.core.spi.Clock;
import net.leasehold.core.spi.JobExecutionRepository;
import net.leasehold.core.spi.JobLockRepository;
import net.leasehold.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 디스패치 경로와 독립적으로 도는 두 개의 청소 작업.
 * - 만료 sweep: 리스가 지난 ACQUIRED 락 → EXPIRED, 보호하던 실행 → TIMED_OUT
 * - 보존 sweep: 보존 기간이 지난 종결 락/실행 삭제
 */
public final class StaleLockReaper {
    private static final Logger log = LoggerFactory.getLogger(StaleLockReaper.class);

    private final JobLockRepository locks;
    private final JobExecutionRepository executions;
    private final TxRunner tx;
    private final Clock clock;

    public StaleLockReaper(JobLockRepository locks,
                           JobExecutionRepository executions,
                           TxRunner tx,
                           Clock clock) {
        this.locks = locks;
        this.executions = executions;
        this.tx = tx;
        this.clock = clock;
    }

    public SweepReport expireStaleLocks() throws Exception {
        Instant now = clock.now();
        SweepReport r = new SweepReport();

        tx.required(() -> {
            List<JobLock> stale = locks.findExpired(now);
            for (JobLock lock : stale) {
                // 그 사이 해제됐거나 다른 sweep 이 처리했으면 건너뜀
                if (!locks.markExpired(lock.id(), now)) continue;
                r.expiredLocks++;
                log.info("lease of job {} held by {} expired at {}", lock.jobId(), lock.instanceId(), lock.leaseExpiresAt());
                if (executions.finish(lock.executionId(), JobExecution.Status.TIMED_OUT, now,
                        Duration.between(lock.lockedAt(), now), null, JobExecution.LEASE_EXPIRED_ERROR)) {
                    r.timedOutExecutions++;
                }
            }
            return null;
        });

        r.timestamp = now;
        if (r.expiredLocks > 0) log.info("{}", r);
        else log.debug("{}", r);
        return r;
    }

    public SweepReport purgeHistory(Duration retention) throws Exception {
        if (retention == null || retention.isZero() || retention.isNegative()) {
            throw new IllegalArgumentException("retention must be positive: " + retention);
        }
        Instant now = clock.now();
        Instant threshold = now.minus(retention);
        SweepReport r = new SweepReport();

        r.purgedLocks = tx.required(() -> locks.deleteFinishedOlderThan(threshold));
        r.purgedExecutions = tx.required(() -> executions.deleteFinishedOlderThan(threshold));

        r.timestamp = now;
        log.info("{}", r);
        return r;
    }

    /** 간단 리포트 DTO */
    public static final class SweepReport {
        public Instant timestamp;
        public int expiredLocks;
        public int timedOutExecutions;
        public int purgedLocks;
        public int purgedExecutions;

        @Override public String toString() {
            return "SweepReport{" +
                    "timestamp=" + timestamp +
                    ", expiredLocks=" + expiredLocks +
                    ", timedOutExecutions=" + timedOutExecutions +
                    ", purgedLocks=" + purgedLocks +
                    ", purgedExecutions=" + purgedExecutions +
                    '}';
        }
    }
}
