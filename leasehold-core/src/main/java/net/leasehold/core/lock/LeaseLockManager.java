package net.leasehold.core.lock;

import net.leasehold.core.model.JobExecution;
import net.leasehold.core.model.JobLock;
import net.leasehold.core.model.LockStats;
import net.leasehold.core.service.SchedulerMetrics;
import net.leasehold.core.spi.Clock;
import net.leasehold.core.spi.JobExecutionRepository;
import net.leasehold.core.spi.JobLockRepository;
import net.leasehold.core.spi.TxRunner;
import net.leasehold.core.util.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 공유 스토어 기반 리스 락.
 * 잡 행 FOR UPDATE 로 경쟁자를 직렬화하고, 최종 판정은 ACQUIRED 유니크 제약이 한다.
 */
public final class LeaseLockManager implements LockManager {
    private static final Logger log = LoggerFactory.getLogger(LeaseLockManager.class);

    private final JobLockRepository locks;
    private final JobExecutionRepository executions;
    private final TxRunner tx;
    private final Clock clock;
    private final SchedulerMetrics metrics;

    public LeaseLockManager(JobLockRepository locks,
                            JobExecutionRepository executions,
                            TxRunner tx,
                            Clock clock,
                            SchedulerMetrics metrics) {
        this.locks = locks;
        this.executions = executions;
        this.tx = tx;
        this.clock = clock;
        this.metrics = metrics;
    }

    @Override
    public Optional<LockToken> tryAcquire(String jobId, String instanceId, Duration lease) throws Exception {
        return tx.required(() -> {
            if (!locks.lockJobRow(jobId)) {
                log.debug("tryAcquire: job {} does not exist", jobId);
                return Optional.<LockToken>empty();
            }
            Instant now = clock.now();

            Optional<JobLock> active = locks.findActive(jobId);
            if (active.isPresent()) {
                JobLock held = active.get();
                if (!held.expiredAt(now)) {
                    log.debug("job {} held by {} until {}", jobId, held.instanceId(), held.leaseExpiresAt());
                    return Optional.<LockToken>empty();
                }
                // takeover: 보유자 협조 없이 회수
                expire(held, now);
                metrics.takeover();
                log.info("taking over job {} from {} (lease expired at {})",
                        jobId, held.instanceId(), held.leaseExpiresAt());
            }

            JobLock fresh = new JobLock(Ids.next(now), jobId, Ids.next(now), instanceId,
                    now, now.plus(lease), JobLock.Status.ACQUIRED, null);
            if (!locks.insertIfNoneActive(fresh)) {
                log.debug("job {} acquired concurrently by another instance", jobId);
                return Optional.<LockToken>empty();
            }
            return Optional.of(LockToken.of(fresh));
        });
    }

    @Override
    public Optional<LockToken> renew(LockToken token, Duration extendBy) throws Exception {
        return tx.required(() -> {
            Instant now = clock.now();
            Instant expiry = now.plus(extendBy);
            if (locks.renew(token.lockId(), now, expiry)) {
                return Optional.of(token.withLeaseExpiresAt(expiry));
            }
            log.warn("lease on job {} (lock {}) was lost before renewal", token.jobId(), token.lockId());
            return Optional.<LockToken>empty();
        });
    }

    @Override
    public boolean release(LockToken token) throws Exception {
        boolean released = tx.required(() -> locks.release(token.lockId(), clock.now()));
        if (!released) {
            log.warn("lock {} on job {} was no longer held at release (already released or expired)",
                    token.lockId(), token.jobId());
        }
        return released;
    }

    @Override
    public boolean reclaimIfExpired(String jobId) throws Exception {
        return tx.required(() -> {
            if (!locks.lockJobRow(jobId)) return false;
            Instant now = clock.now();
            Optional<JobLock> active = locks.findActive(jobId);
            if (active.isEmpty() || !active.get().expiredAt(now)) return false;
            return expire(active.get(), now);
        });
    }

    @Override
    public LockStats stats() throws Exception {
        return tx.required(locks::stats);
    }

    // 락 EXPIRED + 보호하던 실행이 아직 RUNNING 이면 TIMED_OUT
    private boolean expire(JobLock held, Instant now) throws Exception {
        if (!locks.markExpired(held.id(), now)) return false;
        Duration ran = Duration.between(held.lockedAt(), now);
        executions.finish(held.executionId(), JobExecution.Status.TIMED_OUT, now, ran,
                null, JobExecution.LEASE_EXPIRED_ERROR);
        return true;
    }
}
