package net.leasehold.core.lock;

import net.leasehold.core.model.LockStats;
import net.leasehold.core.spi.Clock;
import net.leasehold.core.util.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 프로세스 내부 리스. enable-distributed-locking=false 일 때만 사용.
 * 인스턴스 간 상호배제를 보장하지 않는다.
 */
public final class LocalLockManager implements LockManager {
    private static final Logger log = LoggerFactory.getLogger(LocalLockManager.class);

    private final Clock clock;
    private final Map<String, LockToken> held = new HashMap<>();
    private long released;
    private long expired;

    public LocalLockManager(Clock clock) {
        this.clock = clock;
        log.warn("distributed locking is disabled: job leases are process-local and NOT safe "
                + "for multi-instance deployments");
    }

    @Override
    public synchronized Optional<LockToken> tryAcquire(String jobId, String instanceId, Duration lease) {
        Instant now = clock.now();
        LockToken current = held.get(jobId);
        if (current != null) {
            if (!current.leaseExpiresAt().isBefore(now)) return Optional.empty();
            expired++;
            log.info("taking over job {} locally (lease expired at {})", jobId, current.leaseExpiresAt());
        }
        LockToken token = new LockToken(Ids.next(now), jobId, Ids.next(now), instanceId, now, now.plus(lease));
        held.put(jobId, token);
        return Optional.of(token);
    }

    @Override
    public synchronized Optional<LockToken> renew(LockToken token, Duration extendBy) {
        Instant now = clock.now();
        LockToken current = held.get(token.jobId());
        if (current == null || !current.lockId().equals(token.lockId()) || current.leaseExpiresAt().isBefore(now)) {
            return Optional.empty();
        }
        LockToken renewed = current.withLeaseExpiresAt(now.plus(extendBy));
        held.put(token.jobId(), renewed);
        return Optional.of(renewed);
    }

    @Override
    public synchronized boolean release(LockToken token) {
        LockToken current = held.get(token.jobId());
        if (current == null || !current.lockId().equals(token.lockId())) {
            log.warn("local lock {} on job {} was no longer held at release", token.lockId(), token.jobId());
            return false;
        }
        held.remove(token.jobId());
        released++;
        return true;
    }

    @Override
    public synchronized boolean reclaimIfExpired(String jobId) {
        LockToken current = held.get(jobId);
        if (current == null || !current.leaseExpiresAt().isBefore(clock.now())) return false;
        held.remove(jobId);
        expired++;
        return true;
    }

    @Override
    public synchronized LockStats stats() {
        return new LockStats(held.size(), released, expired);
    }
}
