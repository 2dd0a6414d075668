package net.leasehold.core.lock;

import net.leasehold.core.model.JobLock;

import java.time.Instant;

/** 획득한 리스의 핸들. release/renew 에 그대로 넘긴다. */
public record LockToken(
        String lockId,
        String jobId,
        String executionId,
        String instanceId,
        Instant lockedAt,
        Instant leaseExpiresAt
) {
    public static LockToken of(JobLock lock) {
        return new LockToken(lock.id(), lock.jobId(), lock.executionId(), lock.instanceId(),
                lock.lockedAt(), lock.leaseExpiresAt());
    }

    public LockToken withLeaseExpiresAt(Instant expiresAt) {
        return new LockToken(lockId, jobId, executionId, instanceId, lockedAt, expiresAt);
    }
}
