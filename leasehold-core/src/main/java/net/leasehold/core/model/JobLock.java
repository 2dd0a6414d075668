package net.leasehold.core.model;

import java.time.Instant;

public record JobLock(
        String id,
        String jobId,
        String executionId,
        String instanceId,     // hostname:pid
        Instant lockedAt,
        Instant leaseExpiresAt,
        Status status,
        Instant releasedAt
) {
    public enum Status {
        ACQUIRED, RELEASED, EXPIRED, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }
    }

    /** lease_expires_at < now 이면 만료. 경계 시각은 아직 유효하다. */
    public boolean expiredAt(Instant now) {
        return leaseExpiresAt.isBefore(now);
    }
}
