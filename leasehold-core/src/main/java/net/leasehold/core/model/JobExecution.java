package net.leasehold.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

public record JobExecution(
        String id,            // execution_id (멱등 키)
        String jobId,
        Status status,
        Instant startedAt,
        Instant completedAt,
        Duration duration,
        JsonNode result,
        String error,
        int retryCount,
        String instanceId,
        Map<String, String> metadata    // trigger 경로 등 실행 부가 정보
) {
    public static final String LEASE_EXPIRED_ERROR = "lease expired before completion";

    public static final String TRIGGER = "trigger";
    public static final String SCHEDULED_FOR = "scheduledFor";

    public JobExecution {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public enum Status {
        PENDING, RUNNING, SUCCEEDED, FAILED, TIMED_OUT, CANCELLED, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }

        public boolean terminal() {
            return this == SUCCEEDED || this == FAILED || this == TIMED_OUT || this == CANCELLED;
        }
    }

    public static JobExecution running(String id, String jobId, Instant startedAt, String instanceId) {
        return running(id, jobId, startedAt, instanceId, Map.of());
    }

    public static JobExecution running(String id, String jobId, Instant startedAt, String instanceId,
                                       Map<String, String> metadata) {
        return new JobExecution(id, jobId, Status.RUNNING, startedAt, null, null, null, null, 0, instanceId, metadata);
    }
}
