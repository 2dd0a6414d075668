package net.leasehold.core.executor;

import com.fasterxml.jackson.databind.JsonNode;

public record ExecutionContext(
        String executionId,
        String jobId,
        String jobName,
        JsonNode parameters,
        int retryCount,      // 0 = 첫 시도
        CancelSignal cancel
) {}
