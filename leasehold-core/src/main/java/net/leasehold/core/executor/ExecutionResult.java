package net.leasehold.core.executor;

import com.fasterxml.jackson.databind.JsonNode;

public record ExecutionResult(JsonNode payload) {
    private static final ExecutionResult EMPTY = new ExecutionResult(null);

    public static ExecutionResult empty() { return EMPTY; }

    public static ExecutionResult of(JsonNode payload) { return new ExecutionResult(payload); }
}
