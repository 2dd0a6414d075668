package net.leasehold.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ScheduledJob(
        String id,
        String name,
        String description,
        String kind,          // 실행기 선택 키
        String schedule,      // 6필드 cron (초 포함)
        JsonNode parameters,
        boolean enabled,
        int maxRetries,
        Duration timeout,     // null이면 기본 타임아웃
        int priority,         // 클수록 먼저
        List<String> tags,
        Map<String, String> metadata,
        String createdBy,
        Instant nextDueAt,    // due 커서, null이면 더 이상 실행 없음
        Instant createdAt,
        Instant updatedAt
) {
    public ScheduledJob {
        tags = tags == null ? List.of() : List.copyOf(tags);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean isDueAt(Instant now) {
        return enabled && nextDueAt != null && !nextDueAt.isAfter(now);
    }

    public ScheduledJob withNextDueAt(Instant next, Instant now) {
        return new ScheduledJob(id, name, description, kind, schedule, parameters, enabled, maxRetries,
                timeout, priority, tags, metadata, createdBy, next, createdAt, now);
    }

    public ScheduledJob withEnabled(boolean on, Instant next, Instant now) {
        return new ScheduledJob(id, name, description, kind, schedule, parameters, on, maxRetries,
                timeout, priority, tags, metadata, createdBy, next, createdAt, now);
    }
}
