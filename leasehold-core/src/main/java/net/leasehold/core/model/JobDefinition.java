package net.leasehold.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import net.leasehold.core.error.ConfigurationException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 잡 생성/수정 입력값.
 * 식별자, 타임스탬프, due 커서는 스케줄러가 채운다.
 */
public record JobDefinition(
        String name,
        String description,
        String kind,
        String schedule,
        JsonNode parameters,
        boolean enabled,
        int maxRetries,
        Duration timeout,
        int priority,
        List<String> tags,
        Map<String, String> metadata,   // 자유 형식 key/value, 스케줄러는 해석하지 않는다
        String createdBy
) {
    public static final int DEFAULT_MAX_RETRIES = 3;

    public JobDefinition {
        tags = tags == null ? List.of() : List.copyOf(tags);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static JobDefinition of(String name, String kind, String schedule, String createdBy) {
        return new JobDefinition(name, null, kind, schedule, null, true,
                DEFAULT_MAX_RETRIES, null, 0, List.of(), Map.of(), createdBy);
    }

    public JobDefinition withDescription(String v) {
        return new JobDefinition(name, v, kind, schedule, parameters, enabled, maxRetries, timeout, priority, tags, metadata, createdBy);
    }

    public JobDefinition withParameters(JsonNode v) {
        return new JobDefinition(name, description, kind, schedule, v, enabled, maxRetries, timeout, priority, tags, metadata, createdBy);
    }

    public JobDefinition withEnabled(boolean v) {
        return new JobDefinition(name, description, kind, schedule, parameters, v, maxRetries, timeout, priority, tags, metadata, createdBy);
    }

    public JobDefinition withMaxRetries(int v) {
        return new JobDefinition(name, description, kind, schedule, parameters, enabled, v, timeout, priority, tags, metadata, createdBy);
    }

    public JobDefinition withTimeout(Duration v) {
        return new JobDefinition(name, description, kind, schedule, parameters, enabled, maxRetries, v, priority, tags, metadata, createdBy);
    }

    public JobDefinition withPriority(int v) {
        return new JobDefinition(name, description, kind, schedule, parameters, enabled, maxRetries, timeout, v, tags, metadata, createdBy);
    }

    public JobDefinition withTags(List<String> v) {
        return new JobDefinition(name, description, kind, schedule, parameters, enabled, maxRetries, timeout, priority, v, metadata, createdBy);
    }

    public JobDefinition withMetadata(Map<String, String> v) {
        return new JobDefinition(name, description, kind, schedule, parameters, enabled, maxRetries, timeout, priority, tags, v, createdBy);
    }

    public JobDefinition withMetadata(String key, String value) {
        Map<String, String> merged = new LinkedHashMap<>(metadata);
        merged.put(key, value);
        return withMetadata(merged);
    }

    /** 필드 단위 검증. cron 파싱과 kind 등록 여부는 서비스에서 확인한다. */
    public void validate() {
        requireText(name, "name");
        requireText(kind, "kind");
        requireText(schedule, "schedule");
        requireText(createdBy, "createdBy");
        if (maxRetries < 0) {
            throw new ConfigurationException("maxRetries must be >= 0 (was " + maxRetries + ")");
        }
        metadata.forEach((k, v) -> {
            if (k.isBlank()) throw new ConfigurationException("metadata keys must not be blank");
        });
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new ConfigurationException("timeout must be positive (was " + timeout + ")");
        }
    }

    private static void requireText(String v, String field) {
        if (v == null || v.isBlank()) {
            throw new ConfigurationException("job " + field + " is required");
        }
    }
}
