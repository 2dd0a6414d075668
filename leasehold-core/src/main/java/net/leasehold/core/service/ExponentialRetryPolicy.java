package net.leasehold.core.service;

import java.time.Duration;

final class ExponentialRetryPolicy implements RetryPolicy {
    private final Duration base;
    private final Duration max;

    ExponentialRetryPolicy(Duration base, Duration max) {
        if (base.isNegative() || max.compareTo(base) < 0) {
            throw new IllegalArgumentException("invalid backoff range: base=" + base + ", max=" + max);
        }
        this.base = base;
        this.max = max;
    }

    @Override
    public Duration nextBackoff(long attempt) {
        long shift = Math.max(0, Math.min(attempt - 1, 30));
        long millis = base.toMillis();
        // 오버플로 전에 상한 적용
        if (millis > 0 && millis > (max.toMillis() >> shift)) return max;
        Duration d = Duration.ofMillis(millis << shift);
        return d.compareTo(max) > 0 ? max : d;
    }
}
