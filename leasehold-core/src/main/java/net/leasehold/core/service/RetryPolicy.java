package net.leasehold.core.service;

import java.time.Duration;

public interface RetryPolicy {
    /** attempt 번째 재시도 전 대기 시간 (1부터) */
    Duration nextBackoff(long attempt);

    /** 고정 백오프 정책 */
    static RetryPolicy fixed(Duration backoff) {
        return attempt -> backoff;
    }

    /** base, base*2, base*4 ... max 상한 */
    static RetryPolicy exponential(Duration base, Duration max) {
        return new ExponentialRetryPolicy(base, max);
    }
}
