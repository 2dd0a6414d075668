package net.leasehold.core.service;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;

/** due 시각에 [0, max) 범위 난수 오프셋을 더한다 */
public final class Jitter {
    private final long maxMillis;
    private final RandomGenerator random;   // null 이면 ThreadLocalRandom

    public Jitter(Duration max) {
        this(max, null);
    }

    public Jitter(Duration max, RandomGenerator random) {
        this.maxMillis = max == null ? 0 : max.toMillis();
        this.random = random;
    }

    public static Jitter none() { return new Jitter(Duration.ZERO); }

    public Instant apply(Instant due) {
        if (due == null || maxMillis <= 0) return due;
        RandomGenerator r = random != null ? random : ThreadLocalRandom.current();
        return due.plusMillis(r.nextLong(maxMillis));
    }
}
