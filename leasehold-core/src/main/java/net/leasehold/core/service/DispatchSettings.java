package net.leasehold.core.service;

import net.leasehold.core.error.ConfigurationException;

import java.time.Duration;

public record DispatchSettings(
        Duration lease,
        int maxConcurrent,
        Duration defaultTimeout,
        int candidateBatchSize,
        Duration leaseRenewalInterval,   // ZERO = 갱신 안 함
        Duration shutdownGrace
) {
    public DispatchSettings {
        if (maxConcurrent <= 0) throw new ConfigurationException("maxConcurrent must be positive");
        if (candidateBatchSize <= 0) throw new ConfigurationException("candidateBatchSize must be positive");
        if (lease.compareTo(defaultTimeout) <= 0) {
            throw new ConfigurationException("lock lease (" + lease + ") must exceed the default job timeout ("
                    + defaultTimeout + ")");
        }
        if (leaseRenewalInterval == null) leaseRenewalInterval = Duration.ZERO;
        if (shutdownGrace == null) shutdownGrace = Duration.ofSeconds(10);
    }

    public static DispatchSettings defaults() {
        return new DispatchSettings(Duration.ofSeconds(360), 10, Duration.ofSeconds(300), 50,
                Duration.ZERO, Duration.ofSeconds(10));
    }

    public boolean renewalEnabled() {
        return !leaseRenewalInterval.isZero() && !leaseRenewalInterval.isNegative();
    }
}
