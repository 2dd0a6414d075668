package net.leasehold.bootstrap.metrics;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import net.leasehold.core.service.DispatchService;
import net.leasehold.core.service.SchedulerMetrics;

import java.util.function.ToDoubleFunction;

/** 인스턴스 로컬 카운터를 Micrometer 로 노출 */
public class SchedulerMeterBinder implements MeterBinder {
    static final String PREFIX = "leasehold.scheduler.";

    private final SchedulerMetrics metrics;
    private final DispatchService dispatch;
    private final String instanceId;

    public SchedulerMeterBinder(SchedulerMetrics metrics, DispatchService dispatch, String instanceId) {
        this.metrics = metrics;
        this.dispatch = dispatch;
        this.instanceId = instanceId;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        counter(registry, "dispatched", "executions started", SchedulerMetrics::dispatchedCount);
        counter(registry, "retries", "retry attempts", SchedulerMetrics::retriedCount);
        counter(registry, "lock.conflicts", "lock attempts lost to another holder", SchedulerMetrics::lockConflictCount);
        counter(registry, "lock.takeovers", "expired leases taken over", SchedulerMetrics::takeoverCount);
        counter(registry, "tick.errors", "ticks aborted by store errors", SchedulerMetrics::tickErrorCount);

        outcome(registry, "succeeded", SchedulerMetrics::succeededCount);
        outcome(registry, "failed", SchedulerMetrics::failedCount);
        outcome(registry, "timed_out", SchedulerMetrics::timedOutCount);
        outcome(registry, "cancelled", SchedulerMetrics::cancelledCount);

        Gauge.builder(PREFIX + "running", dispatch, d -> d.runningExecutionIds().size())
                .description("executions running on this instance")
                .tag("instance", instanceId)
                .register(registry);
    }

    private void counter(MeterRegistry registry, String name, String description,
                         ToDoubleFunction<SchedulerMetrics> fn) {
        FunctionCounter.builder(PREFIX + name, metrics, fn)
                .description(description)
                .tag("instance", instanceId)
                .register(registry);
    }

    private void outcome(MeterRegistry registry, String status, ToDoubleFunction<SchedulerMetrics> fn) {
        FunctionCounter.builder(PREFIX + "completed", metrics, fn)
                .description("finished executions by status")
                .tag("instance", instanceId)
                .tag("status", status)
                .register(registry);
    }
}
