package net.leasehold.adapter.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import net.leasehold.core.error.ConfigurationException;
import net.leasehold.core.executor.ExecutionContext;
import net.leasehold.core.executor.ExecutionResult;
import net.leasehold.core.executor.ExecutorRegistry;
import net.leasehold.core.executor.JobExecutor;
import net.leasehold.core.lock.LeaseLockManager;
import net.leasehold.core.lock.LockManager;
import net.leasehold.core.maintenance.StaleLockReaper;
import net.leasehold.core.model.JobExecution;
import net.leasehold.core.model.JobLock;
import net.leasehold.core.model.LockStats;
import net.leasehold.core.model.ScheduledJob;
import net.leasehold.core.service.DispatchService;
import net.leasehold.core.service.DispatchSettings;
import net.leasehold.core.service.Jitter;
import net.leasehold.core.service.RetryPolicy;
import net.leasehold.core.service.SchedulerMetrics;
import net.leasehold.core.spi.JobExecutionRepository;
import net.leasehold.core.spi.ScheduleEvaluator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * tick → 락 → 실행 → 기록 → 해제 전체 흐름
 * - 스케줄 평가는 "지금 + 60초" 고정
 */
class DispatchServiceAcceptanceTest extends TestSupport {
    static final Duration LEASE = Duration.ofSeconds(360);
    static final ScheduleEvaluator EVERY_MINUTE = (schedule, after, zone) -> Optional.of(after.plusSeconds(60));

    final List<DispatchService> opened = new ArrayList<>();
    SchedulerMetrics metrics;

    @AfterEach
    void closeAll() {
        opened.forEach(DispatchService::close);
        opened.clear();
    }

    DispatchService dispatcher(String instanceId, int maxConcurrent, JobExecutor... executors) {
        return dispatcher(instanceId, maxConcurrent, Duration.ZERO, executions, executors);
    }

    DispatchService dispatcher(String instanceId, int maxConcurrent, Duration renewEvery,
                               JobExecutionRepository store, JobExecutor... executors) {
        metrics = new SchedulerMetrics();
        LockManager locks = new LeaseLockManager(lockRepo, executions, tx, clock, metrics);
        DispatchSettings settings = new DispatchSettings(LEASE, maxConcurrent, Duration.ofSeconds(300), 50,
                renewEvery, Duration.ofSeconds(2));
        DispatchService d = new DispatchService(jobs, store, locks, new ExecutorRegistry(List.of(executors)),
                EVERY_MINUTE, tx, clock, metrics, settings, RetryPolicy.fixed(Duration.ofMillis(20)),
                Jitter.none(), ZoneOffset.UTC, instanceId);
        opened.add(d);
        return d;
    }

    LockStats lockStats() throws Exception {
        return tx.required(lockRepo::stats);
    }

    List<JobExecution> history(String jobId) throws Exception {
        return tx.required(() -> executions.findByJob(jobId, 100));
    }

    JobExecution awaitTerminal(String jobId) {
        await().atMost(10, TimeUnit.SECONDS).until(() ->
                history(jobId).stream().anyMatch(e -> e.status().terminal()));
        try {
            return history(jobId).get(0);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    // ========== 정상 경로 ==========

    @Test
    void due_job_runs_once_and_cursor_advances() throws Exception {
        ScheduledJob job = seedJob("report", "echo", 0, T0.minusSeconds(1));
        DispatchService d = dispatcher("host-a:1", 4, new Scripted("echo", ctx ->
                ExecutionResult.of(JsonNodeFactory.instance.objectNode().put("job", ctx.jobName()))));
        d.start();

        assertThat(d.tick()).isEqualTo(1);
        JobExecution exec = awaitTerminal(job.id());

        assertThat(exec.status()).isEqualTo(JobExecution.Status.SUCCEEDED);
        assertThat(exec.result().get("job").asText()).isEqualTo("report");
        assertThat(exec.instanceId()).isEqualTo("host-a:1");
        assertThat(exec.retryCount()).isZero();
        assertThat(reload(job.id()).nextDueAt()).isEqualTo(T0.plusSeconds(60));

        await().atMost(5, TimeUnit.SECONDS).until(() -> d.runningExecutionIds().isEmpty());
        LockStats stats = tx.required(lockRepo::stats);
        assertThat(stats.acquired()).isZero();
        assertThat(stats.released()).isEqualTo(1);

        // 커서가 미래로 갔으므로 같은 시각의 다음 tick 은 아무것도 하지 않는다
        assertThat(d.tick()).isZero();
        assertThat(history(job.id())).hasSize(1);
    }

    @Test
    void higher_priority_wins_the_only_slot() throws Exception {
        ScheduledJob low = seedJob("low", "gate", 1, T0.minusSeconds(10));
        ScheduledJob high = seedJob("high", "gate", 10, T0.minusSeconds(1));
        CountDownLatch gate = new CountDownLatch(1);
        DispatchService d = dispatcher("host-a:1", 1, new Scripted("gate", ctx -> {
            gate.await(5, TimeUnit.SECONDS);
            return ExecutionResult.empty();
        }));
        d.start();

        assertThat(d.tick()).isEqualTo(1);
        assertThat(history(high.id())).hasSize(1);
        assertThat(history(low.id())).isEmpty();

        // 슬롯이 비어 있지 않으면 나머지는 다음 tick 으로
        assertThat(d.tick()).isZero();

        gate.countDown();
        awaitTerminal(high.id());
        await().atMost(5, TimeUnit.SECONDS).until(() -> d.runningExecutionIds().isEmpty());

        assertThat(d.tick()).isEqualTo(1);
        assertThat(awaitTerminal(low.id()).status()).isEqualTo(JobExecution.Status.SUCCEEDED);
    }

    @Test
    void transient_failures_are_retried_within_one_execution() throws Exception {
        ScheduledJob job = seedJob("flaky", "flaky", 0, T0, true, 3, null);
        AtomicInteger calls = new AtomicInteger();
        DispatchService d = dispatcher("host-a:1", 2, new Scripted("flaky", ctx -> {
            if (calls.incrementAndGet() <= 2) throw new IllegalStateException("boom " + ctx.retryCount());
            return ExecutionResult.empty();
        }));
        d.start();

        d.tick();
        JobExecution exec = awaitTerminal(job.id());

        assertThat(exec.status()).isEqualTo(JobExecution.Status.SUCCEEDED);
        assertThat(exec.retryCount()).isEqualTo(2);
        assertThat(calls.get()).isEqualTo(3);
        assertThat(history(job.id())).hasSize(1);
        assertThat(metrics.retriedCount()).isEqualTo(2);
    }

    @Test
    void retries_are_bounded_by_max_retries() throws Exception {
        ScheduledJob job = seedJob("broken", "broken", 0, T0, true, 2, null);
        AtomicInteger calls = new AtomicInteger();
        DispatchService d = dispatcher("host-a:1", 2, new Scripted("broken", ctx -> {
            calls.incrementAndGet();
            throw new IllegalStateException("always broken");
        }));
        d.start();

        d.tick();
        JobExecution exec = awaitTerminal(job.id());

        assertThat(exec.status()).isEqualTo(JobExecution.Status.FAILED);
        assertThat(exec.retryCount()).isEqualTo(2);
        assertThat(exec.error()).contains("always broken");
        assertThat(calls.get()).isEqualTo(3);
        await().atMost(5, TimeUnit.SECONDS).until(() -> tx.required(lockRepo::stats).acquired() == 0);
    }

    @Test
    void slow_job_times_out_and_lock_is_released() throws Exception {
        ScheduledJob job = seedJob("slow", "sleepy", 0, T0, true, 0, Duration.ofMillis(200));
        DispatchService d = dispatcher("host-a:1", 2, new Scripted("sleepy", ctx -> {
            Thread.sleep(10_000);
            return ExecutionResult.empty();
        }));
        d.start();

        d.tick();
        JobExecution exec = awaitTerminal(job.id());

        assertThat(exec.status()).isEqualTo(JobExecution.Status.TIMED_OUT);
        assertThat(exec.error()).startsWith("timed out after");
        await().atMost(5, TimeUnit.SECONDS).until(() -> tx.required(lockRepo::stats).acquired() == 0);
        assertThat(metrics.timedOutCount()).isEqualTo(1);
    }

    @Test
    void disabled_job_is_never_dispatched_by_tick() throws Exception {
        ScheduledJob job = seedJob("paused", "echo", 0, T0.minusSeconds(5), false, 3, null);
        DispatchService d = dispatcher("host-a:1", 2, new Scripted("echo", ctx -> ExecutionResult.empty()));
        d.start();

        clock.advance(Duration.ofHours(1));
        assertThat(d.tick()).isZero();
        assertThat(history(job.id())).isEmpty();
        assertThat(reload(job.id()).nextDueAt()).isEqualTo(T0.minusSeconds(5));
    }

    @Test
    void scheduled_execution_records_its_trigger() throws Exception {
        ScheduledJob job = seedJob("traced", "echo", 0, T0.minusSeconds(1));
        DispatchService d = dispatcher("host-a:1", 2, new Scripted("echo", ctx -> ExecutionResult.empty()));
        d.start();

        d.tick();
        JobExecution exec = awaitTerminal(job.id());

        assertThat(exec.metadata())
                .containsEntry(JobExecution.TRIGGER, "schedule")
                .containsEntry(JobExecution.SCHEDULED_FOR, T0.minusSeconds(1).toString());
    }

    // ========== 결과 기록 ==========

    @Test
    void unstorable_result_is_recorded_as_failure_and_lock_released() throws Exception {
        ScheduledJob job = seedJob("opaque", "opaque", 0, T0, true, 0, null);
        DispatchService d = dispatcher("host-a:1", 2, new Scripted("opaque", ctx ->
                ExecutionResult.of(JsonNodeFactory.instance.pojoNode(new Object()))));
        d.start();

        d.tick();
        JobExecution exec = awaitTerminal(job.id());

        assertThat(exec.status()).isEqualTo(JobExecution.Status.FAILED);
        assertThat(exec.error()).startsWith("unserializable result payload");
        assertThat(exec.result()).isNull();
        await().atMost(5, TimeUnit.SECONDS).until(() -> lockStats().acquired() == 0);

        // 다음 발생도 정상적으로 한 행씩
        clock.advance(Duration.ofSeconds(61));
        assertThat(d.tick()).isEqualTo(1);
        await().atMost(10, TimeUnit.SECONDS).until(() ->
                history(job.id()).stream().filter(e -> e.status().terminal()).count() == 2);
        assertThat(history(job.id())).extracting(JobExecution::status)
                .containsOnly(JobExecution.Status.FAILED);
        assertThat(lockStats().released()).isEqualTo(2);
    }

    @Test
    void unrecorded_outcome_keeps_the_lock_until_the_reaper_times_it_out() throws Exception {
        ScheduledJob job = seedJob("unlucky", "echo", 0, T0);
        DispatchService d = dispatcher("host-a:1", 2, Duration.ZERO, new FinishFails(executions),
                new Scripted("echo", ctx -> ExecutionResult.empty()));
        d.start();

        assertThat(d.tick()).isEqualTo(1);
        await().atMost(5, TimeUnit.SECONDS).until(() -> d.runningExecutionIds().isEmpty());

        assertThat(history(job.id())).singleElement()
                .extracting(JobExecution::status).isEqualTo(JobExecution.Status.RUNNING);
        assertThat(lockStats().acquired()).isEqualTo(1);

        // 리스가 살아 있는 동안은 다음 발생이 와도 두 번째 실행이 생기지 않는다
        clock.advance(Duration.ofSeconds(61));
        assertThat(d.tick()).isZero();
        assertThat(history(job.id())).hasSize(1);

        clock.advance(LEASE);
        StaleLockReaper.SweepReport report = new StaleLockReaper(lockRepo, executions, tx, clock).expireStaleLocks();

        assertThat(report.expiredLocks).isEqualTo(1);
        assertThat(report.timedOutExecutions).isEqualTo(1);
        JobExecution exec = history(job.id()).get(0);
        assertThat(exec.status()).isEqualTo(JobExecution.Status.TIMED_OUT);
        assertThat(exec.error()).isEqualTo(JobExecution.LEASE_EXPIRED_ERROR);
    }

    // ========== 리스 갱신 / 종료 ==========

    @Test
    void lost_lease_cancels_the_running_execution() throws Exception {
        ScheduledJob job = seedJob("renewed", "patient", 0, T0);
        CountDownLatch started = new CountDownLatch(1);
        DispatchService d = dispatcher("host-a:1", 2, Duration.ofMillis(50), executions, new Scripted("patient", ctx -> {
            started.countDown();
            ctx.cancel().await(Duration.ofSeconds(10));
            ctx.cancel().throwIfCancelled();
            return ExecutionResult.empty();
        }));
        d.start();

        d.tick();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        JobLock held = tx.required(() -> lockRepo.findActive(job.id())).orElseThrow();

        // 갱신이 몇 번 돌아도 리스가 유효하면 계속 실행 중
        Thread.sleep(200);
        assertThat(d.runningExecutionIds()).hasSize(1);

        // 다른 주체가 리스를 회수
        tx.required(() -> lockRepo.markExpired(held.id(), clock.now()));

        JobExecution exec = awaitTerminal(job.id());
        assertThat(exec.status()).isEqualTo(JobExecution.Status.CANCELLED);
        assertThat(exec.error()).isEqualTo("lease lost");
    }

    @Test
    void close_cancels_in_flight_executions_and_releases_their_locks() throws Exception {
        ScheduledJob first = seedJob("first", "patient", 0, T0);
        ScheduledJob second = seedJob("second", "patient", 0, T0);
        CountDownLatch started = new CountDownLatch(2);
        DispatchService d = dispatcher("host-a:1", 4, new Scripted("patient", ctx -> {
            started.countDown();
            ctx.cancel().await(Duration.ofSeconds(10));
            ctx.cancel().throwIfCancelled();
            return ExecutionResult.empty();
        }));
        d.start();

        assertThat(d.tick()).isEqualTo(2);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        d.close();

        // close 는 shutdown-grace 안에서 기록과 해제까지 마친다
        for (ScheduledJob job : List.of(first, second)) {
            JobExecution exec = history(job.id()).get(0);
            assertThat(exec.status()).isEqualTo(JobExecution.Status.CANCELLED);
            assertThat(exec.error()).isEqualTo("scheduler shutting down");
        }
        assertThat(lockStats().acquired()).isZero();
        assertThat(lockStats().released()).isEqualTo(2);
        assertThat(d.runningExecutionIds()).isEmpty();
        assertThat(d.tick()).isZero();
        assertThatThrownBy(() -> d.triggerNow(first.id())).isInstanceOf(IllegalStateException.class);
    }

    // ========== 다중 인스턴스 ==========

    @Test
    void two_instances_ticking_together_dispatch_a_due_job_once() throws Exception {
        ScheduledJob job = seedJob("shared", "echo", 0, T0.minusSeconds(1));
        DispatchService a = dispatcher("host-a:1", 2, new Scripted("echo", ctx -> ExecutionResult.empty()));
        DispatchService b = dispatcher("host-b:2", 2, new Scripted("echo", ctx -> ExecutionResult.empty()));
        a.start();
        b.start();

        ExecutorService es = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        Future<Integer> fa = es.submit(() -> { start.await(); return a.tick(); });
        Future<Integer> fb = es.submit(() -> { start.await(); return b.tick(); });
        start.countDown();
        int total = fa.get() + fb.get();
        es.shutdown();

        assertThat(total).isEqualTo(1);
        awaitTerminal(job.id());
        assertThat(history(job.id())).hasSize(1);
    }

    // ========== 수동 실행 / 취소 ==========

    @Test
    void trigger_now_runs_without_moving_the_cursor() throws Exception {
        ScheduledJob job = seedJob("manual", "echo", 0, T0.plusSeconds(3600), false, 3, null);
        DispatchService d = dispatcher("host-a:1", 2, new Scripted("echo", ctx -> ExecutionResult.empty()));
        d.start();

        String executionId = d.triggerNow(job.id()).orElseThrow();
        JobExecution exec = awaitTerminal(job.id());

        assertThat(exec.id()).isEqualTo(executionId);
        assertThat(exec.status()).isEqualTo(JobExecution.Status.SUCCEEDED);
        assertThat(exec.metadata()).containsExactly(Map.entry(JobExecution.TRIGGER, "manual"));
        assertThat(reload(job.id()).nextDueAt()).isEqualTo(T0.plusSeconds(3600));
    }

    @Test
    void trigger_now_is_refused_while_another_instance_holds_the_lease() throws Exception {
        ScheduledJob job = seedJob("busy", "gate", 0, T0.plusSeconds(3600));
        CountDownLatch gate = new CountDownLatch(1);
        DispatchService a = dispatcher("host-a:1", 2, new Scripted("gate", ctx -> {
            gate.await(5, TimeUnit.SECONDS);
            return ExecutionResult.empty();
        }));
        DispatchService b = dispatcher("host-b:2", 2, new Scripted("gate", ctx -> ExecutionResult.empty()));
        a.start();
        b.start();

        assertThat(a.triggerNow(job.id())).isPresent();
        assertThat(b.triggerNow(job.id())).isEmpty();

        gate.countDown();
        awaitTerminal(job.id());
        assertThat(history(job.id())).hasSize(1);
    }

    @Test
    void running_execution_can_be_cancelled() throws Exception {
        ScheduledJob job = seedJob("long", "patient", 0, T0);
        CountDownLatch started = new CountDownLatch(1);
        DispatchService d = dispatcher("host-a:1", 2, new Scripted("patient", ctx -> {
            started.countDown();
            ctx.cancel().await(Duration.ofSeconds(10));
            ctx.cancel().throwIfCancelled();
            return ExecutionResult.empty();
        }));
        d.start();

        d.tick();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        String executionId = d.runningExecutionIds().iterator().next();

        assertThat(d.cancel(executionId)).isTrue();
        JobExecution exec = awaitTerminal(job.id());
        assertThat(exec.status()).isEqualTo(JobExecution.Status.CANCELLED);
        assertThat(exec.error()).isEqualTo("cancelled by administrator");
        assertThat(d.cancel("no-such-execution")).isFalse();
    }

    // ========== 기동 검증 ==========

    @Test
    void start_fails_when_store_holds_unregistered_kind() throws Exception {
        seedJob("orphan", "legacy-kind", 0, T0);
        DispatchService d = dispatcher("host-a:1", 2, new Scripted("echo", ctx -> ExecutionResult.empty()));

        assertThatThrownBy(d::start)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("legacy-kind");
        assertThat(d.isStarted()).isFalse();
        assertThat(d.tick()).isZero();
    }

    // ------------------------------------------------------------------

    @FunctionalInterface
    interface Body {
        ExecutionResult run(ExecutionContext ctx) throws Exception;
    }

    record Scripted(String kind, Body body) implements JobExecutor {
        @Override
        public ExecutionResult execute(ExecutionContext ctx) throws Exception {
            return body.run(ctx);
        }
    }

    /** 종결 기록만 실패하는 저장소 */
    record FinishFails(JobExecutionRepository delegate) implements JobExecutionRepository {
        @Override
        public void insert(JobExecution execution) throws Exception {
            delegate.insert(execution);
        }

        @Override
        public boolean finish(String id, JobExecution.Status status, Instant completedAt, Duration duration,
                              JsonNode result, String error) throws Exception {
            throw new SQLTransientConnectionException("store unavailable");
        }

        @Override
        public int updateRetryCount(String id, int retryCount) throws Exception {
            return delegate.updateRetryCount(id, retryCount);
        }

        @Override
        public Optional<JobExecution> findById(String id) throws Exception {
            return delegate.findById(id);
        }

        @Override
        public List<JobExecution> findByJob(String jobId, int limit) throws Exception {
            return delegate.findByJob(jobId, limit);
        }

        @Override
        public int deleteFinishedOlderThan(Instant threshold) throws Exception {
            return delegate.deleteFinishedOlderThan(threshold);
        }
    }
}
