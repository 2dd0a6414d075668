package net.leasehold.core.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.leasehold.core.error.JobNotFoundException;
import net.leasehold.core.executor.CancelSignal;
import net.leasehold.core.executor.ExecutionContext;
import net.leasehold.core.executor.ExecutionResult;
import net.leasehold.core.executor.ExecutorRegistry;
import net.leasehold.core.executor.JobExecutor;
import net.leasehold.core.lock.LockManager;
import net.leasehold.core.lock.LockToken;
import net.leasehold.core.model.JobExecution;
import net.leasehold.core.model.ScheduledJob;
import net.leasehold.core.spi.Clock;
import net.leasehold.core.spi.JobExecutionRepository;
import net.leasehold.core.spi.JobRepository;
import net.leasehold.core.spi.ScheduleEvaluator;
import net.leasehold.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 폴링 한 번(tick)마다:
 * due 후보 조회 → 우선순위 순으로 락 시도 → 커서 전진 + 실행 행 생성 → 실행기 호출(타임아웃/재시도) → 기록 → 락 해제.
 * 인스턴스당 동시 실행 수는 슬롯(세마포어)으로 제한하고, 슬롯이 없으면 다음 tick 으로 미룬다.
 */
public final class DispatchService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DispatchService.class);

    static final int MAX_ERROR_LENGTH = 4000;
    private static final ObjectMapper PAYLOAD_CHECK = new ObjectMapper();

    private final JobRepository jobs;
    private final JobExecutionRepository executions;
    private final LockManager locks;
    private final ExecutorRegistry registry;
    private final ScheduleEvaluator evaluator;
    private final TxRunner tx;
    private final Clock clock;
    private final SchedulerMetrics metrics;
    private final DispatchSettings settings;
    private final RetryPolicy retryPolicy;
    private final Jitter jitter;
    private final ZoneId zone;
    private final String instanceId;

    private final Semaphore slots;
    private final ExecutorService supervisors;
    private final ExecutorService workers;
    private final ScheduledExecutorService renewals;   // null = 리스 갱신 안 함
    private final Map<String, Running> running = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile boolean started;

    public DispatchService(JobRepository jobs,
                           JobExecutionRepository executions,
                           LockManager locks,
                           ExecutorRegistry registry,
                           ScheduleEvaluator evaluator,
                           TxRunner tx,
                           Clock clock,
                           SchedulerMetrics metrics,
                           DispatchSettings settings,
                           RetryPolicy retryPolicy,
                           Jitter jitter,
                           ZoneId zone,
                           String instanceId) {
        this.jobs = jobs;
        this.executions = executions;
        this.locks = locks;
        this.registry = registry;
        this.evaluator = evaluator;
        this.tx = tx;
        this.clock = clock;
        this.metrics = metrics;
        this.settings = settings;
        this.retryPolicy = retryPolicy;
        this.jitter = jitter;
        this.zone = zone;
        this.instanceId = instanceId;

        this.slots = new Semaphore(settings.maxConcurrent());
        this.supervisors = Executors.newFixedThreadPool(settings.maxConcurrent(), named("leasehold-dispatch", false));
        // 취소를 무시하는 실행기가 스레드를 붙잡아도 다음 실행이 막히지 않도록 고정 크기로 두지 않는다
        this.workers = Executors.newCachedThreadPool(named("leasehold-worker", true));
        this.renewals = settings.renewalEnabled()
                ? Executors.newSingleThreadScheduledExecutor(named("leasehold-renewal", true))
                : null;
    }

    /** 스토어에 있는 모든 kind 가 등록됐는지 검증. 통과해야 tick 이 동작한다. */
    public void start() throws Exception {
        if (closed.get()) throw new IllegalStateException("dispatch service is closed");
        Set<String> kinds = tx.required(jobs::findDistinctKinds);
        registry.validate(kinds);
        started = true;
        log.info("dispatch started: instance={}, maxConcurrent={}, lease={}, kinds={}",
                instanceId, settings.maxConcurrent(), settings.lease(), registry.kinds());
    }

    public boolean isStarted() {
        return started;
    }

    /** @return 이번 tick 에서 실행을 시작한 잡 수 */
    public int tick() {
        if (!started || closed.get()) return 0;
        if (slots.availablePermits() == 0) {
            log.debug("all {} execution slots busy, tick deferred", settings.maxConcurrent());
            return 0;
        }

        Instant now = clock.now();
        List<ScheduledJob> candidates;
        try {
            candidates = tx.required(() -> jobs.findDueCandidates(now, settings.candidateBatchSize()));
        } catch (Exception e) {
            metrics.tickError();
            log.warn("due job query failed, tick aborted: {}", e.toString());
            return 0;
        }

        int dispatched = 0;
        for (int i = 0; i < candidates.size(); i++) {
            ScheduledJob job = candidates.get(i);
            if (!registry.supports(job.kind())) {
                log.warn("job '{}' has unregistered kind '{}', skipped", job.name(), job.kind());
                continue;
            }
            if (!slots.tryAcquire()) {
                log.debug("concurrency cap reached, {} due job(s) deferred to next tick", candidates.size() - i);
                break;
            }
            boolean handedOff = false;
            try {
                Optional<Claim> claim = claim(job.id(), job.nextDueAt(), now, true);
                if (claim.isPresent()) {
                    launch(claim.get());
                    handedOff = true;
                    dispatched++;
                }
            } catch (Exception e) {
                metrics.tickError();
                log.warn("dispatch of job '{}' failed, tick aborted: {}", job.name(), e.toString());
                break;
            } finally {
                if (!handedOff) slots.release();
            }
        }
        return dispatched;
    }

    /**
     * 스케줄과 무관하게 즉시 실행. due 커서는 움직이지 않고 일시정지된 잡도 허용한다.
     * 락은 정상 경로와 동일하게 획득한다.
     *
     * @return 실행 id. 다른 인스턴스가 보유 중이거나 슬롯이 없으면 empty
     */
    public Optional<String> triggerNow(String jobId) throws Exception {
        if (closed.get()) throw new IllegalStateException("dispatch service is closed");
        ScheduledJob job = tx.required(() -> jobs.findById(jobId)).orElseThrow(() -> new JobNotFoundException(jobId));
        registry.require(job.kind());

        if (!slots.tryAcquire()) {
            log.info("manual trigger of job '{}' refused: all {} execution slots busy",
                    job.name(), settings.maxConcurrent());
            return Optional.empty();
        }
        boolean handedOff = false;
        try {
            Optional<Claim> claim = claim(jobId, null, clock.now(), false);
            if (claim.isEmpty()) return Optional.empty();
            launch(claim.get());
            handedOff = true;
            return Optional.of(claim.get().execution().id());
        } finally {
            if (!handedOff) slots.release();
        }
    }

    /** 이 인스턴스에서 실행 중인 실행을 취소. 없으면 false */
    public boolean cancel(String executionId) {
        Running run = running.get(executionId);
        if (run == null) return false;
        log.info("cancelling execution {} of job '{}'", executionId, run.claim.job().name());
        run.requestCancel("cancelled by administrator");
        return true;
    }

    public Set<String> runningExecutionIds() {
        return Set.copyOf(running.keySet());
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        started = false;
        log.info("dispatch shutting down, cancelling {} running execution(s)", running.size());
        running.values().forEach(r -> r.requestCancel("scheduler shutting down"));

        supervisors.shutdown();
        try {
            if (!supervisors.awaitTermination(settings.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("executions still running after {}, forcing shutdown", settings.shutdownGrace());
                supervisors.shutdownNow();
            }
        } catch (InterruptedException e) {
            supervisors.shutdownNow();
            Thread.currentThread().interrupt();
        }
        workers.shutdownNow();
        if (renewals != null) renewals.shutdownNow();
    }

    // ------------------------------------------------------------------
    // claim
    // ------------------------------------------------------------------

    /**
     * 한 트랜잭션에서: 잡 행 잠금 → 락 획득 → (스케줄 경로면) 커서 CAS 전진 → RUNNING 실행 행 생성.
     * 실패로 롤백되면 프로세스 로컬 락이 남지 않도록 해제를 시도한다.
     */
    private Optional<Claim> claim(String jobId, Instant expectedDueAt, Instant now, boolean scheduled) throws Exception {
        AtomicReference<LockToken> acquired = new AtomicReference<>();
        try {
            return tx.requiresNew(() -> {
                ScheduledJob job = jobs.findByIdForUpdate(jobId).orElse(null);
                if (job == null) {
                    log.debug("job {} vanished before dispatch", jobId);
                    return Optional.<Claim>empty();
                }
                if (scheduled && (!job.isDueAt(now) || !job.nextDueAt().equals(expectedDueAt))) {
                    log.debug("occurrence {} of job '{}' already dispatched, skipped", expectedDueAt, job.name());
                    return Optional.<Claim>empty();
                }

                Optional<LockToken> token = locks.tryAcquire(job.id(), instanceId, settings.lease());
                if (token.isEmpty()) {
                    metrics.lockConflict();
                    return Optional.<Claim>empty();
                }
                acquired.set(token.get());

                if (scheduled) {
                    Instant next = nextDueAfter(job, now);
                    if (!jobs.advanceCursor(job.id(), job.nextDueAt(), next, now)) {
                        throw new IllegalStateException("due cursor of job " + job.id() + " moved under row lock");
                    }
                }
                Map<String, String> meta = scheduled
                        ? Map.of(JobExecution.TRIGGER, "schedule", JobExecution.SCHEDULED_FOR, job.nextDueAt().toString())
                        : Map.of(JobExecution.TRIGGER, "manual");
                JobExecution exec = JobExecution.running(token.get().executionId(), job.id(), now, instanceId, meta);
                executions.insert(exec);
                return Optional.of(new Claim(job, token.get(), exec));
            });
        } catch (Exception e) {
            LockToken t = acquired.get();
            if (t != null) releaseQuietly(t);
            throw e;
        }
    }

    private Instant nextDueAfter(ScheduledJob job, Instant now) {
        Optional<Instant> next = evaluator.nextDue(job.schedule(), now, zone);
        if (next.isEmpty()) {
            log.info("schedule '{}' of job '{}' has no further occurrence, job will not be due again",
                    job.schedule(), job.name());
        }
        return next.map(jitter::apply).orElse(null);
    }

    // ------------------------------------------------------------------
    // execution
    // ------------------------------------------------------------------

    private void launch(Claim claim) {
        Running run = new Running(claim);
        running.put(run.executionId(), run);
        metrics.dispatched();
        log.info("dispatching job '{}' (kind={}, execution={})",
                claim.job().name(), claim.job().kind(), run.executionId());
        try {
            supervisors.execute(() -> supervise(run));
        } catch (RejectedExecutionException e) {
            log.warn("execution {} rejected by supervisor pool, recording as cancelled", run.executionId());
            run.requestCancel("scheduler shutting down");
            complete(run, Outcome.cancelled(run.cancelReason, 0));
        }
    }

    private void supervise(Running run) {
        ScheduledFuture<?> renewal = scheduleRenewal(run);
        Outcome outcome = null;
        try {
            outcome = attempt(run);
        } catch (RuntimeException e) {
            log.error("execution {} aborted unexpectedly", run.executionId(), e);
            outcome = Outcome.failed(e.toString(), 0);
        } finally {
            if (renewal != null) renewal.cancel(false);
            complete(run, outcome != null ? outcome : Outcome.failed("execution aborted", 0));
        }
    }

    /** 재시도와 백오프는 같은 락 보유 안에서. 타임아웃은 재시도를 포함한 전체 시간에 적용. */
    private Outcome attempt(Running run) {
        ScheduledJob job = run.claim.job();
        JobExecutor executor = registry.require(job.kind());
        Duration timeout = job.timeout() != null ? job.timeout() : settings.defaultTimeout();
        long deadline = System.nanoTime() + timeout.toNanos();

        int retry = 0;
        while (true) {
            if (run.cancelRequested()) return Outcome.cancelled(run.cancelReason, retry);
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) return timedOut(run, null, timeout, retry);

            ExecutionContext ctx = new ExecutionContext(run.executionId(), job.id(), job.name(),
                    job.parameters(), retry, run.signal);
            Future<ExecutionResult> f;
            try {
                f = workers.submit(() -> executor.execute(ctx));
            } catch (RejectedExecutionException e) {
                return Outcome.cancelled("scheduler shutting down", retry);
            }
            run.current = f;
            try {
                ExecutionResult r = f.get(remaining, TimeUnit.NANOSECONDS);
                return Outcome.succeeded(r == null ? null : r.payload(), retry);
            } catch (TimeoutException e) {
                return timedOut(run, f, timeout, retry);
            } catch (CancellationException e) {
                return Outcome.cancelled(run.cancelReason, retry);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                run.requestCancel("scheduler shutting down");
                return Outcome.cancelled(run.cancelReason, retry);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                if (run.cancelRequested()) return Outcome.cancelled(run.cancelReason, retry);
                if (retry >= job.maxRetries()) return Outcome.failed(cause.toString(), retry);

                retry++;
                metrics.retried();
                persistRetryCount(run, retry);
                Duration backoff = retryPolicy.nextBackoff(retry);
                log.info("job '{}' attempt failed ({}), retry {}/{} in {}",
                        job.name(), cause.toString(), retry, job.maxRetries(), backoff);

                long wait = Math.min(backoff.toNanos(), Math.max(0, deadline - System.nanoTime()));
                try {
                    if (run.signal.await(Duration.ofNanos(wait))) return Outcome.cancelled(run.cancelReason, retry);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    run.requestCancel("scheduler shutting down");
                    return Outcome.cancelled(run.cancelReason, retry);
                }
            } finally {
                run.current = null;
            }
        }
    }

    // 실행기가 취소를 확인하든 말든 기다리지 않는다
    private Outcome timedOut(Running run, Future<?> f, Duration timeout, int retry) {
        run.signal.cancel();
        if (f != null) f.cancel(true);
        return Outcome.timedOut("timed out after " + timeout, retry);
    }

    private void persistRetryCount(Running run, int retry) {
        try {
            tx.required(() -> executions.updateRetryCount(run.executionId(), retry));
        } catch (Exception e) {
            log.warn("could not persist retry count {} of execution {}: {}", retry, run.executionId(), e.toString());
        }
    }

    private ScheduledFuture<?> scheduleRenewal(Running run) {
        if (renewals == null) return null;
        long every = settings.leaseRenewalInterval().toMillis();
        return renewals.scheduleWithFixedDelay(() -> renew(run), every, every, TimeUnit.MILLISECONDS);
    }

    private void renew(Running run) {
        try {
            Optional<LockToken> renewed = locks.renew(run.token, settings.lease());
            if (renewed.isPresent()) {
                run.token = renewed.get();
            } else {
                run.requestCancel("lease lost");
            }
        } catch (Exception e) {
            log.warn("lease renewal for execution {} failed: {}", run.executionId(), e.toString());
        }
    }

    // 기록과 해제는 한 트랜잭션. 기록이 실패하면 락을 남겨 리스 만료 → reaper 가 TIMED_OUT 으로 종결하게 한다
    private void complete(Running run, Outcome outcome) {
        try {
            recordOutcome(run, serializable(run, outcome));
        } finally {
            slots.release();
            running.remove(run.executionId());
        }
    }

    // 저장할 수 없는 결과 payload 는 FAILED 로 바꿔 기록한다
    private Outcome serializable(Running run, Outcome o) {
        if (o.result() == null) return o;
        try {
            PAYLOAD_CHECK.writeValueAsString(o.result());
            return o;
        } catch (JsonProcessingException e) {
            log.warn("result of execution {} cannot be stored as JSON: {}", run.executionId(), e.getOriginalMessage());
            return Outcome.failed("unserializable result payload: " + e.getOriginalMessage(), o.retryCount());
        }
    }

    private void recordOutcome(Running run, Outcome o) {
        ScheduledJob job = run.claim.job();
        Instant end = clock.now();
        Duration took = Duration.between(run.claim.execution().startedAt(), end);
        Duration duration = took.isNegative() ? Duration.ZERO : took;
        String error = truncate(o.error());
        try {
            boolean finished = tx.required(() -> {
                boolean f = executions.finish(run.executionId(), o.status(), end, duration, o.result(), error);
                locks.release(run.token);
                return f;
            });
            if (!finished) {
                log.warn("execution {} of job '{}' was already finalized, outcome {} discarded",
                        run.executionId(), job.name(), o.status());
            }
        } catch (Exception e) {
            log.warn("recording outcome {} of execution {} failed, lock on job '{}' left to lease expiry: {}",
                    o.status(), run.executionId(), job.name(), e.toString());
            return;
        }

        switch (o.status()) {
            case SUCCEEDED -> {
                metrics.succeeded();
                log.info("job '{}' succeeded (execution={}, retries={}, took={})",
                        job.name(), run.executionId(), o.retryCount(), duration);
            }
            case FAILED -> {
                metrics.failed();
                log.warn("job '{}' failed after {} retries (execution={}): {}",
                        job.name(), o.retryCount(), run.executionId(), o.error());
            }
            case TIMED_OUT -> {
                metrics.timedOut();
                log.warn("job '{}' timed out (execution={}): {}", job.name(), run.executionId(), o.error());
            }
            case CANCELLED -> {
                metrics.cancelled();
                log.info("job '{}' cancelled (execution={}): {}", job.name(), run.executionId(), o.error());
            }
            default -> log.warn("job '{}' ended with unexpected status {}", job.name(), o.status());
        }
    }

    private void releaseQuietly(LockToken token) {
        try {
            locks.release(token);
        } catch (Exception e) {
            log.warn("lock release for job {} failed, left to lease expiry: {}", token.jobId(), e.toString());
        }
    }

    static String truncate(String s) {
        if (s == null || s.length() <= MAX_ERROR_LENGTH) return s;
        return s.substring(0, MAX_ERROR_LENGTH);
    }

    private static ThreadFactory named(String prefix, boolean daemon) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(daemon);
            return t;
        };
    }

    // ------------------------------------------------------------------

    private record Claim(ScheduledJob job, LockToken token, JobExecution execution) {}

    private record Outcome(JobExecution.Status status, JsonNode result, String error, int retryCount) {
        static Outcome succeeded(JsonNode result, int retry) { return new Outcome(JobExecution.Status.SUCCEEDED, result, null, retry); }
        static Outcome failed(String error, int retry) { return new Outcome(JobExecution.Status.FAILED, null, error, retry); }
        static Outcome timedOut(String error, int retry) { return new Outcome(JobExecution.Status.TIMED_OUT, null, error, retry); }
        static Outcome cancelled(String reason, int retry) { return new Outcome(JobExecution.Status.CANCELLED, null, reason, retry); }
    }

    private static final class Running {
        final Claim claim;
        final CancelSignal signal = new CancelSignal();
        volatile LockToken token;
        volatile Future<?> current;
        volatile String cancelReason;

        Running(Claim claim) {
            this.claim = claim;
            this.token = claim.token();
        }

        String executionId() { return claim.execution().id(); }

        boolean cancelRequested() { return cancelReason != null; }

        void requestCancel(String reason) {
            if (cancelReason == null) cancelReason = reason;
            signal.cancel();
            Future<?> f = current;
            if (f != null) f.cancel(true);
        }
    }
}
