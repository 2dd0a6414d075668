package net.leasehold.core.service;

import net.leasehold.core.error.ConfigurationException;
import net.leasehold.core.error.JobNotFoundException;
import net.leasehold.core.executor.ExecutorRegistry;
import net.leasehold.core.executor.JobExecutor;
import net.leasehold.core.lock.LockManager;
import net.leasehold.core.model.JobDefinition;
import net.leasehold.core.model.JobExecution;
import net.leasehold.core.model.LockStats;
import net.leasehold.core.model.ScheduledJob;
import net.leasehold.core.spi.Clock;
import net.leasehold.core.spi.JobExecutionRepository;
import net.leasehold.core.spi.JobRepository;
import net.leasehold.core.spi.ScheduleEvaluator;
import net.leasehold.core.spi.TxRunner;
import net.leasehold.core.util.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 외부 관리 화면/API 가 호출하는 계약.
 * 스케줄러 자신은 잡 정의를 바꾸지 않고 due 커서만 전진시킨다.
 */
public final class SchedulerAdminService {
    private static final Logger log = LoggerFactory.getLogger(SchedulerAdminService.class);

    public static final int MAX_HISTORY = 1000;

    private final JobRepository jobs;
    private final JobExecutionRepository executions;
    private final LockManager locks;
    private final ExecutorRegistry registry;
    private final ScheduleEvaluator evaluator;
    private final DispatchService dispatch;
    private final TxRunner tx;
    private final Clock clock;
    private final Jitter jitter;
    private final SchedulerMetrics metrics;
    private final Duration lease;
    private final ZoneId zone;
    private final String instanceId;

    public SchedulerAdminService(JobRepository jobs,
                                 JobExecutionRepository executions,
                                 LockManager locks,
                                 ExecutorRegistry registry,
                                 ScheduleEvaluator evaluator,
                                 DispatchService dispatch,
                                 TxRunner tx,
                                 Clock clock,
                                 Jitter jitter,
                                 SchedulerMetrics metrics,
                                 Duration lease,
                                 ZoneId zone,
                                 String instanceId) {
        this.jobs = jobs;
        this.executions = executions;
        this.locks = locks;
        this.registry = registry;
        this.evaluator = evaluator;
        this.dispatch = dispatch;
        this.tx = tx;
        this.clock = clock;
        this.jitter = jitter;
        this.metrics = metrics;
        this.lease = lease;
        this.zone = zone;
        this.instanceId = instanceId;
    }

    public List<ScheduledJob> listJobs() throws Exception {
        return tx.required(jobs::findAll);
    }

    public ScheduledJob getJob(String id) throws Exception {
        return tx.required(() -> jobs.findById(id)).orElseThrow(() -> new JobNotFoundException(id));
    }

    public Optional<ScheduledJob> findJobByName(String name) throws Exception {
        return tx.required(() -> jobs.findByName(name));
    }

    public ScheduledJob createJob(JobDefinition def) throws Exception {
        Instant now = clock.now();
        Instant first = validate(def, now);

        ScheduledJob job = new ScheduledJob(
                Ids.next(now), def.name(), def.description(), def.kind(), def.schedule(), def.parameters(),
                def.enabled(), def.maxRetries(), def.timeout(), def.priority(), def.tags(), def.metadata(),
                def.createdBy(), jitter.apply(first), now, now);

        tx.required(() -> {
            if (jobs.findByName(def.name()).isPresent()) {
                throw new ConfigurationException("job name already exists: " + def.name());
            }
            jobs.insert(job);
            return null;
        });
        log.info("job created: '{}' (id={}, kind={}, schedule='{}', nextDueAt={})",
                job.name(), job.id(), job.kind(), job.schedule(), job.nextDueAt());
        return job;
    }

    /** 스케줄이 바뀌면 due 커서를 지금 기준으로 다시 잡는다 */
    public ScheduledJob updateJob(String id, JobDefinition def) throws Exception {
        Instant now = clock.now();
        Instant first = validate(def, now);

        ScheduledJob updated = tx.required(() -> {
            ScheduledJob current = jobs.findByIdForUpdate(id).orElseThrow(() -> new JobNotFoundException(id));
            if (!current.name().equals(def.name())) {
                Optional<ScheduledJob> clash = jobs.findByName(def.name());
                if (clash.isPresent()) throw new ConfigurationException("job name already exists: " + def.name());
            }
            Instant next = Objects.equals(current.schedule(), def.schedule()) && current.nextDueAt() != null
                    ? current.nextDueAt()
                    : jitter.apply(first);
            ScheduledJob job = new ScheduledJob(
                    current.id(), def.name(), def.description(), def.kind(), def.schedule(), def.parameters(),
                    def.enabled(), def.maxRetries(), def.timeout(), def.priority(), def.tags(), def.metadata(),
                    current.createdBy(), next, current.createdAt(), now);
            jobs.update(job);
            return job;
        });
        log.info("job updated: '{}' (id={}, nextDueAt={})", updated.name(), updated.id(), updated.nextDueAt());
        return updated;
    }

    public void deleteJob(String id) throws Exception {
        int n = tx.required(() -> jobs.delete(id));
        if (n == 0) throw new JobNotFoundException(id);
        log.info("job deleted: id={}", id);
    }

    /** @return 실행 id. 다른 곳에서 실행 중이거나 슬롯이 없으면 empty */
    public Optional<String> triggerNow(String id) throws Exception {
        return dispatch.triggerNow(id);
    }

    public ScheduledJob pause(String id) throws Exception {
        ScheduledJob job = tx.required(() -> {
            ScheduledJob current = jobs.findByIdForUpdate(id).orElseThrow(() -> new JobNotFoundException(id));
            Instant now = clock.now();
            jobs.setEnabled(id, false, current.nextDueAt(), now);
            return current.withEnabled(false, current.nextDueAt(), now);
        });
        log.info("job paused: '{}'", job.name());
        return job;
    }

    /** 멈춰 있던 동안 지난 발생분은 건너뛰고 지금 이후 발생부터 */
    public ScheduledJob resume(String id) throws Exception {
        ScheduledJob job = tx.required(() -> {
            ScheduledJob current = jobs.findByIdForUpdate(id).orElseThrow(() -> new JobNotFoundException(id));
            Instant now = clock.now();
            Instant next = evaluator.nextDue(current.schedule(), now, zone).map(jitter::apply).orElse(null);
            jobs.setEnabled(id, true, next, now);
            return current.withEnabled(true, next, now);
        });
        log.info("job resumed: '{}' (nextDueAt={})", job.name(), job.nextDueAt());
        return job;
    }

    public LockStats getLockStats() throws Exception {
        return locks.stats();
    }

    public String getInstanceId() {
        return instanceId;
    }

    public List<JobExecution> getExecutionHistory(String jobId, int limit) throws Exception {
        int n = Math.max(1, Math.min(limit, MAX_HISTORY));
        return tx.required(() -> {
            if (jobs.findById(jobId).isEmpty()) throw new JobNotFoundException(jobId);
            return executions.findByJob(jobId, n);
        });
    }

    public Optional<JobExecution> getExecution(String executionId) throws Exception {
        return tx.required(() -> executions.findById(executionId));
    }

    /** 이 인스턴스에서 실행 중일 때만 취소 가능 */
    public boolean cancelExecution(String executionId) {
        return dispatch.cancel(executionId);
    }

    public SchedulerMetrics.Snapshot getMetrics() {
        return metrics.snapshot();
    }

    // 첫 due 시각을 돌려준다
    private Instant validate(JobDefinition def, Instant now) {
        def.validate();
        JobExecutor executor = registry.require(def.kind());
        try {
            executor.validateParameters(def.parameters());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("invalid parameters for kind '" + def.kind() + "': " + e.getMessage(), e);
        }
        if (def.timeout() != null && def.timeout().compareTo(lease) >= 0) {
            throw new ConfigurationException("job timeout " + def.timeout() + " must be shorter than the lock lease " + lease);
        }
        return evaluator.nextDue(def.schedule(), now, zone).orElseThrow(() ->
                new ConfigurationException("schedule '" + def.schedule() + "' is malformed or has no future occurrence"));
    }
}
