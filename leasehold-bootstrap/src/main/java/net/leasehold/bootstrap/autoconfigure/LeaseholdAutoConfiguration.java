package net.leasehold.bootstrap.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import net.leasehold.bootstrap.catalog.CatalogRegistrar;
import net.leasehold.bootstrap.metrics.SchedulerMeterBinder;
import net.leasehold.bootstrap.props.LeaseholdProperties;
import net.leasehold.core.executor.ExecutorRegistry;
import net.leasehold.core.executor.JobExecutor;
import net.leasehold.core.lock.InstanceId;
import net.leasehold.core.lock.LeaseLockManager;
import net.leasehold.core.lock.LocalLockManager;
import net.leasehold.core.lock.LockManager;
import net.leasehold.core.maintenance.StaleLockReaper;
import net.leasehold.core.service.DispatchService;
import net.leasehold.core.service.DispatchSettings;
import net.leasehold.core.service.Jitter;
import net.leasehold.core.service.RetryPolicy;
import net.leasehold.core.service.SchedulerAdminService;
import net.leasehold.core.service.SchedulerMetrics;
import net.leasehold.core.spi.Clock;
import net.leasehold.core.spi.JobExecutionRepository;
import net.leasehold.core.spi.JobLockRepository;
import net.leasehold.core.spi.JobRepository;
import net.leasehold.core.spi.ScheduleEvaluator;
import net.leasehold.core.spi.TxRunner;
import net.leasehold.integration.spring.LeaseholdSpringConfig;
import net.leasehold.integration.spring.sched.LeaseholdSchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.time.ZoneId;

@AutoConfiguration(after = {
        DataSourceTransactionManagerAutoConfiguration.class,
        FlywayAutoConfiguration.class,
        JacksonAutoConfiguration.class
})
@EnableConfigurationProperties(LeaseholdProperties.class)
@Import(LeaseholdSpringConfig.class) // integration-spring: repos/tx/clock/cron wiring
public class LeaseholdAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(LeaseholdAutoConfiguration.class);

    private final LeaseholdProperties props;
    private final String instanceId;
    private final ZoneId zone;

    public LeaseholdAutoConfiguration(LeaseholdProperties props) {
        this.props = props;
        String configured = props.getScheduler().getInstanceId();
        this.instanceId = configured == null || configured.isBlank() ? InstanceId.detect() : configured;
        this.zone = ZoneId.of(props.getZone());
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public SchedulerMetrics schedulerMetrics() {
        return new SchedulerMetrics();
    }

    @Bean
    @ConditionalOnMissingBean
    public LockManager lockManager(JobLockRepository lockRepo,
                                   JobExecutionRepository executions,
                                   TxRunner tx,
                                   Clock clock,
                                   SchedulerMetrics metrics) {
        if (!props.getScheduler().isEnableDistributedLocking()) {
            return new LocalLockManager(clock);
        }
        return new LeaseLockManager(lockRepo, executions, tx, clock, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutorRegistry executorRegistry(ObjectProvider<JobExecutor> executors) {
        return new ExecutorRegistry(executors.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy() {
        var s = props.getScheduler();
        return RetryPolicy.exponential(s.getRetryBackoff(), s.getMaxRetryBackoff());
    }

    @Bean
    @ConditionalOnMissingBean
    public Jitter jitter() {
        return new Jitter(props.getScheduler().getMaxJitter());
    }

    @Bean
    @ConditionalOnMissingBean
    public DispatchSettings dispatchSettings() {
        var s = props.getScheduler();
        return new DispatchSettings(s.lease(), s.getMaxConcurrentJobs(), s.getDefaultTimeout(),
                s.getCandidateBatchSize(), s.getLeaseRenewalInterval(), s.getShutdownGrace());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public DispatchService dispatchService(JobRepository jobs,
                                           JobExecutionRepository executions,
                                           LockManager locks,
                                           ExecutorRegistry registry,
                                           ScheduleEvaluator evaluator,
                                           TxRunner tx,
                                           Clock clock,
                                           SchedulerMetrics metrics,
                                           DispatchSettings settings,
                                           RetryPolicy retryPolicy,
                                           Jitter jitter) {
        return new DispatchService(jobs, executions, locks, registry, evaluator, tx, clock, metrics,
                settings, retryPolicy, jitter, zone, instanceId);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerAdminService schedulerAdminService(JobRepository jobs,
                                                       JobExecutionRepository executions,
                                                       LockManager locks,
                                                       ExecutorRegistry registry,
                                                       ScheduleEvaluator evaluator,
                                                       DispatchService dispatch,
                                                       TxRunner tx,
                                                       Clock clock,
                                                       Jitter jitter,
                                                       SchedulerMetrics metrics,
                                                       DispatchSettings settings) {
        return new SchedulerAdminService(jobs, executions, locks, registry, evaluator, dispatch, tx, clock,
                jitter, metrics, settings.lease(), zone, instanceId);
    }

    @Bean
    @ConditionalOnMissingBean
    public StaleLockReaper staleLockReaper(JobLockRepository lockRepo,
                                           JobExecutionRepository executions,
                                           TxRunner tx,
                                           Clock clock) {
        return new StaleLockReaper(lockRepo, executions, tx, clock);
    }

    // --- 스케줄러 등록 (프로퍼티로 주기 제어) ---

    @Bean
    @ConditionalOnProperty(prefix = "leasehold.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public LeaseholdSchedulers leaseholdSchedulers(DispatchService dispatch, StaleLockReaper reaper) {
        // @Scheduled 주기는 leasehold.scheduler.*-ms 키에서 읽힘. 나머지만 세터로 주입
        var s = new LeaseholdSchedulers(dispatch, reaper);
        s.setHistoryRetention(props.getScheduler().historyRetention());
        return s;
    }

    @Bean
    public CatalogRegistrar catalogRegistrar(SchedulerAdminService admin, ObjectProvider<ObjectMapper> mapper) {
        return new CatalogRegistrar(admin, mapper.getIfAvailable(ObjectMapper::new));
    }

    /** 카탈로그 등록 → kind 검증 후 디스패치 시작. 어느 쪽이든 실패하면 기동 실패. */
    @Bean
    public ApplicationRunner leaseholdStartup(CatalogRegistrar registrar, DispatchService dispatch) {
        return args -> {
            if (props.getCatalog().isEnabled()) {
                registrar.register(props.getCatalog());
            }
            if (props.getScheduler().isEnabled()) {
                dispatch.start();
            } else {
                log.info("leasehold scheduler disabled, instance {} will not dispatch", instanceId);
            }
        };
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {
        @Bean
        @ConditionalOnMissingBean
        SchedulerMeterBinder schedulerMeterBinder(SchedulerMetrics metrics,
                                                  DispatchService dispatch,
                                                  SchedulerAdminService admin) {
            return new SchedulerMeterBinder(metrics, dispatch, admin.getInstanceId());
        }
    }
}
