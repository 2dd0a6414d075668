package net.leasehold.bootstrap.autoconfigure;

import net.leasehold.bootstrap.props.LeaseholdProperties;
import net.leasehold.core.error.ConfigurationException;
import net.leasehold.core.executor.ExecutionContext;
import net.leasehold.core.executor.ExecutionResult;
import net.leasehold.core.executor.ExecutorRegistry;
import net.leasehold.core.executor.JobExecutor;
import net.leasehold.core.lock.LeaseLockManager;
import net.leasehold.core.lock.LocalLockManager;
import net.leasehold.core.lock.LockManager;
import net.leasehold.core.service.DispatchService;
import net.leasehold.core.service.DispatchSettings;
import net.leasehold.core.service.SchedulerAdminService;
import net.leasehold.integration.spring.sched.LeaseholdSchedulers;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class LeaseholdAutoConfigurationTest {
    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    DataSourceAutoConfiguration.class,
                    DataSourceTransactionManagerAutoConfiguration.class,
                    LeaseholdAutoConfiguration.class))
            .withUserConfiguration(TestExecutors.class);

    @Test
    void wires_scheduler_with_defaults() {
        runner.run(ctx -> {
            assertThat(ctx).hasNotFailed();
            assertThat(ctx).hasSingleBean(DispatchService.class);
            assertThat(ctx).hasSingleBean(SchedulerAdminService.class);
            assertThat(ctx).hasSingleBean(LeaseholdSchedulers.class);
            assertThat(ctx.getBean(LockManager.class)).isInstanceOf(LeaseLockManager.class);
            assertThat(ctx.getBean(ExecutorRegistry.class).kinds()).containsExactly("noop");

            DispatchSettings settings = ctx.getBean(DispatchSettings.class);
            assertThat(settings.lease()).isEqualTo(Duration.ofSeconds(360));
            assertThat(settings.maxConcurrent()).isEqualTo(10);
            assertThat(settings.renewalEnabled()).isFalse();
        });
    }

    @Test
    void binds_scheduler_properties() {
        runner.withPropertyValues(
                "leasehold.zone=Asia/Seoul",
                "leasehold.scheduler.enabled=false",
                "leasehold.scheduler.enable-distributed-locking=false",
                "leasehold.scheduler.lock-lease-seconds=120",
                "leasehold.scheduler.default-timeout=60s",
                "leasehold.scheduler.max-concurrent-jobs=3",
                "leasehold.scheduler.instance-id=node-7",
                "leasehold.catalog.jobs[0].name=ping",
                "leasehold.catalog.jobs[0].kind=noop",
                "leasehold.catalog.jobs[0].schedule=0 * * * * *",
                "leasehold.catalog.jobs[0].parameters.target=db",
                "leasehold.catalog.jobs[0].metadata.owner=platform"
        ).run(ctx -> {
            assertThat(ctx).hasNotFailed();
            assertThat(ctx).doesNotHaveBean(LeaseholdSchedulers.class);
            assertThat(ctx.getBean(LockManager.class)).isInstanceOf(LocalLockManager.class);
            assertThat(ctx.getBean(SchedulerAdminService.class).getInstanceId()).isEqualTo("node-7");

            DispatchSettings settings = ctx.getBean(DispatchSettings.class);
            assertThat(settings.lease()).isEqualTo(Duration.ofSeconds(120));
            assertThat(settings.maxConcurrent()).isEqualTo(3);

            LeaseholdProperties props = ctx.getBean(LeaseholdProperties.class);
            assertThat(props.getZone()).isEqualTo("Asia/Seoul");
            assertThat(props.getCatalog().getJobs()).hasSize(1);
            assertThat(props.getCatalog().getJobs().get(0).getParameters()).containsEntry("target", "db");
            assertThat(props.getCatalog().getJobs().get(0).getMetadata()).containsEntry("owner", "platform");
            assertThat(props.getCatalog().getJobs().get(0).getEnabled()).isNull();
        });
    }

    @Test
    void lease_not_longer_than_default_timeout_fails_startup() {
        runner.withPropertyValues(
                "leasehold.scheduler.lock-lease-seconds=60",
                "leasehold.scheduler.default-timeout=60s"
        ).run(ctx -> {
            assertThat(ctx).hasFailed();
            assertThat(ctx.getStartupFailure()).hasRootCauseInstanceOf(ConfigurationException.class);
        });
    }

    @Configuration(proxyBeanMethods = false)
    static class TestExecutors {
        @Bean
        JobExecutor noop() {
            return new JobExecutor() {
                @Override public String kind() { return "noop"; }
                @Override public ExecutionResult execute(ExecutionContext ctx) {
                    return ExecutionResult.empty();
                }
            };
        }
    }
}
