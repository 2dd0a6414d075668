package net.leasehold.app;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.MeterRegistry;
import net.leasehold.app.executor.HeartbeatExecutor;
import net.leasehold.core.error.ConfigurationException;
import net.leasehold.core.model.JobDefinition;
import net.leasehold.core.model.JobExecution;
import net.leasehold.core.model.ScheduledJob;
import net.leasehold.core.service.DispatchService;
import net.leasehold.core.service.SchedulerAdminService;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 부트 전체 기동: Flyway(H2) → 카탈로그 등록 → @Scheduled tick → 실행 기록
 */
@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:flow;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000",
        "leasehold.scheduler.poll-interval-ms=200",
        "leasehold.scheduler.lock-sweep-interval-ms=1000",
        "leasehold.scheduler.instance-id=flow-test:1",
        "leasehold.catalog.jobs[0].name=heartbeat",
        "leasehold.catalog.jobs[0].kind=heartbeat",
        "leasehold.catalog.jobs[0].schedule=* * * * * *",
        "leasehold.catalog.jobs[0].parameters.message=from test",
        "leasehold.catalog.jobs[0].timeout=10s"
})
class SchedulingFlowTest {

    @Autowired SchedulerAdminService admin;
    @Autowired DispatchService dispatch;
    @Autowired JdbcTemplate jdbc;
    @Autowired MeterRegistry meters;

    @Test
    void catalog_job_is_registered_and_dispatched_on_schedule() throws Exception {
        ScheduledJob job = admin.findJobByName("heartbeat").orElseThrow();
        assertThat(job.kind()).isEqualTo(HeartbeatExecutor.KIND);
        assertThat(job.createdBy()).isEqualTo("catalog");
        assertThat(dispatch.isStarted()).isTrue();

        Awaitility.await().atMost(Duration.ofSeconds(20)).untilAsserted(() -> {
            List<JobExecution> history = admin.getExecutionHistory(job.id(), 10);
            assertThat(history).anySatisfy(e -> {
                assertThat(e.status()).isEqualTo(JobExecution.Status.SUCCEEDED);
                assertThat(e.instanceId()).isEqualTo("flow-test:1");
                assertThat(e.result().get("message").asText()).isEqualTo("from test");
            });
        });

        // 실행 기록과 락 기록이 같은 흐름을 가리킨다
        Integer released = jdbc.queryForObject(
                "SELECT COUNT(*) FROM TB_JOB_LOCK WHERE JOB_ID = ? AND STATUS = 'RELEASED'", Integer.class, job.id());
        assertThat(released).isPositive();

        FunctionCounter dispatched = meters.find("leasehold.scheduler.dispatched").functionCounter();
        assertThat(dispatched).isNotNull();
        assertThat(dispatched.count()).isPositive();
    }

    @Test
    void manual_trigger_runs_a_paused_job() throws Exception {
        ScheduledJob job = admin.createJob(JobDefinition.of("manual-beat", HeartbeatExecutor.KIND, "0 0 0 1 1 *", "test")
                .withParameters(JsonNodeFactory.instance.objectNode().put("message", "by hand")));
        admin.pause(job.id());

        String executionId = admin.triggerNow(job.id()).orElseThrow();
        Awaitility.await().atMost(Duration.ofSeconds(10)).untilAsserted(() ->
                assertThat(admin.getExecution(executionId))
                        .hasValueSatisfying(e -> assertThat(e.status()).isEqualTo(JobExecution.Status.SUCCEEDED)));

        assertThat(admin.getJob(job.id()).enabled()).isFalse();
        admin.deleteJob(job.id());
    }

    @Test
    void invalid_parameters_are_rejected_by_the_executor() {
        assertThatThrownBy(() -> admin.createJob(JobDefinition.of("bad-beat", HeartbeatExecutor.KIND, "0 * * * * *", "test")
                .withParameters(JsonNodeFactory.instance.objectNode().put("message", 42))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("message");
    }
}
