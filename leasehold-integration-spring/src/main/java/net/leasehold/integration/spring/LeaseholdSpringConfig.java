package net.leasehold.integration.spring;

import net.leasehold.adapter.jdbc.repo.JdbcJobExecutionRepository;
import net.leasehold.adapter.jdbc.repo.JdbcJobLockRepository;
import net.leasehold.adapter.jdbc.repo.JdbcJobRepository;
import net.leasehold.core.spi.Clock;
import net.leasehold.core.spi.JobExecutionRepository;
import net.leasehold.core.spi.JobLockRepository;
import net.leasehold.core.spi.JobRepository;
import net.leasehold.core.spi.ScheduleEvaluator;
import net.leasehold.core.spi.TxRunner;
import net.leasehold.integration.spring.cron.CronUtilsScheduleEvaluator;
import net.leasehold.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Instant;

@Configuration
public class LeaseholdSpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // Repository 구현 등록 (adapter-jdbc 재사용)
    @Bean public JobRepository jobRepository(DataSource ds) { return new JdbcJobRepository(ds); }
    @Bean public JobExecutionRepository jobExecutionRepository(DataSource ds) { return new JdbcJobExecutionRepository(ds); }
    @Bean public JobLockRepository jobLockRepository(DataSource ds) { return new JdbcJobLockRepository(ds); }

    @Bean public Clock systemClock() { return Instant::now; }

    @Bean public ScheduleEvaluator scheduleEvaluator() { return new CronUtilsScheduleEvaluator(); }
}
