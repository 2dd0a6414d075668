package net.leasehold.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import net.leasehold.core.model.JobExecution;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface JobExecutionRepository {
    void insert(JobExecution execution) throws Exception;

    /** RUNNING 인 경우에만 종결. 이미 종결됐으면 false */
    boolean finish(String id, JobExecution.Status status, Instant completedAt, Duration duration,
                   JsonNode result, String error) throws Exception;

    int updateRetryCount(String id, int retryCount) throws Exception;

    Optional<JobExecution> findById(String id) throws Exception;

    /** 최근 시작순 */
    List<JobExecution> findByJob(String jobId, int limit) throws Exception;

    /** COMPLETED_AT < threshold 인 종결건 삭제 */
    int deleteFinishedOlderThan(Instant threshold) throws Exception;
}
