package net.leasehold.app.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import net.leasehold.core.executor.ExecutionContext;
import net.leasehold.core.executor.ExecutionResult;
import net.leasehold.core.executor.JobExecutor;
import net.leasehold.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 살아있음을 기록하는 예제 실행기.
 * parameters.message 가 있으면 결과에 그대로 싣는다.
 */
@Component
public class HeartbeatExecutor implements JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatExecutor.class);

    public static final String KIND = "heartbeat";

    private final ObjectMapper mapper;
    private final Clock clock;

    public HeartbeatExecutor(ObjectMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public ExecutionResult execute(ExecutionContext ctx) {
        ctx.cancel().throwIfCancelled();
        ObjectNode out = mapper.createObjectNode()
                .put("job", ctx.jobName())
                .put("beatAt", clock.now().toString())
                .put("attempt", ctx.retryCount() + 1);
        JsonNode params = ctx.parameters();
        if (params != null && params.hasNonNull("message")) {
            out.put("message", params.get("message").asText());
        }
        log.info("heartbeat from job '{}' (execution={})", ctx.jobName(), ctx.executionId());
        return ExecutionResult.of(out);
    }

    @Override
    public void validateParameters(JsonNode parameters) {
        if (parameters != null && parameters.has("message") && !parameters.get("message").isTextual()) {
            throw new IllegalArgumentException("'message' must be a string");
        }
    }
}
