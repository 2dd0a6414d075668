package net.leasehold.core.executor;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * kind 하나를 담당하는 실행기.
 * 실패는 예외로 알린다. 재시도와 타임아웃은 스케줄러 몫이다.
 */
public interface JobExecutor {
    String kind();

    ExecutionResult execute(ExecutionContext ctx) throws Exception;

    /** 잡 생성/수정 시 호출. 거부하려면 IllegalArgumentException */
    default void validateParameters(JsonNode parameters) {}
}
