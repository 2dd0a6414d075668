package net.leasehold.core.spi;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * cron 식에서 다음 due 시각을 계산한다.
 * 순수 함수. 지터는 여기서 더하지 않는다.
 */
public interface ScheduleEvaluator {
    /** after 이후 첫 발생 시각. 파싱 실패나 이후 발생이 없으면 empty */
    Optional<Instant> nextDue(String schedule, Instant after, ZoneId zone);
}
