package net.leasehold.integration.spring.cron;

import net.leasehold.core.spi.ScheduleEvaluator;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/** 코어 SPI 구현체 */
public final class CronUtilsScheduleEvaluator implements ScheduleEvaluator {
    @Override
    public Optional<Instant> nextDue(String schedule, Instant after, ZoneId zone) {
        if (schedule == null || schedule.isBlank()) return Optional.empty();
        return CronExpressions.parse(schedule)
                .flatMap(et -> et.nextExecution(after.atZone(zone)))
                .map(next -> next.toInstant());
    }
}
