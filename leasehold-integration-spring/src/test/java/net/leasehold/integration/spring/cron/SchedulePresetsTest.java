package net.leasehold.integration.spring.cron;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulePresetsTest {

    @Test
    void known_presets_are_described() {
        assertThat(SchedulePresets.describe(SchedulePresets.EVERY_5_MINUTES)).contains("Every 5 minutes");
        assertThat(SchedulePresets.describe(" 0 0 3 * * SUN ")).contains("Weekly on Sunday");
        assertThat(SchedulePresets.describe("0 0 2 * * *")).contains("Daily at 2 AM");
    }

    @Test
    void other_expressions_have_no_description() {
        assertThat(SchedulePresets.describe("0 0 5 * * *")).isEmpty();
        assertThat(SchedulePresets.describe(null)).isEmpty();
    }

    @Test
    void every_preset_is_a_valid_schedule() {
        CronUtilsScheduleEvaluator evaluator = new CronUtilsScheduleEvaluator();
        Instant now = Instant.parse("2025-03-10T00:00:30Z");

        assertThat(SchedulePresets.all()).hasSize(10);
        SchedulePresets.all().keySet().forEach(expr ->
                assertThat(evaluator.nextDue(expr, now, ZoneOffset.UTC)).as(expr).isPresent());
        assertThat(evaluator.nextDue(SchedulePresets.MONTHLY, now, ZoneOffset.UTC))
                .contains(Instant.parse("2025-04-01T04:00:00Z"));
    }
}
