package net.leasehold.integration.spring.cron;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** 자주 쓰는 6필드 cron 식과 사람이 읽는 설명 */
public final class SchedulePresets {
    public static final String EVERY_MINUTE = "0 * * * * *";
    public static final String EVERY_5_MINUTES = "0 */5 * * * *";
    public static final String EVERY_15_MINUTES = "0 */15 * * * *";
    public static final String EVERY_30_MINUTES = "0 */30 * * * *";
    public static final String HOURLY = "0 0 * * * *";
    public static final String EVERY_6_HOURS = "0 0 */6 * * *";
    public static final String DAILY = "0 0 0 * * *";
    public static final String DAILY_2AM = "0 0 2 * * *";      // 유지보수 작업용
    public static final String WEEKLY = "0 0 3 * * SUN";
    public static final String MONTHLY = "0 0 4 1 * *";

    private static final Map<String, String> DESCRIPTIONS = new LinkedHashMap<>();

    static {
        DESCRIPTIONS.put(EVERY_MINUTE, "Every minute");
        DESCRIPTIONS.put(EVERY_5_MINUTES, "Every 5 minutes");
        DESCRIPTIONS.put(EVERY_15_MINUTES, "Every 15 minutes");
        DESCRIPTIONS.put(EVERY_30_MINUTES, "Every 30 minutes");
        DESCRIPTIONS.put(HOURLY, "Hourly");
        DESCRIPTIONS.put(EVERY_6_HOURS, "Every 6 hours");
        DESCRIPTIONS.put(DAILY, "Daily at midnight");
        DESCRIPTIONS.put(DAILY_2AM, "Daily at 2 AM");
        DESCRIPTIONS.put(WEEKLY, "Weekly on Sunday");
        DESCRIPTIONS.put(MONTHLY, "Monthly on the 1st");
    }

    private SchedulePresets() {}

    /** 프리셋과 글자 그대로 같은 식만 설명한다. 앞뒤 공백은 무시. */
    public static Optional<String> describe(String schedule) {
        if (schedule == null) return Optional.empty();
        return Optional.ofNullable(DESCRIPTIONS.get(schedule.trim()));
    }

    public static Map<String, String> all() {
        return Map.copyOf(DESCRIPTIONS);
    }
}
