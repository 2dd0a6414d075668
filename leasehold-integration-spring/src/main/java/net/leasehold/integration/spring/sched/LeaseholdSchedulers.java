package net.leasehold.integration.spring.sched;

import net.leasehold.core.maintenance.StaleLockReaper;
import net.leasehold.core.service.DispatchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;

/**
 * 폴링 tick, 만료 락 sweep, 보존 sweep 을 스프링 스케줄러에 건다.
 * 한 번의 실패가 다음 주기를 막지 않도록 예외는 로그만 남긴다.
 */
public class LeaseholdSchedulers {
    private static final Logger log = LoggerFactory.getLogger(LeaseholdSchedulers.class);

    private final DispatchService dispatch;
    private final StaleLockReaper reaper;

    private Duration historyRetention = Duration.ofDays(30);

    public LeaseholdSchedulers(DispatchService dispatch, StaleLockReaper reaper) {
        this.dispatch = dispatch;
        this.reaper = reaper;
    }

    @Scheduled(fixedDelayString = "${leasehold.scheduler.poll-interval-ms:5000}")
    public void tick() {
        if (!dispatch.isStarted()) return;
        try {
            int n = dispatch.tick();
            if (n > 0) log.debug("tick dispatched {} job(s)", n);
        } catch (RuntimeException e) {
            log.warn("dispatch tick failed: {}", e.toString(), e);
        }
    }

    @Scheduled(fixedDelayString = "${leasehold.scheduler.lock-sweep-interval-ms:60000}")
    public void expireStaleLocks() {
        try {
            reaper.expireStaleLocks();
        } catch (Exception e) {
            log.warn("stale lock sweep failed: {}", e.toString(), e);
        }
    }

    @Scheduled(fixedDelayString = "${leasehold.scheduler.retention-sweep-interval-ms:3600000}")
    public void purgeHistory() {
        try {
            reaper.purgeHistory(historyRetention);
        } catch (Exception e) {
            log.warn("history retention sweep failed: {}", e.toString(), e);
        }
    }

    public void setHistoryRetention(Duration historyRetention) {
        this.historyRetention = historyRetention;
    }
}
