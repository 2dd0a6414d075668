package net.leasehold.core.service;

import java.util.concurrent.atomic.LongAdder;

/**
 * 인스턴스 로컬 카운터. 누적값만 보관하고 외부 레지스트리 연동은 bootstrap 에서 한다.
 */
public final class SchedulerMetrics {
    private final LongAdder dispatched = new LongAdder();
    private final LongAdder succeeded = new LongAdder();
    private final LongAdder failed = new LongAdder();
    private final LongAdder timedOut = new LongAdder();
    private final LongAdder cancelled = new LongAdder();
    private final LongAdder retried = new LongAdder();
    private final LongAdder lockConflicts = new LongAdder();
    private final LongAdder takeovers = new LongAdder();
    private final LongAdder tickErrors = new LongAdder();

    public void dispatched() { dispatched.increment(); }
    public void succeeded() { succeeded.increment(); }
    public void failed() { failed.increment(); }
    public void timedOut() { timedOut.increment(); }
    public void cancelled() { cancelled.increment(); }
    public void retried() { retried.increment(); }
    public void lockConflict() { lockConflicts.increment(); }
    public void takeover() { takeovers.increment(); }
    public void tickError() { tickErrors.increment(); }

    public long dispatchedCount() { return dispatched.sum(); }
    public long succeededCount() { return succeeded.sum(); }
    public long failedCount() { return failed.sum(); }
    public long timedOutCount() { return timedOut.sum(); }
    public long cancelledCount() { return cancelled.sum(); }
    public long retriedCount() { return retried.sum(); }
    public long lockConflictCount() { return lockConflicts.sum(); }
    public long takeoverCount() { return takeovers.sum(); }
    public long tickErrorCount() { return tickErrors.sum(); }

    public Snapshot snapshot() {
        return new Snapshot(dispatchedCount(), succeededCount(), failedCount(), timedOutCount(),
                cancelledCount(), retriedCount(), lockConflictCount(), takeoverCount(), tickErrorCount());
    }

    public record Snapshot(long dispatched, long succeeded, long failed, long timedOut, long cancelled,
                           long retried, long lockConflicts, long takeovers, long tickErrors) {}
}
