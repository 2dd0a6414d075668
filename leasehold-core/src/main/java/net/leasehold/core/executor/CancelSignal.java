package net.leasehold.core.executor;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 협조적 취소 신호. 실행기는 주기적으로 확인해야 한다.
 * 스케줄러는 실행기가 멈추는 것을 기다리지 않는다.
 */
public final class CancelSignal {
    private final CountDownLatch latch = new CountDownLatch(1);

    public void cancel() { latch.countDown(); }

    public boolean isCancelled() { return latch.getCount() == 0; }

    public void throwIfCancelled() {
        if (isCancelled()) throw new CancellationException("execution cancelled");
    }

    /** 취소되거나 timeout 이 지날 때까지 대기. 취소됐으면 true */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
