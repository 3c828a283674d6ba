package net.cronengine.core.concurrent;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation shared by the scheduler loop and every execution it launched.
 * One token per scheduler start; once cancelled it stays cancelled.
 */
public final class CancellationToken {
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private volatile String reason = "";

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public String reason() {
        return reason;
    }

    public synchronized void cancel(String why) {
        if (isCancelled()) return;
        this.reason = why == null ? "" : why;
        cancelled.countDown();
    }

    public void throwIfCancelled() {
        if (isCancelled()) throw new CancellationException("Cancelled: " + reason);
    }

    /**
     * Waits up to {@code timeout}, returning early when cancelled.
     *
     * @return true if the token is cancelled
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
