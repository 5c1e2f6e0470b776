package io.usermn.sdk.http;

import io.usermn.sdk.RequestCancelledException;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation for a logical request. The retry loop checks it before each attempt and wakes up from a
 * backoff sleep as soon as it is cancelled. One signal may be shared by several requests.
 */
public final class CancellationSignal {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private volatile String reason;

    public void cancel() {
        cancel("request cancelled");
    }

    public void cancel(String reason) {
        if (cancelled.getCount() > 0) {
            this.reason = reason;
            cancelled.countDown();
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public void throwIfCancelled() throws RequestCancelledException {
        if (isCancelled()) {
            throw new RequestCancelledException(reason == null ? "request cancelled" : reason);
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new RequestCancelledException("request thread interrupted");
        }
    }

    /**
     * Sleeps for {@code delay} unless cancelled first.
     *
     * @throws RequestCancelledException when cancelled or interrupted during the wait
     */
    public void sleep(Duration delay) throws RequestCancelledException {
        throwIfCancelled();
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            if (cancelled.await(delay.toNanos(), TimeUnit.NANOSECONDS)) {
                throwIfCancelled();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RequestCancelledException("interrupted during retry backoff", ex);
        }
    }
}
