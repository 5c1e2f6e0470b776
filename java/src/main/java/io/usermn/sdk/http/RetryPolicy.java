package io.usermn.sdk.http;

import io.usermn.sdk.Config;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Capped exponential backoff with symmetric jitter: {@code min(base * 2^retry, max) * (1 ± jitter)}.
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitter;
    private final Random random;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitter, Random random) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (jitter < 0d || jitter >= 1d) {
            throw new IllegalArgumentException("jitter must be in [0, 1)");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
        this.jitter = jitter;
        this.random = Objects.requireNonNull(random, "random");
    }

    public static RetryPolicy from(Config config) {
        return new RetryPolicy(
            config.getMaxAttempts(),
            config.getRetryBaseDelay(),
            config.getRetryMaxDelay(),
            config.getRetryJitter(),
            config.getRandom()
        );
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * @param retry zero for the delay before the first retry
     */
    public Duration delayFor(int retry) {
        long capped = cappedDelayMillis(retry);
        if (jitter == 0d || capped == 0L) {
            return Duration.ofMillis(capped);
        }
        double factor;
        synchronized (random) {
            factor = 1d + jitter * (2d * random.nextDouble() - 1d);
        }
        return Duration.ofMillis(Math.round(capped * factor));
    }

    /**
     * Upper bound of {@link #delayFor(int)} for the given retry.
     */
    public Duration maxDelayFor(int retry) {
        return Duration.ofMillis((long) Math.ceil(cappedDelayMillis(retry) * (1d + jitter)));
    }

    private long cappedDelayMillis(int retry) {
        long base = Math.max(0L, baseDelay.toMillis());
        long max = maxDelay.toMillis();
        if (base == 0L) {
            return 0L;
        }
        int shift = Math.max(0, retry);
        if (shift >= 62) {
            return max;
        }
        long delay = base << shift;
        if ((delay >> shift) != base || delay > max) {
            return max;
        }
        return delay;
    }
}
