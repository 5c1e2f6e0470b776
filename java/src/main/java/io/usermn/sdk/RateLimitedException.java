package io.usermn.sdk;

import java.time.Duration;
import java.util.Optional;

/**
 * The backend answered 429 on every attempt.
 */
public final class RateLimitedException extends ApiException {

    private static final long serialVersionUID = 1L;

    private final Duration retryAfter;

    public RateLimitedException(String code, String message, String requestId, Duration retryAfter) {
        super(429, code, message, requestId, null);
        this.retryAfter = retryAfter;
    }

    /**
     * @return delay requested by the last {@code Retry-After} header, when one was sent.
     */
    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
