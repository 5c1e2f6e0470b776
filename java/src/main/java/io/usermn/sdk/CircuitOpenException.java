package io.usermn.sdk;

import java.time.Instant;

/**
 * Request rejected locally because the circuit breaker is open.
 */
public final class CircuitOpenException extends ApiException {

    private static final long serialVersionUID = 1L;

    private final Instant retryAt;

    public CircuitOpenException(String circuitName, Instant retryAt) {
        super(0, "CIRCUIT_OPEN", "circuit " + circuitName + " is open until " + retryAt, null, null);
        this.retryAt = retryAt;
    }

    public Instant getRetryAt() {
        return retryAt;
    }
}
