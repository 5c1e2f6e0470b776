package io.usermn.sdk.http;

import io.usermn.sdk.CircuitOpenException;
import io.usermn.sdk.Config;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Fails requests fast after repeated exhausted failures.
 *
 * <p>CLOSED counts consecutive failures and opens at the threshold. OPEN rejects every request until the reset
 * timeout has elapsed, then lets trial requests through in HALF_OPEN. HALF_OPEN closes after enough consecutive
 * successes and reopens on the first failure.</p>
 */
public final class CircuitBreaker {

    private static final Logger LOGGER = Logger.getLogger(CircuitBreaker.class.getName());

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String name;
    private final int failureThreshold;
    private final Duration resetTimeout;
    private final int successThreshold;
    private final Clock clock;

    private State state = State.CLOSED;
    private int failures;
    private int successes;
    private Instant openedAt;

    public CircuitBreaker(String name, int failureThreshold, Duration resetTimeout, int successThreshold, Clock clock) {
        if (failureThreshold < 1 || successThreshold < 1) {
            throw new IllegalArgumentException("circuit thresholds must be positive");
        }
        this.name = Objects.requireNonNull(name, "name");
        this.failureThreshold = failureThreshold;
        this.resetTimeout = Objects.requireNonNull(resetTimeout, "resetTimeout");
        this.successThreshold = successThreshold;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static CircuitBreaker from(String name, Config config) {
        return new CircuitBreaker(
            name,
            config.getCircuitFailureThreshold(),
            config.getCircuitResetTimeout(),
            config.getCircuitSuccessThreshold(),
            config.getClock()
        );
    }

    /**
     * @throws CircuitOpenException while open and the reset timeout has not elapsed
     */
    public synchronized void acquire() throws CircuitOpenException {
        if (state != State.OPEN) {
            return;
        }
        Instant retryAt = openedAt.plus(resetTimeout);
        if (clock.instant().isBefore(retryAt)) {
            throw new CircuitOpenException(name, retryAt);
        }
        transition(State.HALF_OPEN);
    }

    public synchronized void recordSuccess() {
        if (state == State.HALF_OPEN) {
            successes++;
            if (successes >= successThreshold) {
                transition(State.CLOSED);
            }
        } else {
            failures = 0;
        }
    }

    public synchronized void recordFailure() {
        if (state == State.HALF_OPEN) {
            transition(State.OPEN);
            return;
        }
        failures++;
        if (state == State.CLOSED && failures >= failureThreshold) {
            transition(State.OPEN);
        }
    }

    public synchronized State state() {
        return state;
    }

    public synchronized void reset() {
        transition(State.CLOSED);
    }

    private void transition(State next) {
        State previous = state;
        state = next;
        failures = 0;
        successes = 0;
        openedAt = next == State.OPEN ? clock.instant() : null;
        if (previous != next) {
            LOGGER.info(() -> String.format(Locale.ROOT, "[usermn-sdk] circuit %s %s -> %s", name, previous, next));
        }
    }
}
