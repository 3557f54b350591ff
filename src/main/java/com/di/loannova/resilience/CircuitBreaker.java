package com.di.loannova.resilience;

import com.di.loannova.exception.CircuitOpenException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Consecutive-failure circuit breaker with an explicit state machine.
 *
 * <pre>
 *   CLOSED --(failureThreshold consecutive failures)--> OPEN
 *   OPEN   --(resetTimeout elapsed, next call)--------> HALF_OPEN (one trial call admitted)
 *   HALF_OPEN --trial succeeds--> CLOSED
 *   HALF_OPEN --trial fails-----> OPEN (cooldown restarts)
 * </pre>
 *
 * While OPEN, or while a HALF_OPEN trial call is in flight, calls are rejected with
 * {@link CircuitOpenException} without invoking the protected operation.
 * One instance belongs to one adapter; state is never shared.
 */
@Slf4j
public class CircuitBreaker {

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String name;
    private final int failureThreshold;
    private final Duration resetTimeout;
    private final Clock clock;

    private State state = State.CLOSED;
    private int consecutiveFailures;
    private Instant openedAt;
    private boolean trialInFlight;

    public CircuitBreaker(String name, int failureThreshold, Duration resetTimeout, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got " + failureThreshold);
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.resetTimeout = resetTimeout;
        this.clock = clock;
    }

    /** Current state, advancing OPEN to HALF_OPEN once the cooldown has elapsed. */
    public synchronized State state() {
        if (state == State.OPEN && !clock.instant().isBefore(openedAt.plus(resetTimeout))) {
            transition(State.HALF_OPEN);
        }
        return state;
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    /**
     * Admits or rejects a call. A rejected call raises {@link CircuitOpenException};
     * an admitted call must be followed by exactly one {@link #recordSuccess()} or {@link #recordFailure()}.
     */
    public synchronized void acquirePermission() {
        switch (state()) {
            case CLOSED:
                return;
            case HALF_OPEN:
                if (!trialInFlight) {
                    trialInFlight = true;
                    log.info("[BREAKER] {} admitting half-open trial call", name);
                    return;
                }
                throw new CircuitOpenException(name);
            default:
                throw new CircuitOpenException(name);
        }
    }

    public synchronized void recordSuccess() {
        consecutiveFailures = 0;
        trialInFlight = false;
        if (state != State.CLOSED) {
            transition(State.CLOSED);
        }
    }

    public synchronized void recordFailure() {
        consecutiveFailures++;
        if (state == State.HALF_OPEN) {
            trialInFlight = false;
            trip();
        } else if (state == State.CLOSED && consecutiveFailures >= failureThreshold) {
            trip();
        }
    }

    /** Runs {@code call} under the breaker; any exception counts as one failure. */
    public <T> T execute(Supplier<T> call) {
        acquirePermission();
        try {
            T result = call.get();
            recordSuccess();
            return result;
        } catch (RuntimeException e) {
            recordFailure();
            throw e;
        }
    }

    private void trip() {
        openedAt = clock.instant();
        transition(State.OPEN);
        log.warn("[BREAKER] {} opened after {} consecutive failure(s); cooling down for {}s",
                name, consecutiveFailures, resetTimeout.toSeconds());
    }

    private void transition(State next) {
        if (state != next) {
            log.info("[BREAKER] {} {} -> {}", name, state, next);
            state = next;
        }
    }

    public String name() {
        return name;
    }
}
