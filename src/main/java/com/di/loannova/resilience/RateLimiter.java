package com.di.loannova.resilience;

import com.di.loannova.exception.PipelineException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Interval throttle: consecutive calls are spaced at least {@code 60 / maxRequestsPerMinute} seconds apart.
 */
public class RateLimiter {

    private final Duration interval;
    private final Clock clock;
    private final Sleeper sleeper;
    private Instant lastCall;

    public RateLimiter(int maxRequestsPerMinute, Clock clock, Sleeper sleeper) {
        if (maxRequestsPerMinute < 1) {
            throw new IllegalArgumentException("maxRequestsPerMinute must be >= 1, got " + maxRequestsPerMinute);
        }
        this.interval = Duration.ofMillis(Math.round(60_000.0 / maxRequestsPerMinute));
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public Duration interval() {
        return interval;
    }

    /** Blocks until the next call is allowed, then claims the slot. */
    public synchronized void acquire() {
        Instant now = clock.instant();
        if (lastCall != null) {
            Duration wait = Duration.between(now, lastCall.plus(interval));
            if (!wait.isNegative() && !wait.isZero()) {
                try {
                    sleeper.sleep(wait.toMillis() / 1000.0);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new PipelineException("Rate limiter wait interrupted", e);
                }
                now = clock.instant();
            }
        }
        lastCall = now;
    }
}
