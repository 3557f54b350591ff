package com.di.loannova.resilience;

import com.di.loannova.exception.CircuitOpenException;
import com.di.loannova.exception.TransientNetworkException;
import com.di.loannova.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CircuitBreaker Tests")
class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker breaker;
    private AtomicInteger calls;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-06-30T00:00:00Z");
        breaker = new CircuitBreaker("http-source", 2, Duration.ofSeconds(60), clock);
        calls = new AtomicInteger();
    }

    private String failing() {
        calls.incrementAndGet();
        throw new TransientNetworkException("503");
    }

    private String succeeding() {
        calls.incrementAndGet();
        return "ok";
    }

    private void trip() {
        for (int i = 0; i < 2; i++) {
            assertThrows(TransientNetworkException.class, () -> breaker.execute(this::failing));
        }
    }

    @Test
    @DisplayName("Should reject invalid failure threshold")
    void testConstructor_InvalidThreshold() {
        assertThrows(IllegalArgumentException.class,
                () -> new CircuitBreaker("x", 0, Duration.ofSeconds(1), clock));
    }

    @Test
    @DisplayName("Should open after the configured consecutive failures")
    void testOpensAfterThreshold() {
        trip();

        assertEquals(CircuitBreaker.State.OPEN, breaker.state());
        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("Should reset the failure count on success while closed")
    void testSuccessResetsCount() {
        assertThrows(TransientNetworkException.class, () -> breaker.execute(this::failing));
        breaker.execute(this::succeeding);
        assertThrows(TransientNetworkException.class, () -> breaker.execute(this::failing));

        assertEquals(CircuitBreaker.State.CLOSED, breaker.state());
        assertEquals(1, breaker.consecutiveFailures());
    }

    @Test
    @DisplayName("Should reject calls while open without invoking the operation")
    void testOpenRejectsWithoutAttempt() {
        trip();

        assertThrows(CircuitOpenException.class, () -> breaker.execute(this::succeeding));
        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("Should admit a single trial call after the cooldown and close on success")
    void testHalfOpenTrialSucceeds() {
        trip();
        clock.advance(Duration.ofSeconds(60));

        assertEquals(CircuitBreaker.State.HALF_OPEN, breaker.state());
        assertEquals("ok", breaker.execute(this::succeeding));
        assertEquals(CircuitBreaker.State.CLOSED, breaker.state());
        assertEquals(0, breaker.consecutiveFailures());
    }

    @Test
    @DisplayName("Should reopen and restart the cooldown when the trial call fails")
    void testHalfOpenTrialFails() {
        trip();
        clock.advance(Duration.ofSeconds(61));

        assertThrows(TransientNetworkException.class, () -> breaker.execute(this::failing));
        assertEquals(CircuitBreaker.State.OPEN, breaker.state());

        clock.advance(Duration.ofSeconds(59));
        assertThrows(CircuitOpenException.class, () -> breaker.execute(this::succeeding));
        clock.advance(Duration.ofSeconds(1));
        assertEquals(CircuitBreaker.State.HALF_OPEN, breaker.state());
    }

    @Test
    @DisplayName("Should reject a second caller while the trial call is in flight")
    void testSingleTrialCall() {
        trip();
        clock.advance(Duration.ofSeconds(60));

        breaker.acquirePermission();

        assertThrows(CircuitOpenException.class, breaker::acquirePermission);
        breaker.recordSuccess();
        assertEquals(CircuitBreaker.State.CLOSED, breaker.state());
    }
}
