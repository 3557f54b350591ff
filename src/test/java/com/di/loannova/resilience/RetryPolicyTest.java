package com.di.loannova.resilience;

import com.di.loannova.exception.TransientNetworkException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RetryPolicy Tests")
class RetryPolicyTest {

    private final List<Double> sleeps = new ArrayList<>();
    private final Sleeper recording = sleeps::add;

    @Test
    @DisplayName("Should make maxRetries + 1 attempts before giving up")
    void testExecute_ExhaustsAttempts() {
        RetryPolicy policy = new RetryPolicy(3, 1.0, 0.0, recording, new Random(7));
        AtomicInteger attempts = new AtomicInteger();
        AtomicInteger retries = new AtomicInteger();

        TransientNetworkException e = assertThrows(TransientNetworkException.class,
                () -> policy.execute("fetch", () -> {
                    throw new TransientNetworkException("attempt " + attempts.incrementAndGet());
                }, retries::incrementAndGet));

        assertEquals(4, attempts.get());
        assertEquals(3, retries.get());
        assertEquals("attempt 4", e.getMessage());
        assertEquals(List.of(1.0, 2.0, 4.0), sleeps);
    }

    @Test
    @DisplayName("Should return as soon as an attempt succeeds")
    void testExecute_RecoversAfterTransientFailure() {
        RetryPolicy policy = new RetryPolicy(3, 0.5, 0.0, recording, new Random(7));
        AtomicInteger attempts = new AtomicInteger();

        String result = policy.execute("fetch", () -> {
            if (attempts.incrementAndGet() < 2) throw new TransientNetworkException("timeout");
            return "payload";
        });

        assertEquals("payload", result);
        assertEquals(List.of(0.5), sleeps);
    }

    @Test
    @DisplayName("Should not retry terminal failures")
    void testExecute_TerminalFailure() {
        RetryPolicy policy = new RetryPolicy(3, 1.0, 0.0, recording, new Random(7));
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(IllegalStateException.class, () -> policy.execute("fetch", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("404");
        }));
        assertEquals(1, attempts.get());
        assertTrue(sleeps.isEmpty());
    }

    @ParameterizedTest
    @CsvSource({"1, 1.0", "2, 2.0", "3, 4.0", "4, 8.0"})
    @DisplayName("Should double the delay per attempt without jitter")
    void testDelayAfter_Exponential(int attempt, double expected) {
        RetryPolicy policy = new RetryPolicy(5, 1.0, 0.0, recording, new Random(7));

        assertEquals(expected, policy.delayAfter(attempt), 1e-9);
    }

    @Test
    @DisplayName("Should keep jittered delays within half the jitter and never negative")
    void testDelayAfter_JitterBounds() {
        RetryPolicy policy = new RetryPolicy(5, 0.1, 1.0, recording, new Random(42));

        for (int i = 0; i < 200; i++) {
            double delay = policy.delayAfter(1);
            assertTrue(delay >= 0.0);
            assertTrue(delay <= 0.6 + 1e-9);
        }
    }

    @Test
    @DisplayName("Should reject negative maxRetries")
    void testConstructor_NegativeRetries() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(-1, 1.0, 0.0));
    }
}
