package com.di.loannova.resilience;

import com.di.loannova.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RateLimiter Tests")
class RateLimiterTest {

    @Test
    @DisplayName("Should space consecutive calls by the configured interval")
    void testAcquire_WaitsForInterval() {
        MutableClock clock = MutableClock.at("2024-06-30T00:00:00Z");
        List<Double> sleeps = new ArrayList<>();
        RateLimiter limiter = new RateLimiter(60, clock, seconds -> {
            sleeps.add(seconds);
            clock.advance(Duration.ofMillis(Math.round(seconds * 1000)));
        });

        limiter.acquire();
        clock.advance(Duration.ofMillis(250));
        limiter.acquire();

        assertEquals(Duration.ofSeconds(1), limiter.interval());
        assertEquals(List.of(0.75), sleeps);
    }

    @Test
    @DisplayName("Should not wait when the interval already elapsed")
    void testAcquire_NoWait() {
        MutableClock clock = MutableClock.at("2024-06-30T00:00:00Z");
        List<Double> sleeps = new ArrayList<>();
        RateLimiter limiter = new RateLimiter(120, clock, sleeps::add);

        limiter.acquire();
        clock.advance(Duration.ofSeconds(1));
        limiter.acquire();

        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Should reject a non-positive rate")
    void testConstructor_Invalid() {
        assertThrows(IllegalArgumentException.class,
                () -> new RateLimiter(0, MutableClock.at("2024-06-30T00:00:00Z"), Sleeper.SYSTEM));
    }
}
