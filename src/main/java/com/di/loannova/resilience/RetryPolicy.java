package com.di.loannova.resilience;

import com.di.loannova.exception.PipelineException;
import com.di.loannova.exception.TransientNetworkException;
import lombok.extern.slf4j.Slf4j;

import java.util.Random;
import java.util.function.Supplier;

/**
 * Exponential backoff with symmetric jitter.
 *
 * <p>Attempt {@code n} (1-based) that fails with a {@link TransientNetworkException} is followed by a pause of
 * {@code backoff * 2^(n-1) + jitter * (0.5 - U[0,1))}, never negative. Any other exception is terminal and
 * propagates immediately. After {@code maxRetries + 1} attempts the last transient failure is rethrown.
 */
@Slf4j
public class RetryPolicy {

    private final int maxRetries;
    private final double backoffSeconds;
    private final double jitterSeconds;
    private final Sleeper sleeper;
    private final Random random;

    public RetryPolicy(int maxRetries, double backoffSeconds, double jitterSeconds) {
        this(maxRetries, backoffSeconds, jitterSeconds, Sleeper.SYSTEM, new Random());
    }

    public RetryPolicy(int maxRetries, double backoffSeconds, double jitterSeconds, Sleeper sleeper, Random random) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.backoffSeconds = Math.max(0.0, backoffSeconds);
        this.jitterSeconds = Math.max(0.0, jitterSeconds);
        this.sleeper = sleeper;
        this.random = random;
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    /** Pause before the attempt following failed attempt {@code attempt} (1-based). */
    public double delayAfter(int attempt) {
        double delay = backoffSeconds * Math.pow(2, attempt - 1);
        if (jitterSeconds > 0) {
            delay += jitterSeconds * (0.5 - random.nextDouble());
        }
        return Math.max(0.0, delay);
    }

    public <T> T execute(String operation, Supplier<T> call) {
        return execute(operation, call, () -> { });
    }

    /**
     * @param onRetry invoked once per scheduled retry, before sleeping
     */
    public <T> T execute(String operation, Supplier<T> call, Runnable onRetry) {
        TransientNetworkException last = null;
        for (int attempt = 1; attempt <= maxAttempts(); attempt++) {
            try {
                return call.get();
            } catch (TransientNetworkException e) {
                last = e;
                if (attempt == maxAttempts()) {
                    break;
                }
                double delay = delayAfter(attempt);
                log.warn("[HTTP] {} attempt {}/{} failed: {} (retrying in {}s)",
                        operation, attempt, maxAttempts(), e.getMessage(), String.format("%.2f", delay));
                onRetry.run();
                pause(delay);
            }
        }
        log.error("[HTTP] {} gave up after {} attempt(s)", operation, maxAttempts());
        throw last;
    }

    private void pause(double seconds) {
        try {
            sleeper.sleep(seconds);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("Retry interrupted", e);
        }
    }
}
