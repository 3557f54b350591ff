package com.di.loannova.resilience;

/**
 * Blocking pause between attempts; swapped out in tests so backoff never really waits.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = seconds -> {
        if (seconds > 0) {
            Thread.sleep((long) (seconds * 1000));
        }
    };

    void sleep(double seconds) throws InterruptedException;
}
