package com.di.loannova.observability;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Carries the submitting thread's SLF4J MDC ({@code runId}, {@code phase}) into
 * worker threads, so upload logs stay correlated with the run that produced them.
 *
 * <p>Usage: {@code CompletableFuture.runAsync(MdcPropagation.wrapRunnable(() -> upload(file)), pool)}
 * or {@code CompletableFuture.supplyAsync(MdcPropagation.wrapSupplier(...), pool)}.
 */
public final class MdcPropagation {

    private MdcPropagation() {
    }

    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> captured = copyMdc();
        return () -> runWithMdcContext(captured, task);
    }

    public static <T> Supplier<T> wrapSupplier(Supplier<T> task) {
        Map<String, String> captured = copyMdc();
        return () -> {
            apply(captured);
            try {
                return task.get();
            } finally {
                remove(captured);
            }
        };
    }

    private static void runWithMdcContext(Map<String, String> contextMap, Runnable task) {
        apply(contextMap);
        try {
            task.run();
        } finally {
            remove(contextMap);
        }
    }

    private static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static void apply(Map<String, String> contextMap) {
        if (contextMap != null) contextMap.forEach(MDC::put);
    }

    private static void remove(Map<String, String> contextMap) {
        if (contextMap != null) contextMap.keySet().forEach(MDC::remove);
    }
}
