package com.di.loannova.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories for run summaries, alerts and log lines.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN), add a matcher in
 * {@link #MATCHERS}, and a helper in the "Matcher helpers" section when the test is not a plain instanceof.
 */
public enum ErrorCategory {

    CONTRACT_VIOLATION("Contract violation", "Dataset broke its schema contract"),
    SCHEMA_DRIFT("Schema drift", "Source layout matches no recognized shape"),
    CIRCUIT_OPEN("Circuit open", "Remote call rejected by an open circuit breaker"),
    TRANSIENT_NETWORK("Transient network error", "Remote source failed after retries"),
    CALCULATION_ERROR("Calculation error", "A KPI could not be computed"),
    PERSISTENCE_ERROR("Persistence error", "Artifact, manifest or state could not be written"),
    NETWORK_ERROR("Network error", "Network communication failure"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    VALIDATION_ERROR("Validation error", "Input validation or configuration rule violation"),
    SERIALIZATION_ERROR("Serialization error", "Data could not be parsed or serialized"),
    RESOURCE_ERROR("Resource error", "File missing or system resource unavailable"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. Pipeline exceptions come before the generic JDK ones. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof ContractViolationException, CONTRACT_VIOLATION);
        MATCHERS.put(t -> t instanceof SchemaDriftException, SCHEMA_DRIFT);
        MATCHERS.put(t -> t instanceof CircuitOpenException, CIRCUIT_OPEN);
        MATCHERS.put(t -> t instanceof TransientNetworkException, TRANSIENT_NETWORK);
        MATCHERS.put(t -> t instanceof CalculationException, CALCULATION_ERROR);
        MATCHERS.put(t -> t instanceof PersistenceException, PERSISTENCE_ERROR);
        MATCHERS.put(ErrorCategory::isResourceError, RESOURCE_ERROR);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    // --- Matcher helpers ---

    private static boolean isResourceError(Throwable t) {
        return t instanceof java.io.FileNotFoundException
                || t instanceof java.nio.file.NoSuchFileException
                || t instanceof java.nio.file.AccessDeniedException
                || t instanceof OutOfMemoryError;
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException
                || messageContains(t, "timed out", "timeout");
    }

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException
                || t instanceof org.springframework.web.client.ResourceAccessException;
    }

    private static boolean isSerializationError(Throwable t) {
        return t instanceof com.fasterxml.jackson.core.JsonProcessingException
                || t instanceof java.io.UncheckedIOException && t.getCause() instanceof com.fasterxml.jackson.core.JsonProcessingException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException;
    }

    private static boolean messageContains(Throwable t, String... keywords) {
        String msg = t.getMessage();
        if (msg == null) return false;
        String lower = msg.toLowerCase();
        for (String k : keywords) {
            if (lower.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
