package com.di.loannova.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions escaping the REST layer to a structured {@link ErrorResponse}.
 *
 * <p>Pipeline failures normally end up in the run summary; this handler only sees what escapes
 * the orchestrator (bad request bodies, configuration errors, unexpected bugs). Each error is
 * categorised with {@link ErrorCategory} and logged with the current {@code runId} when one is bound.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e, HttpServletRequest request) {
        return respond("UNREADABLE_BODY", ErrorCategory.SERIALIZATION_ERROR, e, HttpStatus.BAD_REQUEST, request);
    }

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<ErrorResponse> handleValidationException(RuntimeException e, HttpServletRequest request) {
        return respond("VALIDATION_EXCEPTION", ErrorCategory.categorize(e), e, HttpStatus.BAD_REQUEST, request);
    }

    @ExceptionHandler({CircuitOpenException.class, TransientNetworkException.class})
    public ResponseEntity<ErrorResponse> handleUpstreamException(PipelineException e, HttpServletRequest request) {
        return respond("UPSTREAM_EXCEPTION", ErrorCategory.categorize(e), e, HttpStatus.SERVICE_UNAVAILABLE, request);
    }

    @ExceptionHandler({ContractViolationException.class, SchemaDriftException.class})
    public ResponseEntity<ErrorResponse> handleDataException(PipelineException e, HttpServletRequest request) {
        return respond("DATA_EXCEPTION", ErrorCategory.categorize(e), e, HttpStatus.UNPROCESSABLE_ENTITY, request);
    }

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<ErrorResponse> handlePipelineException(PipelineException e, HttpServletRequest request) {
        return respond("PIPELINE_EXCEPTION", ErrorCategory.categorize(e), e, HttpStatus.INTERNAL_SERVER_ERROR, request);
    }

    @ExceptionHandler(java.util.concurrent.TimeoutException.class)
    public ResponseEntity<ErrorResponse> handleTimeoutException(java.util.concurrent.TimeoutException e, HttpServletRequest request) {
        return respond("TIMEOUT_EXCEPTION", ErrorCategory.TIMEOUT_ERROR, e, HttpStatus.REQUEST_TIMEOUT, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e, HttpServletRequest request) {
        return respond("UNHANDLED_EXCEPTION", ErrorCategory.categorize(e), e, HttpStatus.INTERNAL_SERVER_ERROR, request);
    }

    private ResponseEntity<ErrorResponse> respond(String eventType, ErrorCategory category, Throwable e,
                                                  HttpStatus status, HttpServletRequest request) {
        String runId = MDC.get("runId");
        if (status.is5xxServerError()) {
            log.error("[API] {} [{}] runId={}: {}", eventType, category.getName(), runId, e.getMessage(), e);
        } else {
            log.warn("[API] {} [{}] runId={}: {}", eventType, category.getName(), runId, e.getMessage());
        }
        return ResponseEntity.status(status).body(buildErrorResponse(category, e, status, request));
    }

    static ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status,
                                            HttpServletRequest request) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setErrorCategoryDescription(category.getDescription());
        response.setPath(request != null ? request.getRequestURI() : "/unknown");
        response.addDetail("exceptionType", exception.getClass().getName());

        Throwable rootCause = rootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        if (exception instanceof ContractViolationException cve) {
            response.addDetail("violations", cve.getViolations());
        }
        if (exception instanceof SchemaDriftException sde) {
            response.addDetail("missingColumns", sde.getMissingColumns());
            response.addDetail("unexpectedColumns", sde.getUnexpectedColumns());
        }
        return response;
    }

    private static Throwable rootCause(Throwable exception) {
        Throwable current = exception;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Structured error response for API endpoints.
     */
    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String errorCategoryDescription;
        private String path;
        private Map<String, Object> details = new LinkedHashMap<>();

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
