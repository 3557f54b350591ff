package com.di.loannova.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.mock.web.MockHttpServletRequest;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GlobalExceptionHandler Tests")
class GlobalExceptionHandlerTest {

    @Test
    @DisplayName("Should describe the category and request path")
    void testBuildErrorResponse_Basics() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/pipeline/run");

        GlobalExceptionHandler.ErrorResponse response = GlobalExceptionHandler.buildErrorResponse(
                ErrorCategory.VALIDATION_ERROR, new IllegalArgumentException("bad strategy"),
                HttpStatus.BAD_REQUEST, request);

        assertEquals(400, response.getStatus());
        assertEquals("Bad Request", response.getError());
        assertEquals("bad strategy", response.getMessage());
        assertEquals("VALIDATION_ERROR", response.getErrorCategory());
        assertEquals(ErrorCategory.VALIDATION_ERROR.getName(), response.getErrorCategoryName());
        assertEquals("/api/pipeline/run", response.getPath());
        assertEquals(IllegalArgumentException.class.getName(), response.getDetails().get("exceptionType"));
        assertFalse(response.getDetails().containsKey("rootCauseType"));
        assertNotNull(response.getTimestamp());
    }

    @Test
    @DisplayName("Should report the root cause and fall back to the class name without a message")
    void testBuildErrorResponse_RootCause() {
        PersistenceException e = new PersistenceException("Failed to write manifest",
                new IllegalStateException(new IOException("disk full")));

        GlobalExceptionHandler.ErrorResponse response = GlobalExceptionHandler.buildErrorResponse(
                ErrorCategory.PERSISTENCE_ERROR, e, HttpStatus.INTERNAL_SERVER_ERROR, null);

        assertEquals("/unknown", response.getPath());
        assertEquals(IOException.class.getName(), response.getDetails().get("rootCauseType"));
        assertEquals("disk full", response.getDetails().get("rootCauseMessage"));

        GlobalExceptionHandler.ErrorResponse anonymous = GlobalExceptionHandler.buildErrorResponse(
                ErrorCategory.UNKNOWN, new NullPointerException(), HttpStatus.INTERNAL_SERVER_ERROR, null);
        assertEquals("NullPointerException", anonymous.getMessage());
    }

    @Test
    @DisplayName("Should list missing and unexpected columns for schema drift")
    void testBuildErrorResponse_SchemaDrift() {
        SchemaDriftException e = new SchemaDriftException("unrecognized layout",
                List.of("dpd_30_60_usd"), List.of("headcount"));

        GlobalExceptionHandler.ErrorResponse response = GlobalExceptionHandler.buildErrorResponse(
                ErrorCategory.SCHEMA_DRIFT, e, HttpStatus.UNPROCESSABLE_ENTITY, null);

        assertEquals(422, response.getStatus());
        assertEquals(List.of("dpd_30_60_usd"), response.getDetails().get("missingColumns"));
        assertEquals(List.of("headcount"), response.getDetails().get("unexpectedColumns"));
    }
}
