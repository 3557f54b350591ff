package com.di.loannova.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IsoDates Tests")
class IsoDatesTest {

    @ParameterizedTest
    @ValueSource(strings = {"2024-03-31", "2024-03-31T10:15:30", "2024-03-31T10:15:30Z", "2024-03-31T10:15:30.123+02:00"})
    @DisplayName("Should accept ISO-8601 dates and timestamps")
    void testIsIso8601_Valid(String value) {
        assertTrue(IsoDates.isIso8601(value));
    }

    @ParameterizedTest
    @ValueSource(strings = {"31/03/2024", "2024/03/31", "March 31", ""})
    @DisplayName("Should reject non ISO-8601 values")
    void testIsIso8601_Invalid(String value) {
        assertFalse(IsoDates.isIso8601(value));
    }

    @Test
    @DisplayName("Should return empty for an impossible calendar date")
    void testParseIso_ImpossibleDate() {
        assertEquals(Optional.empty(), IsoDates.parseIso("2024-02-31"));
    }

    @ParameterizedTest
    @CsvSource({
            "2024-03-31, 2024-03-31",
            "2024-03-31 08:00:00, 2024-03-31",
            "2024/03/31, 2024-03-31",
            "03/31/2024, 2024-03-31",
            "20240331, 2024-03-31"
    })
    @DisplayName("Should parse common export layouts leniently")
    void testParseLenient(String input, String expected) {
        assertEquals(Optional.of(LocalDate.parse(expected)), IsoDates.parseLenient(input));
    }

    @Test
    @DisplayName("Should return empty for unparseable or null values")
    void testParseLenient_Unparseable() {
        assertTrue(IsoDates.parseLenient("not a date").isEmpty());
        assertTrue(IsoDates.parseLenient(null).isEmpty());
    }
}
