package com.di.loannova.contract;

import com.di.loannova.common.Dataset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ContractValidator Tests")
class ContractValidatorTest {

    private final ContractValidator validator =
            new ContractValidator(Clock.fixed(Instant.parse("2024-06-30T12:00:00Z"), ZoneOffset.UTC));

    private static SchemaContract contract(List<String> required, List<String> numeric, List<String> dates,
                                           List<String> pct, List<String> nonNeg, List<String> keys, boolean unique) {
        return new SchemaContract(required, numeric, dates, pct, nonNeg, keys, unique);
    }

    @Test
    @DisplayName("Should return no violations for a conforming dataset")
    void testValidate_Clean() {
        Dataset ds = Dataset.of(List.of("loan_id", "balance", "as_of"), List.of(
                Map.of("loan_id", "L1", "balance", "10", "as_of", "2024-06-01")));
        SchemaContract c = contract(List.of("loan_id"), List.of("balance"), List.of("as_of"),
                List.of(), List.of("balance"), List.of("loan_id"), true);

        assertTrue(validator.validate(ds, c).isEmpty());
    }

    @Test
    @DisplayName("Should flag a missing required column as critical")
    void testValidate_MissingRequiredColumn() {
        Dataset ds = Dataset.of(List.of("loan_id"), List.of(Map.of("loan_id", "L1")));
        List<Violation> violations = validator.validate(ds, SchemaContract.empty().requiring(List.of("balance")));

        assertEquals(1, violations.size());
        assertEquals("required_column", violations.get(0).rule());
        assertTrue(ContractValidator.hasCritical(violations));
    }

    @Test
    @DisplayName("Should flag non-numeric literals but accept blanks")
    void testValidate_Numeric() {
        Dataset ds = Dataset.of(List.of("balance"), List.of(
                Map.of("balance", "12.5"), Map.of("balance", "n/a"), Map.of("balance", "")));
        List<Violation> violations = validator.validate(ds,
                contract(List.of(), List.of("balance"), List.of(), List.of(), List.of(), List.of(), false));

        assertEquals(1, violations.size());
        assertEquals(1, violations.get(0).row());
        assertFalse(violations.get(0).critical());
    }

    @Test
    @DisplayName("Should flag malformed dates and mark future dates critical")
    void testValidate_Dates() {
        Dataset ds = Dataset.of(List.of("as_of"), List.of(
                Map.of("as_of", "30/06/2024"), Map.of("as_of", "2024-07-15")));
        List<Violation> violations = validator.validate(ds,
                contract(List.of(), List.of(), List.of("as_of"), List.of(), List.of(), List.of(), false));

        assertEquals(List.of("iso8601", "future_date"), violations.stream().map(Violation::rule).toList());
        assertFalse(violations.get(0).critical());
        assertTrue(violations.get(1).critical());
    }

    @Test
    @DisplayName("Should enforce percentage and non-negative bounds")
    void testValidate_Bounds() {
        Dataset ds = Dataset.of(List.of("rate", "amount"), List.of(
                Map.of("rate", "101", "amount", "-1"), Map.of("rate", "50", "amount", "3")));
        List<Violation> violations = validator.validate(ds,
                contract(List.of(), List.of(), List.of(), List.of("rate"), List.of("amount"), List.of(), false));

        assertEquals(List.of("percentage_bounds", "non_negative"), violations.stream().map(Violation::rule).toList());
    }

    @Test
    @DisplayName("Should report null and duplicate keys")
    void testValidate_Keys() {
        Dataset ds = Dataset.of(List.of("loan_id"), List.of(
                Map.of("loan_id", "L1"), Map.of("loan_id", "L1"), Map.of("loan_id", " ")));
        List<Violation> violations = validator.validate(ds,
                contract(List.of(), List.of(), List.of(), List.of(), List.of(), List.of("loan_id"), true));

        assertEquals(List.of("key_unique", "key_not_null"), violations.stream().map(Violation::rule).toList());
    }

    @Test
    @DisplayName("Should reject a malformed contract before evaluating rules")
    void testValidate_MalformedContract() {
        Dataset ds = Dataset.of(List.of("x"), List.of(Map.of("x", "abc")));
        SchemaContract c = contract(Arrays.asList("x", " "), List.of("x"), List.of("x"),
                List.of(), List.of(), List.of(), false);

        List<Violation> violations = validator.validate(ds, c);

        assertEquals(2, violations.size());
        assertTrue(violations.stream().allMatch(v -> v.rule().equals("malformed_contract") && v.critical()));
    }
}
