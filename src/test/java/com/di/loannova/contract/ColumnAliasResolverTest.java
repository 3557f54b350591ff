package com.di.loannova.contract;

import com.di.loannova.common.Dataset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ColumnAliasResolver Tests")
class ColumnAliasResolverTest {

    @Test
    @DisplayName("Should rename aliased columns to canonical names")
    void testResolve_RenamesAliases() {
        Dataset ds = Dataset.of(List.of("Loan Number", "outstanding_balance", "reporting_date"), List.of(
                Map.of("Loan Number", "L1", "outstanding_balance", "100", "reporting_date", "2024-06-01")));

        ColumnAliasResolver.Resolved resolved = ColumnAliasResolver.withOverrides(Map.of()).resolve(ds);

        assertEquals(List.of("loan_id", "total_receivable_usd", "measurement_date"), resolved.dataset().columns());
        assertEquals("100", resolved.dataset().value(0, "total_receivable_usd"));
        assertEquals("outstanding_balance", resolved.resolutions().get("total_receivable_usd").source());
        assertEquals("NORMALIZED", resolved.resolutions().get("loan_id").match());
    }

    @Test
    @DisplayName("Should keep an existing canonical column and not steal it for another field")
    void testResolve_CanonicalClaimedFirst() {
        Dataset ds = Dataset.of(List.of("total_receivable_usd", "outstanding_balance"), List.of(
                Map.of("total_receivable_usd", "5", "outstanding_balance", "7")));

        ColumnAliasResolver.Resolved resolved = ColumnAliasResolver.withOverrides(null).resolve(ds);

        assertSame(ds, resolved.dataset());
        assertEquals("EXACT", resolved.resolutions().get("total_receivable_usd").match());
    }

    @Test
    @DisplayName("Should let configured aliases override the built-in list")
    void testResolve_Overrides() {
        Dataset ds = Dataset.of(List.of("saldo"), List.of(Map.of("saldo", "9")));

        ColumnAliasResolver.Resolved resolved = ColumnAliasResolver
                .withOverrides(Map.of("total_receivable_usd", List.of("saldo")))
                .resolve(ds);

        assertEquals(List.of("total_receivable_usd"), resolved.dataset().columns());
    }
}
