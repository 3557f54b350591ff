package com.di.loannova.ingestion;

import com.di.loannova.common.Dataset;
import com.di.loannova.exception.SchemaDriftException;
import com.di.loannova.support.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.di.loannova.contract.LoanTapeSchema.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BiExportConverter Tests")
class BiExportConverterTest {

    private final TabularParser parser = new TabularParser();
    private final BiExportConverter converter =
            new BiExportConverter(Clock.fixed(Instant.parse("2024-07-01T00:00:00Z"), ZoneOffset.UTC));

    private Dataset fixture(String name) {
        return parser.parseCsv(Fixtures.bytes(name));
    }

    @Test
    @DisplayName("Should convert PAR balances into one snapshot per reporting date")
    void testConvert_ParBalances() {
        BiExportConverter.Conversion conversion = converter.convert(fixture("bi_par_balances.csv"),
                Map.of("2024-06-30", 5500.0), null, "today");

        Dataset ds = conversion.dataset();
        assertEquals(BiExportConverter.MODE_PAR_BALANCES, conversion.sourceMode());
        assertEquals(2, ds.size());
        assertEquals("looker_snapshot_20240531", ds.value(0, LOAN_ID));
        assertEquals(10000.0, ds.value(0, TOTAL_RECEIVABLE_USD));
        assertEquals(10000.0, ds.value(0, TOTAL_ELIGIBLE_USD));
        assertEquals(8000.0, ds.value(0, DPD_0_7_USD));
        assertEquals(500.0, ds.value(0, DPD_7_30_USD));
        assertEquals(700.0, ds.value(0, DPD_30_60_USD));
        assertEquals(500.0, ds.value(0, DPD_60_90_USD));
        assertEquals(300.0, ds.value(0, DPD_90_PLUS_USD));
        assertEquals(0.0, ds.value(0, CASH_AVAILABLE_USD));
        assertEquals(5500.0, ds.value(1, CASH_AVAILABLE_USD));
    }

    @Test
    @DisplayName("Should bucket per-loan balances by days past due on the strategy date")
    void testConvert_LoanDpd() {
        BiExportConverter.Conversion conversion = converter.convert(fixture("bi_dpd_loans.csv"),
                Map.of(), null, "max_disburse_date");

        Dataset ds = conversion.dataset();
        assertEquals(BiExportConverter.MODE_LOAN_DPD, conversion.sourceMode());
        assertEquals(1, ds.size());
        assertEquals("2024-04-20", ds.value(0, MEASUREMENT_DATE));
        assertEquals(2000.0, ds.value(0, TOTAL_RECEIVABLE_USD));
        assertEquals(1000.0, ds.value(0, DPD_0_7_USD));
        assertEquals(500.0, ds.value(0, DPD_7_30_USD));
        assertEquals(300.0, ds.value(0, DPD_30_60_USD));
        assertEquals(0.0, ds.value(0, DPD_60_90_USD));
        assertEquals(200.0, ds.value(0, DPD_90_PLUS_USD));
    }

    @Test
    @DisplayName("Should fall back to today when the strategy column is absent")
    void testConvert_TodayStrategy() {
        Dataset source = Dataset.of(List.of("days_past_due", "outstanding_balance_usd"),
                List.of(Map.of("days_past_due", 3.0, "outstanding_balance_usd", 100.0)));

        Dataset ds = converter.convert(source, Map.of(), "", "max_maturity_date").dataset();

        assertEquals("2024-07-01", ds.value(0, MEASUREMENT_DATE));
    }

    @Test
    @DisplayName("Should prefer a per-row measurement date column when configured")
    void testConvert_MeasurementDateColumn() {
        Dataset source = Dataset.of(List.of("dpd", "outstanding_balance", "as_of"), List.of(
                Map.of("dpd", 0.0, "outstanding_balance", 100.0, "as_of", "2024-05-31"),
                Map.of("dpd", 95.0, "outstanding_balance", 50.0, "as_of", "2024-06-30"),
                Map.of("dpd", 10.0, "outstanding_balance", 25.0, "as_of", "2024-06-30")));

        Dataset ds = converter.convert(source, Map.of(), "as_of", "today").dataset();

        assertEquals(2, ds.size());
        assertEquals(75.0, ds.value(1, TOTAL_RECEIVABLE_USD));
        assertEquals(50.0, ds.value(1, DPD_90_PLUS_USD));
        assertEquals(25.0, ds.value(1, DPD_7_30_USD));
    }

    @Test
    @DisplayName("Should raise schema drift with the missing and unexpected columns")
    void testConvert_SchemaDrift() {
        SchemaDriftException e = assertThrows(SchemaDriftException.class,
                () -> converter.convert(fixture("bi_unknown.csv"), Map.of(), null, "today"));

        assertTrue(e.getMissingColumns().containsAll(List.of("reporting_date", "outstanding_balance_usd", "dpd")));
        assertEquals(List.of("region", "headcount"), e.getUnexpectedColumns());
    }

    @ParameterizedTest
    @CsvSource({"0, 0", "6.9, 0", "7, 1", "29, 1", "30, 2", "59, 2", "60, 3", "89, 3", "90, 4", "365, 4"})
    @DisplayName("Should place days past due into the 7/30/60/90 buckets")
    void testBucketIndex(double dpd, int expected) {
        assertEquals(expected, BiExportConverter.bucketIndex(dpd));
    }
}
