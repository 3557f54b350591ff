package com.di.loannova.contract;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical loan-tape fields and their built-in source aliases.
 */
public final class LoanTapeSchema {

    public static final String LOAN_ID                = "loan_id";
    public static final String TOTAL_RECEIVABLE_USD   = "total_receivable_usd";
    public static final String TOTAL_ELIGIBLE_USD     = "total_eligible_usd";
    public static final String DISCOUNTED_BALANCE_USD = "discounted_balance_usd";
    public static final String CASH_AVAILABLE_USD     = "cash_available_usd";
    public static final String DPD_0_7_USD            = "dpd_0_7_usd";
    public static final String DPD_7_30_USD           = "dpd_7_30_usd";
    public static final String DPD_30_60_USD          = "dpd_30_60_usd";
    public static final String DPD_60_90_USD          = "dpd_60_90_usd";
    public static final String DPD_90_PLUS_USD        = "dpd_90_plus_usd";
    public static final String MEASUREMENT_DATE       = "measurement_date";

    /** Must be present in every loan tape; absence is a critical violation. */
    public static final List<String> CORE_COLUMNS = List.of(
            TOTAL_RECEIVABLE_USD, TOTAL_ELIGIBLE_USD, DISCOUNTED_BALANCE_USD);

    /** Optional monetary fields, defaulted to zero. */
    public static final List<String> DEFAULTED_COLUMNS = List.of(
            CASH_AVAILABLE_USD, DPD_0_7_USD, DPD_7_30_USD, DPD_30_60_USD, DPD_60_90_USD, DPD_90_PLUS_USD);

    public static final List<String> DPD_BUCKETS = List.of(
            DPD_0_7_USD, DPD_7_30_USD, DPD_30_60_USD, DPD_60_90_USD, DPD_90_PLUS_USD);

    private LoanTapeSchema() {
    }

    /** Priority-ordered candidates per canonical field. */
    public static Map<String, List<String>> defaultAliases() {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put(LOAN_ID, List.of(LOAN_ID, "loan_number", "loan_reference", "credit_id"));
        m.put(TOTAL_RECEIVABLE_USD, List.of(TOTAL_RECEIVABLE_USD, "total_receivable",
                "outstanding_balance_usd", "outstanding_balance"));
        m.put(TOTAL_ELIGIBLE_USD, List.of(TOTAL_ELIGIBLE_USD, "total_eligible", "eligible_balance_usd", "eligible_balance"));
        m.put(DISCOUNTED_BALANCE_USD, List.of(DISCOUNTED_BALANCE_USD, "discounted_balance"));
        m.put(CASH_AVAILABLE_USD, List.of(CASH_AVAILABLE_USD, "cash_available", "cash_balance_usd", "cash_balance"));
        m.put(DPD_0_7_USD, List.of(DPD_0_7_USD, "dpd_0_7"));
        m.put(DPD_7_30_USD, List.of(DPD_7_30_USD, "dpd_7_30"));
        m.put(DPD_30_60_USD, List.of(DPD_30_60_USD, "dpd_30_60"));
        m.put(DPD_60_90_USD, List.of(DPD_60_90_USD, "dpd_60_90"));
        m.put(DPD_90_PLUS_USD, List.of(DPD_90_PLUS_USD, "dpd_90_plus", "dpd_90+"));
        m.put(MEASUREMENT_DATE, List.of(MEASUREMENT_DATE, "reporting_date", "as_of_date", "snapshot_date"));
        return m;
    }
}
