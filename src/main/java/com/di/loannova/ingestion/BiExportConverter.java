package com.di.loannova.ingestion;

import com.di.loannova.common.ColumnFinder;
import com.di.loannova.common.Dataset;
import com.di.loannova.common.IsoDates;
import com.di.loannova.exception.SchemaDriftException;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import static com.di.loannova.contract.LoanTapeSchema.*;

/**
 * Converts BI-tool exports into one canonical loan-tape snapshot row per measurement date.
 *
 * <p>Two shapes are recognised, checked in this order:
 * <ul>
 *   <li><b>PAR balances</b>: {@code reporting_date}, {@code outstanding_balance[_usd]} and
 *       {@code par_7/30/60/90_balance_usd}. Buckets come from successive differences, clipped at zero.</li>
 *   <li><b>Per-loan DPD</b>: {@code dpd} or {@code days_past_due} plus {@code outstanding_balance[_usd]}.
 *       Each balance lands in the bucket its days-past-due falls into (thresholds 7/30/60/90).</li>
 * </ul>
 * Anything else is schema drift; no partial dataset is produced.
 */
public class BiExportConverter {

    public static final String MODE_PAR_BALANCES = "bi_par_balances";
    public static final String MODE_LOAN_DPD     = "bi_loan_dpd";

    static final int DPD_7  = 7;
    static final int DPD_30 = 30;
    static final int DPD_60 = 60;
    static final int DPD_90 = 90;

    private static final List<String> PAR_COLUMNS = List.of(
            "reporting_date", "outstanding_balance_usd",
            "par_7_balance_usd", "par_30_balance_usd", "par_60_balance_usd", "par_90_balance_usd");
    private static final List<String> DPD_COLUMNS = List.of("dpd", "outstanding_balance_usd");

    /** Converted snapshot rows and the shape that was recognised. */
    public record Conversion(Dataset dataset, String sourceMode) {
    }

    private final Clock clock;

    public BiExportConverter(Clock clock) {
        this.clock = clock;
    }

    public Conversion convert(Dataset source, Map<String, Double> cashByDate,
                              String measurementDateColumn, String measurementDateStrategy) {
        List<String> columns = source.columns();
        List<String> parMissing = missingParColumns(columns);
        if (parMissing.isEmpty()) {
            return new Conversion(fromParBalances(source, cashByDate), MODE_PAR_BALANCES);
        }
        List<String> dpdMissing = missingDpdColumns(columns);
        if (dpdMissing.isEmpty()) {
            return new Conversion(fromLoanDpd(source, cashByDate, measurementDateColumn, measurementDateStrategy),
                    MODE_LOAN_DPD);
        }

        Set<String> missing = new LinkedHashSet<>(parMissing);
        missing.addAll(dpdMissing);
        Set<String> known = new LinkedHashSet<>(PAR_COLUMNS);
        known.addAll(List.of("outstanding_balance", "days_past_due", "dpd"));
        List<String> unexpected = columns.stream()
                .filter(c -> known.stream().noneMatch(k -> k.equalsIgnoreCase(c)))
                .toList();
        throw new SchemaDriftException("BI export matches neither the PAR-balance nor the per-loan DPD shape",
                new ArrayList<>(missing), unexpected);
    }

    /* ------------------------------------------------------------------ */
    /* Shape detection                                                      */
    /* ------------------------------------------------------------------ */

    private static List<String> missingParColumns(List<String> columns) {
        List<String> missing = new ArrayList<>();
        for (String c : PAR_COLUMNS) {
            if (c.equals("outstanding_balance_usd")) {
                if (balanceColumn(columns).isEmpty()) missing.add(c);
            } else if (ColumnFinder.findIgnoreCase(columns, c).isEmpty()) {
                missing.add(c);
            }
        }
        return missing;
    }

    private static List<String> missingDpdColumns(List<String> columns) {
        List<String> missing = new ArrayList<>();
        if (dpdColumn(columns).isEmpty()) missing.add("dpd");
        if (balanceColumn(columns).isEmpty()) missing.add("outstanding_balance_usd");
        return missing;
    }

    private static Optional<String> balanceColumn(List<String> columns) {
        return ColumnFinder.findIgnoreCase(columns, "outstanding_balance_usd")
                .or(() -> ColumnFinder.findIgnoreCase(columns, "outstanding_balance"));
    }

    private static Optional<String> dpdColumn(List<String> columns) {
        return ColumnFinder.findIgnoreCase(columns, "dpd")
                .or(() -> ColumnFinder.findIgnoreCase(columns, "days_past_due"));
    }

    private static String column(List<String> columns, String name) {
        return ColumnFinder.findIgnoreCase(columns, name).orElseThrow();
    }

    /* ------------------------------------------------------------------ */
    /* PAR balances                                                         */
    /* ------------------------------------------------------------------ */

    private Dataset fromParBalances(Dataset source, Map<String, Double> cashByDate) {
        List<String> cols = source.columns();
        String dateCol = column(cols, "reporting_date");
        String balanceCol = balanceColumn(cols).orElseThrow();
        String par7 = column(cols, "par_7_balance_usd");
        String par30 = column(cols, "par_30_balance_usd");
        String par60 = column(cols, "par_60_balance_usd");
        String par90 = column(cols, "par_90_balance_usd");

        Map<String, double[]> byDate = new TreeMap<>();
        for (Map<String, Object> row : source.rows()) {
            Optional<LocalDate> date = IsoDates.parseLenient(row.get(dateCol));
            if (date.isEmpty()) continue;
            double total = amount(row.get(balanceCol));
            double p7 = amount(row.get(par7));
            double p30 = amount(row.get(par30));
            double p60 = amount(row.get(par60));
            double p90 = amount(row.get(par90));
            accumulate(byDate, date.get().toString(), total,
                    clip(total - p7), clip(p7 - p30), clip(p30 - p60), clip(p60 - p90), p90);
        }
        return snapshot(byDate, cashByDate);
    }

    /* ------------------------------------------------------------------ */
    /* Per-loan DPD                                                         */
    /* ------------------------------------------------------------------ */

    private Dataset fromLoanDpd(Dataset source, Map<String, Double> cashByDate,
                                String measurementDateColumn, String strategy) {
        List<String> cols = source.columns();
        String dpdCol = dpdColumn(cols).orElseThrow();
        String balanceCol = balanceColumn(cols).orElseThrow();

        Optional<String> perRowDate = Optional.ofNullable(measurementDateColumn)
                .filter(c -> !c.isBlank())
                .flatMap(c -> ColumnFinder.findIgnoreCase(cols, c));
        String fixedDate = perRowDate.isPresent() ? null : strategyDate(source, strategy);

        Map<String, double[]> byDate = new TreeMap<>();
        for (Map<String, Object> row : source.rows()) {
            String date;
            if (perRowDate.isPresent()) {
                Optional<LocalDate> parsed = IsoDates.parseLenient(row.get(perRowDate.get()));
                if (parsed.isEmpty()) continue;
                date = parsed.get().toString();
            } else {
                date = fixedDate;
            }
            double balance = amount(row.get(balanceCol));
            double dpd = amount(row.get(dpdCol));
            double[] buckets = new double[5];
            buckets[bucketIndex(dpd)] = balance;
            accumulate(byDate, date, balance, buckets[0], buckets[1], buckets[2], buckets[3], buckets[4]);
        }
        return snapshot(byDate, cashByDate);
    }

    /** 0 = [0,7), 1 = [7,30), 2 = [30,60), 3 = [60,90), 4 = 90+. */
    static int bucketIndex(double dpd) {
        if (dpd >= DPD_90) return 4;
        if (dpd >= DPD_60) return 3;
        if (dpd >= DPD_30) return 2;
        if (dpd >= DPD_7) return 1;
        return 0;
    }

    private String strategyDate(Dataset source, String strategy) {
        List<String> candidates;
        if ("max_disburse_date".equals(strategy)) {
            candidates = List.of("disburse_date", "disbursement_date");
        } else if ("max_maturity_date".equals(strategy)) {
            candidates = List.of("maturity_date", "loan_end_date");
        } else {
            candidates = List.of();
        }
        for (String candidate : candidates) {
            Optional<String> col = ColumnFinder.findIgnoreCase(source.columns(), candidate);
            if (col.isPresent()) {
                Optional<LocalDate> max = source.values(col.get()).stream()
                        .map(IsoDates::parseLenient)
                        .flatMap(Optional::stream)
                        .max(LocalDate::compareTo);
                if (max.isPresent()) return max.get().toString();
                break;
            }
        }
        return LocalDate.now(clock).toString();
    }

    /* ------------------------------------------------------------------ */
    /* Shared                                                               */
    /* ------------------------------------------------------------------ */

    private static void accumulate(Map<String, double[]> byDate, String date, double total,
                                   double d0, double d7, double d30, double d60, double d90) {
        double[] acc = byDate.computeIfAbsent(date, k -> new double[6]);
        acc[0] += total;
        acc[1] += d0;
        acc[2] += d7;
        acc[3] += d30;
        acc[4] += d60;
        acc[5] += d90;
    }

    private static Dataset snapshot(Map<String, double[]> byDate, Map<String, Double> cashByDate) {
        List<String> columns = List.of(LOAN_ID, MEASUREMENT_DATE, TOTAL_RECEIVABLE_USD, TOTAL_ELIGIBLE_USD,
                DISCOUNTED_BALANCE_USD, CASH_AVAILABLE_USD,
                DPD_0_7_USD, DPD_7_30_USD, DPD_30_60_USD, DPD_60_90_USD, DPD_90_PLUS_USD);
        Dataset.Builder out = Dataset.builder(columns);
        byDate.forEach((date, acc) -> {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(LOAN_ID, "looker_snapshot_" + date.replace("-", ""));
            row.put(MEASUREMENT_DATE, date);
            row.put(TOTAL_RECEIVABLE_USD, acc[0]);
            row.put(TOTAL_ELIGIBLE_USD, acc[0]);
            row.put(DISCOUNTED_BALANCE_USD, acc[0]);
            row.put(CASH_AVAILABLE_USD, cashByDate.getOrDefault(date, 0.0));
            row.put(DPD_0_7_USD, acc[1]);
            row.put(DPD_7_30_USD, acc[2]);
            row.put(DPD_30_60_USD, acc[3]);
            row.put(DPD_60_90_USD, acc[4]);
            row.put(DPD_90_PLUS_USD, acc[5]);
            out.addRow(row);
        });
        return out.build();
    }

    private static double amount(Object value) {
        Double d = Dataset.toDouble(value);
        return d == null || !Double.isFinite(d) ? 0.0 : d;
    }

    private static double clip(double value) {
        return Math.max(0.0, value);
    }
}
