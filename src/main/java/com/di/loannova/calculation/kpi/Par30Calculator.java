package com.di.loannova.calculation.kpi;

import com.di.loannova.calculation.KpiCatalog;
import com.di.loannova.calculation.KpiValue;
import com.di.loannova.common.Dataset;
import com.di.loannova.exception.CalculationException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Portfolio at risk beyond 30 days as a share of total receivables.
 *
 * <p>When the DPD bucket columns are absent the share of loans whose {@code loan_status}
 * is one of the delinquent statuses is used instead.
 */
@Component
public class Par30Calculator extends AbstractKpiCalculator {

    static final String[] REQUIRED = {"dpd_30_60_usd", "dpd_60_90_usd", "dpd_90_plus_usd", "total_receivable_usd"};
    static final Set<String> DELINQUENT_STATUSES =
            Set.of("30-59 days past due", "60-89 days past due", "90+ days past due");

    @Override
    public String name() {
        return KpiCatalog.PAR30;
    }

    @Override
    public KpiValue calculate(Dataset ds, Instant now) {
        if (ds.isEmpty()) {
            return empty(now);
        }
        if (missingColumns(ds, REQUIRED).isEmpty()) {
            return fromBuckets(ds, now);
        }
        if (ds.hasColumn("loan_status")) {
            return fromLoanStatus(ds, now);
        }
        throw new CalculationException("PAR30: missing required columns: "
                + String.join(", ", REQUIRED) + " or 'loan_status'");
    }

    private KpiValue fromBuckets(Dataset ds, Instant now) {
        long nulls = nullCount(ds, REQUIRED);
        double d30 = ds.sum("dpd_30_60_usd");
        double d60 = ds.sum("dpd_60_90_usd");
        double d90 = ds.sum("dpd_90_plus_usd");
        double total = ds.sum("total_receivable_usd");
        if (total == 0.0) {
            return value(0.0, ds, nulls, now, Map.of("reason", "Zero total receivable"));
        }
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("dpd_30_60_sum", d30);
        extra.put("dpd_60_90_sum", d60);
        extra.put("dpd_90_plus_sum", d90);
        extra.put("total_receivable_sum", total);
        return value(boundedPercent((d30 + d60 + d90) / total * 100.0, extra), ds, nulls, now, extra);
    }

    private KpiValue fromLoanStatus(Dataset ds, Instant now) {
        long delinquent = ds.values("loan_status").stream()
                .filter(v -> v != null && DELINQUENT_STATUSES.contains(v.toString().trim()))
                .count();
        double pct = delinquent * 100.0 / ds.size();
        return value(pct, ds, ds.nullCount("loan_status"), now,
                Map.of("delinquent_count", delinquent, "method", "loan_status_fallback"));
    }
}
