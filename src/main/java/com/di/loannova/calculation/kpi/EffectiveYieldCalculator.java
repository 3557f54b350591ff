package com.di.loannova.calculation.kpi;

import com.di.loannova.calculation.KpiCatalog;
import com.di.loannova.calculation.KpiValue;
import com.di.loannova.common.Dataset;
import com.di.loannova.common.IsoDates;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Annualized effective yield: XIRR over disbursements (outflows) and payments (inflows), in percent.
 * Rows with an unparseable date or a zero amount contribute no flow.
 */
@Component
public class EffectiveYieldCalculator extends AbstractKpiCalculator {

    static final String[] REQUIRED = {"disbursement_date", "disbursement_amount", "payment_date", "payment_amount"};

    @Override
    public String name() {
        return KpiCatalog.EFFECTIVE_YIELD;
    }

    @Override
    public KpiValue calculate(Dataset ds, Instant now) {
        if (ds.isEmpty()) {
            return empty(now);
        }
        requireColumns(ds, REQUIRED);
        List<Xirr.CashFlow> flows = new ArrayList<>();
        for (Map<String, Object> row : ds.rows()) {
            addFlow(flows, row.get("disbursement_date"), -num(row, "disbursement_amount"));
            addFlow(flows, row.get("payment_date"), num(row, "payment_amount"));
        }
        if (Xirr.signDegenerate(flows)) {
            return value(0.0, ds, nullCount(ds, REQUIRED), now,
                    Map.of("cash_flows", flows.size(), "reason", "Cash flows do not change sign"));
        }
        double rate = Xirr.solve(flows);
        return value(rate * 100.0, ds, nullCount(ds, REQUIRED), now,
                Map.of("cash_flows", flows.size(), "annual_rate", rate));
    }

    private static void addFlow(List<Xirr.CashFlow> flows, Object date, double amount) {
        if (amount == 0.0) {
            return;
        }
        IsoDates.parseLenient(date).ifPresent(d -> flows.add(new Xirr.CashFlow(d, amount)));
    }
}
