package com.di.loannova.calculation;

import com.di.loannova.calculation.KpiDefinition.Direction;
import com.di.loannova.config.PipelineProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static catalogue of every KPI the pipeline knows, in evaluation order.
 *
 * <p>Thresholds here are the defaults; {@code loannova.pipeline.calculation.thresholds}
 * overrides them per KPI.
 */
public final class KpiCatalog {

    public static final String PAR30            = "PAR30";
    public static final String PAR90            = "PAR90";
    public static final String COLLECTION_RATE  = "CollectionRate";
    public static final String LTV              = "LTV";
    public static final String DTI              = "DTI";
    public static final String PORTFOLIO_YIELD  = "PortfolioYield";
    public static final String EFFECTIVE_YIELD  = "EffectiveYield";
    public static final String PORTFOLIO_HEALTH = "PortfolioHealth";

    private static final Map<String, KpiDefinition> DEFINITIONS = new LinkedHashMap<>();

    static {
        register(new KpiDefinition(PAR30, "PAR 30",
                "Percentage of portfolio delinquent 30+ days",
                "SUM(dpd_30_60 + dpd_60_90 + dpd_90+) / SUM(total_receivable) * 100",
                "%", "CRO", 5.0, 8.0, Direction.HIGHER_IS_WORSE, false));
        register(new KpiDefinition(PAR90, "PAR 90",
                "Percentage of portfolio delinquent beyond 90 days",
                "SUM(dpd_90_plus_usd) / SUM(total_receivable_usd) * 100",
                "%", "CRO", null, null, Direction.HIGHER_IS_WORSE, false));
        register(new KpiDefinition(COLLECTION_RATE, "Collection Rate",
                "Collections as percentage of receivables outstanding",
                "SUM(cash_available) / SUM(total_eligible) * 100",
                "%", "CFO", 1.5, 1.0, Direction.LOWER_IS_WORSE, false));
        register(new KpiDefinition(LTV, "Loan to Value",
                "Average ratio of loan amount to appraised value",
                "AVG(loan_amount / appraised_value) * 100",
                "%", "Risk", 80.0, 90.0, Direction.HIGHER_IS_WORSE, false));
        register(new KpiDefinition(DTI, "Debt to Income",
                "Average ratio of monthly debt to monthly income",
                "AVG(monthly_debt / (borrower_income / 12)) * 100",
                "%", "Underwriting", 36.0, 43.0, Direction.HIGHER_IS_WORSE, false));
        register(new KpiDefinition(PORTFOLIO_YIELD, "Portfolio Yield",
                "Weighted average interest rate across the portfolio",
                "SUM(interest_rate * principal_balance) / SUM(principal_balance) * 100",
                "%", "Finance", 8.0, 6.0, Direction.LOWER_IS_WORSE, false));
        register(new KpiDefinition(EFFECTIVE_YIELD, "Effective Yield",
                "Annualized internal rate of return over dated disbursements and payments",
                "XIRR(-disbursement_amount @ disbursement_date, payment_amount @ payment_date) * 100",
                "%", "Finance", null, null, Direction.LOWER_IS_WORSE, false));
        register(new KpiDefinition(PORTFOLIO_HEALTH, "Portfolio Health",
                "Composite score (0-10) reflecting portfolio quality",
                "(10 - PAR30/10) * (CollectionRate/10)",
                "score", "CRO", 5.0, 3.0, Direction.LOWER_IS_WORSE, true));
    }

    private KpiCatalog() {
    }

    private static void register(KpiDefinition definition) {
        DEFINITIONS.put(definition.name(), definition);
    }

    public static List<String> names() {
        return List.copyOf(DEFINITIONS.keySet());
    }

    /** Position in evaluation order; unknown names sort last. */
    public static int order(String name) {
        int i = names().indexOf(name);
        return i < 0 ? Integer.MAX_VALUE : i;
    }

    public static Optional<KpiDefinition> find(String name) {
        return Optional.ofNullable(DEFINITIONS.get(name));
    }

    public static KpiDefinition get(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown KPI: " + name));
    }

    /** Definition with configured threshold overrides applied; a null override keeps the default. */
    public static KpiDefinition resolve(String name, Map<String, PipelineProperties.Threshold> overrides) {
        KpiDefinition def = get(name);
        PipelineProperties.Threshold t = overrides == null ? null : overrides.get(name);
        if (t == null) {
            return def;
        }
        return def.withThresholds(
                t.getWarning() != null ? t.getWarning() : def.warning(),
                t.getCritical() != null ? t.getCritical() : def.critical());
    }

    public static KpiStatus status(KpiDefinition def, Double value) {
        if (value == null || value.isNaN()) {
            return KpiStatus.UNKNOWN;
        }
        if (def.direction() == Direction.HIGHER_IS_WORSE) {
            if (def.critical() != null && value >= def.critical()) return KpiStatus.CRITICAL;
            if (def.warning() != null && value >= def.warning()) return KpiStatus.WARNING;
        } else {
            if (def.critical() != null && value <= def.critical()) return KpiStatus.CRITICAL;
            if (def.warning() != null && value <= def.warning()) return KpiStatus.WARNING;
        }
        return KpiStatus.OK;
    }
}
