package com.di.loannova.calculation.kpi;

import com.di.loannova.calculation.KpiCatalog;
import com.di.loannova.calculation.KpiDefinition;
import com.di.loannova.calculation.KpiValue;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Composite 0-10 score derived from PAR30 and the collection rate rather than from the dataset.
 */
@Component
public class PortfolioHealthCalculator {

    public KpiDefinition definition() {
        return KpiCatalog.get(KpiCatalog.PORTFOLIO_HEALTH);
    }

    public KpiValue calculate(double par30, double collectionRate, Instant now) {
        double parComponent = Math.max(0.0, 10.0 - par30 / 10.0);
        double collComponent = collectionRate / 10.0;
        double score = Math.min(10.0, Math.max(0.0, parComponent * collComponent));
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("par_30_input", par30);
        extra.put("collection_rate_input", collectionRate);
        extra.put("par_component", parComponent);
        extra.put("coll_component", collComponent);
        return KpiValue.of(score, definition().formula(), 2, 0, now, extra);
    }
}
