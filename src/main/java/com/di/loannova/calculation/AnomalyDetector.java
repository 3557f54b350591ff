package com.di.loannova.calculation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Baseline diff against the metrics of the most recent prior run.
 */
public final class AnomalyDetector {

    private AnomalyDetector() {
    }

    /**
     * Flags every metric whose relative change {@code |current - previous| / |previous|} exceeds
     * {@code maxChangePct}. Metrics without a current value, or whose baseline is missing or zero,
     * are never flagged.
     */
    public static List<AnomalyFlag> detect(Map<String, MetricResult> metrics,
                                           Map<String, Double> baseline,
                                           double maxChangePct) {
        List<AnomalyFlag> flags = new ArrayList<>();
        if (baseline == null || baseline.isEmpty()) {
            return flags;
        }
        metrics.forEach((name, metric) -> {
            Double current = metric.value();
            Double previous = baseline.get(name);
            if (current == null || previous == null || previous == 0.0) {
                return;
            }
            double change = Math.abs(current - previous) / Math.abs(previous);
            if (change > maxChangePct) {
                flags.add(new AnomalyFlag(name, previous, current, round4(change)));
            }
        });
        return flags;
    }

    static double round4(double value) {
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }
}
