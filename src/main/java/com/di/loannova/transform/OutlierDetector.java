package com.di.loannova.transform;

import com.di.loannova.common.Dataset;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Flags numeric columns holding values whose |z-score| exceeds a threshold.
 * Uses the sample standard deviation; columns with fewer than two values or zero
 * variance are skipped. Values are only counted, never changed.
 */
public final class OutlierDetector {

    /** Outliers found in one column. */
    public record Flag(int outliers, double threshold, double mean, double std) {
    }

    private OutlierDetector() {
    }

    public static Map<String, Flag> detect(Dataset dataset, double threshold) {
        Map<String, Flag> result = new LinkedHashMap<>();
        for (String column : dataset.columns()) {
            if (!isNumericColumn(dataset, column)) continue;
            List<Double> values = dataset.values(column).stream()
                    .filter(Objects::nonNull)
                    .map(v -> ((Number) v).doubleValue())
                    .filter(Double::isFinite)
                    .toList();
            if (values.size() < 2) continue;

            double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            double variance = values.stream().mapToDouble(v -> (v - mean) * (v - mean)).sum() / (values.size() - 1);
            double std = Math.sqrt(variance);
            if (std == 0.0 || Double.isNaN(std)) continue;

            int count = 0;
            for (double v : values) {
                if (Math.abs((v - mean) / std) > threshold) count++;
            }
            if (count > 0) {
                result.put(column, new Flag(count, threshold, mean, std));
            }
        }
        return result;
    }

    /** Numeric means every non-null cell already holds a number. */
    static boolean isNumericColumn(Dataset dataset, String column) {
        boolean any = false;
        for (Object v : dataset.values(column)) {
            if (v == null) continue;
            if (!(v instanceof Number)) return false;
            any = true;
        }
        return any;
    }
}
