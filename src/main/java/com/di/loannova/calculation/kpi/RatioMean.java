package com.di.loannova.calculation.kpi;

import com.di.loannova.common.Dataset;

import java.util.Map;

/**
 * Row-wise {@code numerator / (denominator * scale) * 100}, averaged over rows whose scaled
 * denominator is positive. Zero qualifying rows yield 0.
 */
record RatioMean(double value, double avgNumerator, double avgDenominator, int count) {

    static RatioMean over(Dataset ds, String numerator, String denominator, double scale) {
        double ratioSum = 0.0;
        double numSum = 0.0;
        double denSum = 0.0;
        int count = 0;
        for (Map<String, Object> row : ds.rows()) {
            double n = AbstractKpiCalculator.num(row, numerator);
            double d = AbstractKpiCalculator.num(row, denominator) * scale;
            numSum += n;
            denSum += d;
            if (d > 0) {
                ratioSum += n / d * 100.0;
                count++;
            }
        }
        int rows = Math.max(ds.size(), 1);
        return new RatioMean(count == 0 ? 0.0 : ratioSum / count, numSum / rows, denSum / rows, count);
    }
}
