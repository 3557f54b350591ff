package com.di.loannova.calculation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AnomalyDetector Tests")
class AnomalyDetectorTest {

    private static final Instant NOW = Instant.parse("2024-07-01T00:00:00Z");

    private static MetricResult metric(String name, double value) {
        return MetricResult.success(KpiCatalog.get(name), KpiValue.of(value, "f", 1, 0, NOW, Map.of()));
    }

    private static Map<String, MetricResult> current() {
        Map<String, MetricResult> metrics = new LinkedHashMap<>();
        metrics.put(KpiCatalog.PAR30, metric(KpiCatalog.PAR30, 6.0));
        metrics.put(KpiCatalog.LTV, metric(KpiCatalog.LTV, 70.0));
        metrics.put(KpiCatalog.DTI, MetricResult.failure(KpiCatalog.get(KpiCatalog.DTI), "missing columns"));
        metrics.put(KpiCatalog.PORTFOLIO_YIELD, metric(KpiCatalog.PORTFOLIO_YIELD, 10.0));
        return metrics;
    }

    @Test
    @DisplayName("Should flag metrics whose relative change exceeds the tolerance")
    void testDetect_Flags() {
        Map<String, Double> baseline = Map.of(
                KpiCatalog.PAR30, 4.0,
                KpiCatalog.LTV, 65.0,
                KpiCatalog.DTI, 30.0,
                KpiCatalog.PORTFOLIO_YIELD, 0.0);

        List<AnomalyFlag> flags = AnomalyDetector.detect(current(), baseline, 0.2);

        assertEquals(1, flags.size());
        AnomalyFlag flag = flags.get(0);
        assertEquals(KpiCatalog.PAR30, flag.metric());
        assertEquals(4.0, flag.previous());
        assertEquals(6.0, flag.current());
        assertEquals(0.5, flag.changePct());
    }

    @Test
    @DisplayName("Should flag nothing without a baseline")
    void testDetect_NoBaseline() {
        assertTrue(AnomalyDetector.detect(current(), Map.of(), 0.2).isEmpty());
        assertTrue(AnomalyDetector.detect(current(), null, 0.2).isEmpty());
    }

    @Test
    @DisplayName("Should round the change to four places")
    void testRound4() {
        assertEquals(0.3333, AnomalyDetector.round4(1.0 / 3.0));
        assertEquals(0.6667, AnomalyDetector.round4(2.0 / 3.0));
    }
}
