package com.di.loannova.orchestrator;

import com.di.loannova.calculation.MetricResult;
import com.di.loannova.config.PipelineProperties;
import com.di.loannova.contract.Violation;
import com.di.loannova.exception.ContractViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns data-quality breaches, KPI threshold crossings and critical contract violations into
 * messages on the configured channels.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertDispatcher {

    private final NotificationSink sink;
    private final PipelineProperties properties;

    /**
     * Data-quality breach, checked as soon as ingestion has scored the dataset and before the
     * quality gate.
     *
     * @return the alert line that was sent, empty when the score meets the minimum
     */
    public Optional<String> dataQuality(String runId, double dataQualityScore) {
        double threshold = properties.getValidation().getMinDataQualityScore();
        if (dataQualityScore >= threshold) {
            return Optional.empty();
        }
        String alert = String.format("Data Quality Alert: score is %s%% (threshold: %s%%)", dataQualityScore, threshold);
        send("Pipeline Alert - Run " + runId + "\n" + alert, properties.getAlerts().getKpiChannel());
        return Optional.of(alert);
    }

    /**
     * One combined message on the KPI channel for every KPI in warning or critical state, or
     * nothing when all are fine.
     *
     * @return the alert lines that were sent
     */
    public List<String> kpiAlerts(String runId, Map<String, MetricResult> metrics) {
        List<String> alerts = new ArrayList<>();
        if (metrics != null) {
            for (MetricResult m : metrics.values()) {
                switch (m.status()) {
                    case CRITICAL -> alerts.add(String.format("Critical KPI Alert: %s is %s (status: CRITICAL)",
                            m.displayName(), m.value()));
                    case WARNING -> alerts.add(String.format("KPI Warning: %s is %s (status: WARNING)",
                            m.displayName(), m.value()));
                    default -> { }
                }
            }
        }
        if (!alerts.isEmpty()) {
            send("Pipeline Alert - Run " + runId + "\n" + String.join("\n", alerts),
                    properties.getAlerts().getKpiChannel());
        }
        return alerts;
    }

    public void contractViolation(String runId, ContractViolationException e) {
        List<String> critical = e.getViolations().stream()
                .filter(Violation::critical)
                .map(Violation::toString)
                .toList();
        send("Critical contract violation in run " + runId + ": " + (critical.isEmpty() ? e.getMessage() : critical),
                properties.getAlerts().getContractChannel());
    }

    private void send(String message, String channel) {
        try {
            sink.notify(message, channel);
        } catch (RuntimeException ex) {
            log.warn("[ORCHESTRATOR] alert delivery to '{}' failed: {}", channel, ex.getMessage());
        }
    }
}
