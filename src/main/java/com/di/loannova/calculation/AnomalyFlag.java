package com.di.loannova.calculation;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A KPI whose value moved further from the previous run than the configured tolerance.
 *
 * @param changePct relative change as a fraction, rounded to four places
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AnomalyFlag(String metric, double previous, double current, double changePct) {
}
