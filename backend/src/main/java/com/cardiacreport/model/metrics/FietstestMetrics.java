package com.cardiacreport.model.metrics;

import lombok.Builder;

import java.util.List;

/**
 * Derived bicycle test values: heart rate against predicted, VO2 and workload against predicted.
 */
@Builder(toBuilder = true)
public record FietstestMetrics(
    Long predictedMaxHr,
    Double hrPercentOfPredicted,
    Double vo2,
    Vo2Percentile vo2Percentile,
    Double predictedWatt,
    Double wattPercentOfPredicted,
    List<String> summaryLines
) {
}
