package com.cardiacreport.model.metrics;

import lombok.Builder;

import java.util.List;

@Builder(toBuilder = true)
public record EcgMetrics(
    Double qtcBazett,
    Double qtcFridericia,
    boolean tachycardia,
    boolean bradycardia,
    String axisDeviation,
    List<String> summaryLines
) {
}
