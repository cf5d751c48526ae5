package com.cardiacreport.model.metrics;

import lombok.Builder;

import java.util.List;

/**
 * Suggested pacing parameters. All timings in ms, rates in bpm.
 */
@Builder(toBuilder = true)
public record CiedMetrics(
    Long predictedMaxHr,
    Long myPaceLowerRate,
    Long upperTrackingSuggestion,
    Long avDelayReduction,
    Long rateAdaptiveSensedAv,
    Long rateAdaptivePacedAv,
    Long optimalPvarp,
    Long recommendedSensedAv,
    List<String> summaryLines
) {
}
