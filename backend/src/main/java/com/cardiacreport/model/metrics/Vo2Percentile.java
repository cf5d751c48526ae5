package com.cardiacreport.model.metrics;

/**
 * Observed VO2 placed against the reference distribution for sex and age bucket.
 *
 * @param ageBucket     decade used for the lookup (20 to 70)
 * @param p50           median VO2 of the bucket, ml/kg/min
 * @param percentOfP50  observed VO2 as percentage of the median
 * @param band          e.g. "25-75%"
 * @param bandText      e.g. "Normale inspanningscapaciteit"
 */
public record Vo2Percentile(
    int ageBucket,
    double p50,
    double percentOfP50,
    String band,
    String bandText
) {
}
