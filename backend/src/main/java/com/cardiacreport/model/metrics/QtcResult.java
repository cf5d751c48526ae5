package com.cardiacreport.model.metrics;

/**
 * Corrected QT intervals in ms. Either value may be null.
 */
public record QtcResult(Double bazett, Double fridericia) {

    public static QtcResult none() {
        return new QtcResult(null, null);
    }
}
