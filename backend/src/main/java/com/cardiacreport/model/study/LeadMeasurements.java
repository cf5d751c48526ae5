package com.cardiacreport.model.study;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;

/**
 * Per-lead values read out during a device follow-up. Kept as entered, they are only displayed.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record LeadMeasurements(
    String sensing,
    String impedance,
    String thresholdV,
    String thresholdMs,
    String polarity,
    Boolean stable,
    String location
) {

    public boolean hasReadings() {
        return hasText(sensing) || hasText(thresholdV) || hasText(thresholdMs) || hasText(impedance);
    }

    /** Unknown stability counts as stable. */
    public boolean markedUnstable() {
        return Boolean.FALSE.equals(stable);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
