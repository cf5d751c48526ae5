package com.cardiacreport.model.study;

import com.cardiacreport.model.patient.PatientContext;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;

/**
 * Resting ECG input, entered manually or taken from the device printout.
 * Intervals in ms, axes in degrees.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record EcgMeasurements(
    PatientContext patient,
    String recordedAt,
    Double ventRate,
    Double prIntervalMs,
    Double pDurationMs,
    Double qrsDurationMs,
    Double qtIntervalMs,
    Double qtcIntervalMs,
    Double pAxisDeg,
    Double qrsAxisDeg,
    Double tAxisDeg,
    String rhythmSummary,
    String autoReportText,
    String acquisitionDevice
) {
}
