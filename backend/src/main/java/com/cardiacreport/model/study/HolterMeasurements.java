package com.cardiacreport.model.study;

import com.cardiacreport.model.patient.PatientContext;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;

/**
 * Holter monitoring input.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record HolterMeasurements(
    PatientContext patient,
    String recordingDate,
    Integer recordingDurationHours,
    Integer avgHr,
    Integer minHr,
    Integer maxHr,
    Double afibPercentage,
    Integer pausesCount,
    Integer longestPauseMs,
    Integer vesCount,
    Integer svesCount,
    String avBlockType,
    String otherFindings
) {
}
