package com.cardiacreport.model.study;

import com.cardiacreport.model.patient.PatientContext;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;

/**
 * Bicycle stress test input.
 *
 * @param durationAtMax seconds at the maximal workload
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record FietstestMeasurements(
    PatientContext patient,
    Integer startWatt,
    Integer incrementWatt,
    Integer maxWatt,
    Integer durationAtMax,
    Integer maxHr,
    String bpEvolutie,
    String ritme,
    String effortType,
    String stopCriterium,
    String ecgChanges,
    String conclusion
) {
}
