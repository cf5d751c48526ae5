package com.cardiacreport.model.patient;

import com.cardiacreport.model.enums.Sex;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;

/**
 * Patient information shared by every study.
 *
 * @param sex          required, all threshold tables are sex-specific
 * @param age          years
 * @param bsa          body surface area in m²
 * @param weight       kg
 * @param length       cm
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PatientContext(
    Sex sex,
    String patientId,
    String fullName,
    String dateOfBirth,
    Double age,
    Double bsa,
    Double weight,
    Double length
) {
}
