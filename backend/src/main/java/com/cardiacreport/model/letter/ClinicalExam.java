package com.cardiacreport.model.letter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;

/**
 * Clinical examination findings for the consultation letter.
 *
 * @param pulse      beats per minute
 * @param systolic   mmHg, printed only together with diastolic
 * @param diastolic  mmHg
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClinicalExam(
    Double pulse,
    Double systolic,
    Double diastolic,
    String auscultation
) {
    public static ClinicalExam empty() {
        return ClinicalExam.builder().build();
    }
}
