package com.cardiacreport.model.study;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;

/**
 * Optional clinical findings consulted by the guideline engine once severe
 * mitral regurgitation or severe aortic stenosis has been detected.
 *
 * @param calciumScore     Agatston score
 * @param vmaxProgression  m/s per year
 * @param bnp              BNP or NT-proBNP, pg/mL
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecommendationFlags(
    Boolean mitralSymptoms,
    Boolean atrialFibrillation,
    Boolean aorticStenosisSymptoms,
    Boolean systolicPressureDrop,
    Double calciumScore,
    Double vmaxProgression,
    Double bnp
) {

    public static RecommendationFlags none() {
        return RecommendationFlags.builder().build();
    }

    public boolean hasMitralSymptoms() {
        return Boolean.TRUE.equals(mitralSymptoms);
    }

    public boolean hasAtrialFibrillation() {
        return Boolean.TRUE.equals(atrialFibrillation);
    }

    public boolean hasAorticStenosisSymptoms() {
        return Boolean.TRUE.equals(aorticStenosisSymptoms);
    }

    public boolean hasSystolicPressureDrop() {
        return Boolean.TRUE.equals(systolicPressureDrop);
    }
}
