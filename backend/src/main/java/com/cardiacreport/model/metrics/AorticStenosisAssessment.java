package com.cardiacreport.model.metrics;

import com.cardiacreport.model.enums.StenosisGrade;

/**
 * Aortic stenosis grade with the indexed values it was derived from.
 */
public record AorticStenosisAssessment(
    StenosisGrade grade,
    Double avaIndexed,
    Double strokeVolumeIndexed,
    boolean lowFlowLowGradient
) {
}
