package com.cardiacreport.model.metrics;

import com.cardiacreport.model.enums.StenosisGrade;
import lombok.Builder;

import java.util.List;

/**
 * Everything derived from an echo study before composition.
 * Labels ending in "Auto" or "Suggested" are defaults the clinician's choices override.
 */
@Builder(toBuilder = true)
public record EchoMetrics(
    Double bsa,

    // Left ventricle
    Double lvMass,
    Double massIndex,
    String massSeverity,
    Double rwt,
    String lvHypertrophyAuto,
    Double lviddIndexed,
    String lvDilatationAuto,
    Double lvidsIndexed,
    Double lvesdi,
    Integer lvidsGrade,
    String lvidsLabel,
    Double teichholzEf,
    String lvefClass,
    String systolicAuto,
    String diastolicSuggestion,

    // Atria
    Double lavi,
    String laSuggested,
    Double ravi,
    String raDilatationAuto,

    // Right ventricle
    String rvHypertrophyAuto,
    String rvDilatationAuto,
    String rvFunctionAuto,
    String paspText,

    // Aorta and valves
    List<AorticSegmentAssessment> aorticSegments,
    AorticStenosisAssessment stenosis,
    int mitralScore,
    String mitralSuggested,
    int tricuspidScore,
    String tricuspidSuggested,
    int pulmonaryScore,
    String pulmonarySuggested,

    List<String> summaryLines
) {

    public StenosisGrade stenosisGrade() {
        return stenosis != null ? stenosis.grade() : StenosisGrade.NONE;
    }
}
