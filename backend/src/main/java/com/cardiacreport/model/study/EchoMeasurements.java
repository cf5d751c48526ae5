package com.cardiacreport.model.study;

import com.cardiacreport.model.patient.PatientContext;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;

/**
 * Transthoracic echo input: raw measurements plus the clinician's label choices.
 *
 * <p>Dimensions are in mm, volumes in mL, areas in cm², velocities in m/s and
 * gradients in mmHg. A label choice left null is replaced by the automatic
 * classification when the report is composed.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record EchoMeasurements(
    PatientContext patient,

    // Left ventricle
    Double ivsd,
    Double lvpw,
    Double lvidd,
    Double lvids,
    Double lvef,
    Double ea,
    Double ee,

    // Atria
    Double laVolume,
    Double raVolume,

    // Right ventricle
    Double tapse,
    Double rvfwd,
    Double rvbd,
    Double rvmd,
    Double paspRaw,

    // Aorta
    Double aoa,
    Double aosv,
    Double aostj,
    Double ascao,

    // Aortic valve
    Double akVmax,
    Double akMean,
    Double ava,
    Double sv,

    // Mitral valve
    Double mkEroa,
    Double mkRegvol,
    Double mkRf,

    // Tricuspid valve
    Double tkEroa,
    Double tkRegvol,
    Double tkRf,
    Double tkVcw,

    // Pulmonary valve
    Double pkEroa,
    Double pkRegvol,
    Double pkRf,
    Double pkDtRegjet,
    Double pkPhtRegjet,
    Double pkPrIndex,

    // Label choices
    String lvHypertrofieChoice,
    String lvDilatatieChoice,
    String systolicOption,
    String lvDiastolischeFunctie,
    String laChoice,
    String rvHypertrofie,
    String rvDilatatie,
    String rvFunctie,
    String raDilatatie,
    String akMorfologie,
    String akCalcificatie,
    String akStenose,
    String akRegurgitatie,
    String mkRegurgitatie,
    String tkRegurgitatie,
    String pkRegurgitatie,
    String ivcDilatatie,
    String ivcVariatie,
    String cvd,

    RecommendationFlags recommendationFlags
) {

    public RecommendationFlags flagsOrNone() {
        return recommendationFlags != null ? recommendationFlags : RecommendationFlags.none();
    }
}
