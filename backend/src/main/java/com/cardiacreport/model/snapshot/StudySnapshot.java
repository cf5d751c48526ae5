package com.cardiacreport.model.snapshot;

import com.cardiacreport.model.patient.PatientContext;
import com.cardiacreport.model.study.CiedMeasurements;
import com.cardiacreport.model.study.EcgMeasurements;
import com.cardiacreport.model.study.EchoMeasurements;
import com.cardiacreport.model.study.FietstestMeasurements;
import com.cardiacreport.model.study.HolterMeasurements;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serializable state of one stored study: patient, the measurements that were
 * entered and the generated report texts keyed by ReportTextKey.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StudySnapshot(
    PatientContext patient,
    EchoMeasurements echo,
    FietstestMeasurements fietstest,
    EcgMeasurements ecg,
    HolterMeasurements holter,
    CiedMeasurements cied,
    @JsonProperty("report_texts") Map<String, String> reportTexts
) {
    public StudySnapshot {
        reportTexts = reportTexts != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(reportTexts))
            : Map.of();
    }

    public String reportText(String key) {
        return reportTexts.get(key);
    }
}
