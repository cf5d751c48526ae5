package com.cardiacreport.service.metrics;

import com.cardiacreport.model.enums.Sex;
import com.cardiacreport.model.metrics.FietstestMetrics;
import com.cardiacreport.model.metrics.Vo2Percentile;
import com.cardiacreport.model.patient.PatientContext;
import com.cardiacreport.model.study.FietstestMeasurements;
import com.cardiacreport.service.calculation.ExerciseCapacityService;
import com.cardiacreport.util.ReportFormat;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Derived values of a bicycle stress test. Summary lines follow a fixed order:
 * heart rate, observed VO2, wattage.
 */
@Service
public class FietstestMetricsService {

    private final ExerciseCapacityService exerciseCapacity;

    public FietstestMetricsService(ExerciseCapacityService exerciseCapacity) {
        this.exerciseCapacity = exerciseCapacity;
    }

    public FietstestMetrics compute(FietstestMeasurements m) {
        PatientContext patient = m.patient();
        Sex sex = patient != null ? patient.sex() : null;
        Double age = patient != null ? patient.age() : null;
        Double weight = patient != null ? patient.weight() : null;

        Long predictedMaxHr = exerciseCapacity.predictedMaxHeartRate(age);
        Double hrPercent = null;
        if (isPositive(predictedMaxHr) && m.maxHr() != null && m.maxHr() > 0) {
            hrPercent = ReportFormat.round(m.maxHr() / (double) predictedMaxHr * 100, 1);
        }

        Double vo2 = exerciseCapacity.estimateVo2(m.maxWatt(), weight);
        Vo2Percentile percentile = exerciseCapacity.vo2Percentile(sex, age, vo2);

        Double predictedWatt = exerciseCapacity.predictedWatt(sex, age, weight);
        Double wattPercent = null;
        if (predictedWatt != null && predictedWatt > 0 && m.maxWatt() != null && m.maxWatt() > 0) {
            wattPercent = ReportFormat.round(m.maxWatt() / predictedWatt * 100, 1);
        }

        List<String> lines = new ArrayList<>();
        if (isPositive(predictedMaxHr)) {
            if (hrPercent != null) {
                lines.add("Max HR: " + m.maxHr() + " bpm (" + ReportFormat.plain(hrPercent)
                    + "% of predicted " + predictedMaxHr + " bpm)");
            } else if (m.maxHr() != null) {
                lines.add("Max HR: " + m.maxHr() + " bpm (predicted " + predictedMaxHr + " bpm)");
            }
        }
        if (vo2 != null) {
            String observed = "Observed VO2: " + ReportFormat.plain(vo2) + " ml·kg⁻¹·min⁻¹";
            if (percentile != null) {
                observed += " — " + ReportFormat.plain(percentile.percentOfP50()) + "% vs 50e ("
                    + percentile.band() + ": " + percentile.bandText() + ")";
            }
            lines.add(observed);
        }
        if (predictedWatt != null) {
            if (wattPercent != null) {
                lines.add("Wattage: " + m.maxWatt() + " W (" + ReportFormat.plain(wattPercent)
                    + "% of predicted " + ReportFormat.plain(predictedWatt) + " W)");
            } else {
                lines.add("Predicted wattage: " + ReportFormat.plain(predictedWatt) + " W");
            }
        }

        return FietstestMetrics.builder()
            .predictedMaxHr(predictedMaxHr)
            .hrPercentOfPredicted(hrPercent)
            .vo2(vo2)
            .vo2Percentile(percentile)
            .predictedWatt(predictedWatt)
            .wattPercentOfPredicted(wattPercent)
            .summaryLines(lines)
            .build();
    }

    /**
     * Effort suggestion used by the input form: below 80% of the predicted maximal heart rate
     * the test counts as submaximal.
     */
    public String suggestEffortType(FietstestMeasurements m, FietstestMetrics metrics) {
        if (!isPositive(metrics.predictedMaxHr()) || m.maxHr() == null || m.maxHr() <= 0) return null;
        return m.maxHr() < 0.8 * metrics.predictedMaxHr() ? "Submaximale inspanning" : "Maximale inspanning";
    }

    private static boolean isPositive(Long value) {
        return value != null && value > 0;
    }
}
