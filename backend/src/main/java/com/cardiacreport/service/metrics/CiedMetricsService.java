package com.cardiacreport.service.metrics;

import com.cardiacreport.model.metrics.CiedMetrics;
import com.cardiacreport.model.patient.PatientContext;
import com.cardiacreport.model.study.CiedMeasurements;
import com.cardiacreport.service.calculation.ExerciseCapacityService;
import com.cardiacreport.service.calculation.PacingParameterService;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Programming suggestions for a device follow-up.
 */
@Service
public class CiedMetricsService {

    private final ExerciseCapacityService exerciseCapacity;
    private final PacingParameterService pacing;

    public CiedMetricsService(ExerciseCapacityService exerciseCapacity, PacingParameterService pacing) {
        this.exerciseCapacity = exerciseCapacity;
        this.pacing = pacing;
    }

    public CiedMetrics compute(CiedMeasurements m) {
        PatientContext patient = m.patient();
        Double age = patient != null ? patient.age() : null;
        Double length = patient != null ? patient.length() : null;

        Long predictedMaxHr = exerciseCapacity.predictedMaxHeartRate(age);
        Long myPace = pacing.myPaceLowerRate(length, m.lvef());
        Long upperSuggestion = pacing.upperTrackingSuggestion(predictedMaxHr);
        Long reduction = pacing.avDelayReduction(m.lowerRate(), m.upperTracking());
        Long sensedAv = pacing.rateAdaptiveAvDelay(m.sensedAvDelay(), reduction);
        Long pacedAv = pacing.rateAdaptiveAvDelay(m.pacedAvDelay(), reduction);
        Long pvarp = pacing.optimalPvarp(m.upperTracking(), m.sensedAvDelay());
        Long recommendedSensed = pacing.recommendedSensedAvDelay(m.pacedAvDelay());

        List<String> lines = new ArrayList<>();
        if (myPace != null) {
            lines.add("myPACE (if HFpEF) suggested lower rate: " + myPace + " bpm");
        }
        if (upperSuggestion != null) {
            lines.add("Suggested upper tracking rate: " + upperSuggestion
                + " bpm (≈85% of predicted max HR " + predictedMaxHr + " bpm)");
        }
        if (reduction != null) {
            lines.add("Optimal AV delay reduction: " + reduction + " ms (≈5 ms per 10 bpm).");
        }
        if (sensedAv != null) {
            lines.add("Rate-adaptive sensed AV delay at peak UTR: " + sensedAv + " ms");
        }
        if (pacedAv != null) {
            lines.add("Rate-adaptive paced AV delay at peak UTR: " + pacedAv + " ms");
        }
        if (pvarp != null) {
            lines.add("Optimal PVARP: " + pvarp + " ms (60000 / UTR - sensed AV delay - 20 ms)");
        }
        if (recommendedSensed != null && !recommendedSensed.equals(toLong(m.sensedAvDelay()))) {
            lines.add("Recommended sensed AV delay based on paced AV delay: " + recommendedSensed + " ms (paced - 30).");
        }

        return CiedMetrics.builder()
            .predictedMaxHr(predictedMaxHr)
            .myPaceLowerRate(myPace)
            .upperTrackingSuggestion(upperSuggestion)
            .avDelayReduction(reduction)
            .rateAdaptiveSensedAv(sensedAv)
            .rateAdaptivePacedAv(pacedAv)
            .optimalPvarp(pvarp)
            .recommendedSensedAv(recommendedSensed)
            .summaryLines(lines)
            .build();
    }

    private static Long toLong(Integer value) {
        return value != null ? value.longValue() : null;
    }
}
