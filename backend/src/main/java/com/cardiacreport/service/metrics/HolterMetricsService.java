package com.cardiacreport.service.metrics;

import com.cardiacreport.model.metrics.HolterMetrics;
import com.cardiacreport.model.study.HolterMeasurements;
import com.cardiacreport.util.ReportFormat;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Holter rhythm flags:
 *   bradycardia  minimum below 40 bpm
 *   tachycardia  maximum above 120 bpm
 *   pauses       significant when the longest exceeds 2000 ms
 *   ectopy       frequent above 1000 beats
 */
@Service
public class HolterMetricsService {

    static final int BRADY_LIMIT = 40;
    static final int TACHY_LIMIT = 120;
    static final int PAUSE_LIMIT_MS = 2000;
    static final int FREQUENT_ECTOPY = 1000;

    public HolterMetrics compute(HolterMeasurements m) {
        List<String> lines = new ArrayList<>();
        boolean brady = false;
        boolean tachy = false;
        boolean afib = false;
        boolean pauses = false;
        boolean frequentVes = false;
        boolean frequentSves = false;
        boolean avBlock = false;

        if (isPositive(m.recordingDurationHours())) {
            lines.add("Registratieduur: " + m.recordingDurationHours() + " uur");
        }
        if (m.avgHr() != null) {
            lines.add("Gemiddelde hartfrequentie: " + m.avgHr() + " bpm");
        }
        if (m.minHr() != null) {
            brady = m.minHr() < BRADY_LIMIT;
            lines.add("Minimale hartfrequentie: " + m.minHr() + " bpm" + (brady ? " (bradycardie)" : ""));
        }
        if (m.maxHr() != null) {
            tachy = m.maxHr() > TACHY_LIMIT;
            lines.add("Maximale hartfrequentie: " + m.maxHr() + " bpm" + (tachy ? " (tachycardie)" : ""));
        }
        if (m.afibPercentage() != null && m.afibPercentage() > 0) {
            afib = true;
            lines.add("Atriumfibrilleren: " + ReportFormat.plain(m.afibPercentage()) + "% van de tijd");
        }
        if (isPositive(m.pausesCount())) {
            pauses = m.longestPauseMs() != null && m.longestPauseMs() > PAUSE_LIMIT_MS;
            String line = "Pauzes: " + m.pausesCount();
            if (isPositive(m.longestPauseMs())) line += " (langste: " + m.longestPauseMs() + " ms)";
            if (pauses) line += " - significant";
            lines.add(line);
        }
        if (m.vesCount() != null) {
            frequentVes = m.vesCount() > FREQUENT_ECTOPY;
            lines.add("VES: " + m.vesCount() + (frequentVes ? " (frequent)" : ""));
        }
        if (m.svesCount() != null) {
            frequentSves = m.svesCount() > FREQUENT_ECTOPY;
            lines.add("SVES: " + m.svesCount() + (frequentSves ? " (frequent)" : ""));
        }
        if (ReportFormat.hasText(m.avBlockType())) {
            avBlock = true;
            lines.add("AV-blok: " + m.avBlockType());
        }

        return HolterMetrics.builder()
            .bradycardia(brady)
            .tachycardia(tachy)
            .atrialFibrillation(afib)
            .significantPauses(pauses)
            .frequentVes(frequentVes)
            .frequentSves(frequentSves)
            .avBlock(avBlock)
            .summaryLines(lines)
            .build();
    }

    private static boolean isPositive(Integer value) {
        return value != null && value > 0;
    }
}
