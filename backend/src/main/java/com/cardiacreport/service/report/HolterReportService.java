package com.cardiacreport.service.report;

import com.cardiacreport.model.metrics.HolterMetrics;
import com.cardiacreport.model.study.HolterMeasurements;
import com.cardiacreport.util.ReportFormat;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

import static com.cardiacreport.util.ReportFormat.plain;

/**
 * Holter monitoring report: heart rate, rhythm findings and a bulleted conclusion.
 */
@Service
public class HolterReportService {

    static final String NO_FINDINGS = "Geen significante ritmestoornissen waargenomen.";
    static final String NO_ABNORMALITIES = "- Geen afwijkingen geregistreerd tijdens Holter-monitoring";
    static final String BRIEF_FALLBACK = "Holter-monitoring uitgevoerd";

    public String composeFullReport(HolterMeasurements m, HolterMetrics metrics) {
        List<String> lines = new ArrayList<>();
        lines.add(ReportFormat.hasText(m.recordingDate())
            ? "Holter-monitoring geregistreerd op " + m.recordingDate() + "."
            : "Holter-monitoring registratie.");
        if (isPositive(m.recordingDurationHours())) {
            lines.add("Registratieduur: " + m.recordingDurationHours() + " uur.");
        }

        List<String> rates = new ArrayList<>();
        if (m.avgHr() != null) rates.add("gemiddelde hartfrequentie " + m.avgHr() + " bpm");
        if (m.minHr() != null) rates.add("minimum " + m.minHr() + " bpm");
        if (m.maxHr() != null) rates.add("maximum " + m.maxHr() + " bpm");
        if (!rates.isEmpty()) lines.add("Hartfrequentie: " + String.join(", ", rates) + ".");

        if (metrics.bradycardia()) lines.add("Er werd bradycardie vastgesteld.");
        if (metrics.tachycardia()) lines.add("Er werden episoden van tachycardie waargenomen.");

        List<String> findings = rhythmFindings(m, metrics);
        lines.addAll(findings.isEmpty() ? List.of(NO_FINDINGS) : findings);

        if (ReportFormat.hasText(m.otherFindings())) {
            lines.add("Overige bevindingen: " + m.otherFindings().trim() + ".");
        }

        lines.add("\nConclusie:");
        lines.addAll(conclusions(m, metrics));
        return String.join("\n", lines);
    }

    public String composeBrief(HolterMeasurements m, HolterMetrics metrics) {
        List<String> parts = new ArrayList<>();
        if (isPositive(m.recordingDurationHours())) parts.add("Holter-monitoring (" + m.recordingDurationHours() + "u)");
        if (isPositive(m.avgHr())) parts.add("Gem. HR: " + m.avgHr() + " bpm");
        if (metrics.atrialFibrillation()) parts.add("AFIB: " + plain(m.afibPercentage()) + "%");
        if (metrics.significantPauses()) parts.add("Significante pauzes");
        if (metrics.frequentVes()) parts.add("Frequente VES (" + m.vesCount() + ")");
        if (metrics.frequentSves()) parts.add("Frequente SVES (" + m.svesCount() + ")");
        return parts.isEmpty() ? BRIEF_FALLBACK : String.join("; ", parts);
    }

    private List<String> rhythmFindings(HolterMeasurements m, HolterMetrics metrics) {
        List<String> findings = new ArrayList<>();

        Double afib = m.afibPercentage();
        if (metrics.atrialFibrillation() && afib != null) {
            String share = " (" + plain(afib) + "% van de tijd).";
            if (afib >= 50) {
                findings.add("Er werd permanent atriumfibrilleren vastgesteld" + share);
            } else if (afib >= 10) {
                findings.add("Er werden frequente episoden van atriumfibrilleren waargenomen" + share);
            } else {
                findings.add("Er werden incidentele episoden van atriumfibrilleren waargenomen" + share);
            }
        }

        if (isPositive(m.pausesCount())) {
            String pauses = m.pausesCount() + " pauze(s)";
            if (isPositive(m.longestPauseMs())) pauses += " met een maximale duur van " + m.longestPauseMs() + " ms";
            findings.add(metrics.significantPauses()
                ? "Er werden significante pauzes geregistreerd: " + pauses + "."
                : "Er werden " + pauses + " geregistreerd.");
        }

        List<String> ectopy = new ArrayList<>();
        if (isPositive(m.vesCount())) {
            ectopy.add((metrics.frequentVes() ? "frequente " : "") + "ventriculaire extrasystolen (VES: " + m.vesCount() + ")");
        }
        if (isPositive(m.svesCount())) {
            ectopy.add((metrics.frequentSves() ? "frequente " : "") + "supraventriculaire extrasystolen (SVES: "
                + m.svesCount() + ")");
        }
        if (!ectopy.isEmpty()) findings.add("Er werden " + String.join(" en ", ectopy) + " waargenomen.");

        if (metrics.avBlock()) findings.add("Er werd " + m.avBlockType() + " vastgesteld.");
        return findings;
    }

    private List<String> conclusions(HolterMeasurements m, HolterMetrics metrics) {
        List<String> items = new ArrayList<>();
        if (metrics.atrialFibrillation()) items.add("- Atriumfibrilleren gedocumenteerd");
        if (metrics.bradycardia()) items.add("- Bradycardie");
        if (metrics.tachycardia()) items.add("- Tachycardie");
        if (metrics.significantPauses()) items.add("- Significante pauzes");
        if (metrics.frequentVes()) items.add("- Frequente ventriculaire extrasystolen");
        if (metrics.frequentSves()) items.add("- Frequente supraventriculaire extrasystolen");
        if (metrics.avBlock()) items.add("- " + m.avBlockType());
        if (!metrics.anyFinding()) items.add(NO_ABNORMALITIES);
        return items;
    }

    private static boolean isPositive(Integer value) {
        return value != null && value > 0;
    }
}
