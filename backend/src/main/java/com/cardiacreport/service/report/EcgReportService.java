package com.cardiacreport.service.report;

import com.cardiacreport.model.metrics.EcgMetrics;
import com.cardiacreport.model.study.EcgMeasurements;
import com.cardiacreport.service.metrics.EcgMetricsService;
import com.cardiacreport.util.ReportFormat;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

import static com.cardiacreport.util.ReportFormat.fixed;

/**
 * Resting ECG report and brief.
 */
@Service
public class EcgReportService {

    static final String NO_DATA = "Geen ECG-gegevens beschikbaar.";

    public String composeFullReport(EcgMeasurements m, EcgMetrics metrics) {
        List<String> lines = new ArrayList<>();
        lines.add(ReportFormat.hasText(m.recordedAt())
            ? "ECG geregistreerd op " + m.recordedAt() + "."
            : "Normaal sinusaal ritme.");

        if (ReportFormat.hasText(m.rhythmSummary())) {
            lines.add("Ritme: " + m.rhythmSummary() + ".");
        }

        List<String> intervals = new ArrayList<>();
        if (m.ventRate() != null) intervals.add("Frequentie " + fixed(m.ventRate(), 0) + " bpm");
        if (m.prIntervalMs() != null) intervals.add("PR " + fixed(m.prIntervalMs(), 0) + " ms");
        if (m.qrsDurationMs() != null) intervals.add("QRS " + fixed(m.qrsDurationMs(), 0) + " ms");
        if (m.qtIntervalMs() != null) {
            intervals.add("QT " + fixed(m.qtIntervalMs(), 0) + " ms"
                + EcgMetricsService.qtcSuffix(metrics.qtcBazett(), metrics.qtcFridericia()));
        }
        if (!intervals.isEmpty()) lines.add(String.join(", ", intervals) + ".");

        // T axis is measured but not reported
        List<String> axes = new ArrayList<>();
        if (m.pAxisDeg() != null) axes.add("P-as " + fixed(m.pAxisDeg(), 0) + "°");
        if (m.qrsAxisDeg() != null) axes.add("QRS-as " + fixed(m.qrsAxisDeg(), 0) + "°");
        if (!axes.isEmpty()) lines.add(String.join(", ", axes) + ".");

        String axis = metrics.axisDeviation();
        if (axis != null && !lines.get(lines.size() - 1).contains(axis)) {
            lines.add(axis + ".");
        }

        if (ReportFormat.hasText(m.autoReportText())) {
            lines.add("");
            lines.add("Automatische protocolering:");
            lines.add(m.autoReportText().trim());
        }

        if (metrics.tachycardia()) lines.add("Frequentie in tachycard bereik (>100 bpm).");
        if (metrics.bradycardia()) lines.add("Frequentie in bradycard bereik (<50 bpm).");
        return String.join("\n", lines);
    }

    public String composeBrief(EcgMeasurements m, EcgMetrics metrics) {
        List<String> parts = new ArrayList<>();
        if (ReportFormat.hasText(m.rhythmSummary())) parts.add(m.rhythmSummary().trim());
        if (m.ventRate() != null) parts.add("HF " + fixed(m.ventRate(), 0) + " bpm");
        if (m.qrsDurationMs() != null) parts.add("QRS " + fixed(m.qrsDurationMs(), 0) + " ms");
        if (m.pDurationMs() != null) parts.add("P duur " + fixed(m.pDurationMs(), 0) + " ms");

        Double bazett = metrics.qtcBazett();
        Double fridericia = metrics.qtcFridericia();
        if (bazett != null && fridericia != null) {
            parts.add("QTcB " + fixed(bazett, 0) + " ms");
            parts.add("QTcF " + fixed(fridericia, 0) + " ms");
        } else if (fridericia != null) {
            parts.add("QTcF " + fixed(fridericia, 0) + " ms");
        } else if (bazett != null) {
            parts.add("QTcB " + fixed(bazett, 0) + " ms");
        } else if (m.qtIntervalMs() != null) {
            parts.add("QT " + fixed(m.qtIntervalMs(), 0) + " ms");
        }
        if (metrics.axisDeviation() != null) parts.add(metrics.axisDeviation());

        String text = String.join("; ", parts);
        String prefix;
        if (ReportFormat.hasText(m.recordedAt())) {
            prefix = "ECG dd. " + m.recordedAt() + ": ";
        } else {
            prefix = text.isEmpty() ? "" : "ECG: ";
        }
        String summary = (prefix + text).trim();
        return summary.isEmpty() ? NO_DATA : summary;
    }
}
