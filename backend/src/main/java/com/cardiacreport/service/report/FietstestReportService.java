package com.cardiacreport.service.report;

import com.cardiacreport.model.metrics.FietstestMetrics;
import com.cardiacreport.model.metrics.Vo2Percentile;
import com.cardiacreport.model.study.FietstestMeasurements;
import com.cardiacreport.util.ReportFormat;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

import static com.cardiacreport.util.ReportFormat.orEmpty;
import static com.cardiacreport.util.ReportFormat.plain;

/**
 * Bicycle stress test report. Missing workload and heart rate values print as 0.
 */
@Service
public class FietstestReportService {

    static final String NO_DATA = "Geen fietsproefgegevens beschikbaar.";
    private static final String VO2_UNIT = "ml·kg⁻¹·min⁻¹";

    public String composeFullReport(FietstestMeasurements m, FietstestMetrics metrics) {
        int startWatt = orZero(m.startWatt());
        int increment = orZero(m.incrementWatt());
        int maxWatt = orZero(m.maxWatt());
        int duration = orZero(m.durationAtMax());
        int maxHr = orZero(m.maxHr());

        String hrPercent = "";
        if (metrics.predictedMaxHr() != null && metrics.predictedMaxHr() > 0 && maxHr > 0) {
            Double pct = metrics.hrPercentOfPredicted();
            if (pct == null) pct = ReportFormat.round(maxHr / (double) metrics.predictedMaxHr() * 100, 1);
            hrPercent = " (" + plain(pct) + "% predicted)";
        }

        List<String> report = new ArrayList<>();
        report.add("Start aan " + startWatt + " W. Opdrijven van de belasting met " + increment + " W om de minuut.");
        report.add(maxWatt > 0
            ? "Maximale belasting tot " + maxWatt + " Watt gedurende " + duration + " seconden."
            : "Maximale belasting niet bereikt of niet gerapporteerd.");
        report.add("Maximale hartslag bedraagt " + maxHr + "/min" + hrPercent);
        report.add(orEmpty(m.bpEvolutie()) + ". " + orEmpty(m.ritme()) + ".");
        report.add(orEmpty(m.effortType()) + ". Het criterium voor staken betreft " + orEmpty(m.stopCriterium()) + ".");
        report.add("");
        report.add("Het ECG vertoont " + orEmpty(m.ecgChanges()) + " tijdens inspanning of recuperatie.");
        report.add("");
        report.add("Conclusie: " + orEmpty(m.conclusion()) + ".");

        if (metrics.vo2() != null) {
            report.add(3, vo2Line(metrics.vo2(), metrics.vo2Percentile()));
        }
        return String.join("\n", report);
    }

    /**
     * Workload, heart rate, VO2 and conclusion, joined by "; ".
     */
    public String composeBrief(FietstestMeasurements m, FietstestMetrics metrics) {
        List<String> parts = new ArrayList<>();
        if (m.maxWatt() != null && m.maxWatt() != 0) {
            parts.add("Max belasting " + m.maxWatt() + " W");
        }
        if (m.maxHr() != null && m.maxHr() != 0) {
            parts.add(metrics.hrPercentOfPredicted() != null
                ? "HF " + m.maxHr() + " bpm (" + ReportFormat.fixed(metrics.hrPercentOfPredicted(), 0) + "% voorspeld)"
                : "HF " + m.maxHr() + " bpm");
        }
        if (metrics.vo2() != null) {
            String vo2 = "VO₂ " + ReportFormat.fixed(metrics.vo2(), 1) + " " + VO2_UNIT;
            if (metrics.vo2Percentile() != null) {
                vo2 += " (" + ReportFormat.fixed(metrics.vo2Percentile().percentOfP50(), 0) + "% vs p50)";
            }
            parts.add(vo2);
        }
        if (ReportFormat.hasText(m.conclusion())) parts.add(m.conclusion().trim());
        return parts.isEmpty() ? NO_DATA : String.join("; ", parts);
    }

    private static String vo2Line(double vo2, Vo2Percentile percentile) {
        if (percentile == null) {
            return "VO2 (" + VO2_UNIT + "): " + plain(vo2);
        }
        return "VO2: " + plain(vo2) + " " + VO2_UNIT + " (" + plain(percentile.percentOfP50()) + "% predicted)"
            + " — Percentiel: " + percentile.band() + " (" + percentile.bandText() + ")";
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }
}
