package com.cardiacreport.service.metrics;

import com.cardiacreport.model.metrics.EcgMetrics;
import com.cardiacreport.model.metrics.QtcResult;
import com.cardiacreport.model.study.EcgMeasurements;
import com.cardiacreport.service.calculation.QtCorrectionService;
import com.cardiacreport.util.ReportFormat;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Resting ECG: corrected QT, rate flags and QRS axis.
 *   Tachycardia above 100 bpm, bradycardia below 50 bpm.
 *   Axis below -30° is left deviation, above 90° right deviation.
 */
@Service
public class EcgMetricsService {

    public static final String LEFT_AXIS = "Linkerasdeviatie";
    public static final String RIGHT_AXIS = "Rechterasdeviatie";
    public static final String NORMAL_AXIS = "Normale QRS-as";

    private final QtCorrectionService qtCorrection;

    public EcgMetricsService(QtCorrectionService qtCorrection) {
        this.qtCorrection = qtCorrection;
    }

    public EcgMetrics compute(EcgMeasurements m) {
        QtcResult qtc = qtCorrection.correct(m.qtIntervalMs(), m.ventRate(), m.qtcIntervalMs());
        Double rate = m.ventRate();
        boolean tachy = rate != null && rate > 100;
        boolean brady = rate != null && rate != 0 && rate < 50;
        String axis = classifyAxis(m.qrsAxisDeg());

        List<String> lines = new ArrayList<>();
        if (ReportFormat.hasText(m.rhythmSummary())) lines.add("Ritme: " + m.rhythmSummary());
        if (rate != null) lines.add("Frequentie: " + ReportFormat.fixed(rate, 0) + " bpm");
        if (m.prIntervalMs() != null) lines.add("PR " + ReportFormat.fixed(m.prIntervalMs(), 0) + " ms");
        if (m.pDurationMs() != null) lines.add("P duur " + ReportFormat.fixed(m.pDurationMs(), 0) + " ms");
        if (m.qrsDurationMs() != null) lines.add("QRS " + ReportFormat.fixed(m.qrsDurationMs(), 0) + " ms");
        if (m.qtIntervalMs() != null) {
            lines.add("QT " + ReportFormat.fixed(m.qtIntervalMs(), 0) + " ms" + qtcSuffix(qtc.bazett(), qtc.fridericia()));
        }
        if (axis != null) lines.add(axis);

        return EcgMetrics.builder()
            .qtcBazett(qtc.bazett())
            .qtcFridericia(qtc.fridericia())
            .tachycardia(tachy)
            .bradycardia(brady)
            .axisDeviation(axis)
            .summaryLines(lines)
            .build();
    }

    public String classifyAxis(Double qrsAxis) {
        if (qrsAxis == null) return null;
        if (qrsAxis < -30) return LEFT_AXIS;
        if (qrsAxis > 90) return RIGHT_AXIS;
        return NORMAL_AXIS;
    }

    /**
     * " (QTcB 440 ms; QTcF 430 ms)", or the one value that is known, or empty.
     */
    public static String qtcSuffix(Double bazett, Double fridericia) {
        if (bazett != null && fridericia != null) {
            return " (QTcB " + ReportFormat.fixed(bazett, 0) + " ms; QTcF " + ReportFormat.fixed(fridericia, 0) + " ms)";
        }
        if (fridericia != null) return " (QTcF " + ReportFormat.fixed(fridericia, 0) + " ms)";
        if (bazett != null) return " (QTcB " + ReportFormat.fixed(bazett, 0) + " ms)";
        return "";
    }
}
