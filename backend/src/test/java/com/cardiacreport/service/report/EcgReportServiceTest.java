package com.cardiacreport.service.report;

import com.cardiacreport.model.metrics.EcgMetrics;
import com.cardiacreport.model.study.EcgMeasurements;
import com.cardiacreport.service.metrics.EcgMetricsService;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class EcgReportServiceTest {

    private final EcgReportService service = new EcgReportService();

    private static EcgMeasurements study() {
        return EcgMeasurements.builder()
            .recordedAt("2024-03-01")
            .rhythmSummary("Sinusritme")
            .ventRate(72.0).prIntervalMs(160.0).qrsDurationMs(96.0).qtIntervalMs(400.0)
            .pAxisDeg(60.0).qrsAxisDeg(30.0).tAxisDeg(45.0)
            .build();
    }

    private static EcgMetrics metrics() {
        return EcgMetrics.builder()
            .qtcBazett(438.2).qtcFridericia(425.0)
            .axisDeviation(EcgMetricsService.NORMAL_AXIS)
            .build();
    }

    @Test
    public void testComposeFullReport() {
        assertEquals("ECG geregistreerd op 2024-03-01.\n"
            + "Ritme: Sinusritme.\n"
            + "Frequentie 72 bpm, PR 160 ms, QRS 96 ms, QT 400 ms (QTcB 438 ms; QTcF 425 ms).\n"
            + "P-as 60°, QRS-as 30°.\n"
            + "Normale QRS-as.", service.composeFullReport(study(), metrics()));
    }

    @Test
    public void testComposeFullReport_AutoTextAndRateFlag() {
        EcgMeasurements m = EcgMeasurements.builder().ventRate(110.0).autoReportText("  Sinustachycardie  ").build();
        EcgMetrics metrics = EcgMetrics.builder().tachycardia(true).build();

        assertEquals("Normaal sinusaal ritme.\n"
            + "Frequentie 110 bpm.\n"
            + "\n"
            + "Automatische protocolering:\n"
            + "Sinustachycardie\n"
            + "Frequentie in tachycard bereik (>100 bpm).", service.composeFullReport(m, metrics));
    }

    @Test
    public void testComposeBrief() {
        assertEquals("ECG dd. 2024-03-01: Sinusritme; HF 72 bpm; QRS 96 ms; QTcB 438 ms; QTcF 425 ms; Normale QRS-as",
            service.composeBrief(study(), metrics()));
    }

    @Test
    public void testComposeBrief_FallsBackToRawQt() {
        EcgMeasurements m = EcgMeasurements.builder().qtIntervalMs(380.0).build();
        assertEquals("ECG: QT 380 ms", service.composeBrief(m, EcgMetrics.builder().build()));
    }

    @Test
    public void testComposeBrief_NoData() {
        assertEquals(EcgReportService.NO_DATA,
            service.composeBrief(EcgMeasurements.builder().build(), EcgMetrics.builder().build()));
    }
}
