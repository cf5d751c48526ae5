package com.cardiacreport.service.report;

import com.cardiacreport.model.metrics.HolterMetrics;
import com.cardiacreport.model.study.HolterMeasurements;
import com.cardiacreport.service.metrics.HolterMetricsService;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class HolterReportServiceTest {

    private final HolterMetricsService metricsService = new HolterMetricsService();
    private final HolterReportService service = new HolterReportService();

    private static HolterMeasurements abnormal() {
        return HolterMeasurements.builder()
            .recordingDate("2024-02-10").recordingDurationHours(24)
            .avgHr(68).minHr(38).maxHr(130)
            .afibPercentage(12.5)
            .pausesCount(3).longestPauseMs(2500)
            .vesCount(1500).svesCount(200)
            .build();
    }

    @Test
    public void testComposeFullReport_Findings() {
        HolterMeasurements m = abnormal();
        String report = service.composeFullReport(m, metricsService.compute(m));

        assertEquals("Holter-monitoring geregistreerd op 2024-02-10.\n"
            + "Registratieduur: 24 uur.\n"
            + "Hartfrequentie: gemiddelde hartfrequentie 68 bpm, minimum 38 bpm, maximum 130 bpm.\n"
            + "Er werd bradycardie vastgesteld.\n"
            + "Er werden episoden van tachycardie waargenomen.\n"
            + "Er werden frequente episoden van atriumfibrilleren waargenomen (12.5% van de tijd).\n"
            + "Er werden significante pauzes geregistreerd: 3 pauze(s) met een maximale duur van 2500 ms.\n"
            + "Er werden frequente ventriculaire extrasystolen (VES: 1500) en supraventriculaire extrasystolen"
            + " (SVES: 200) waargenomen.\n"
            + "\n"
            + "Conclusie:\n"
            + "- Atriumfibrilleren gedocumenteerd\n"
            + "- Bradycardie\n"
            + "- Tachycardie\n"
            + "- Significante pauzes\n"
            + "- Frequente ventriculaire extrasystolen", report);
    }

    @Test
    public void testComposeFullReport_NoFindings() {
        HolterMeasurements m = HolterMeasurements.builder().build();
        String report = service.composeFullReport(m, metricsService.compute(m));

        assertEquals("Holter-monitoring registratie.\n"
            + HolterReportService.NO_FINDINGS + "\n"
            + "\n"
            + "Conclusie:\n"
            + HolterReportService.NO_ABNORMALITIES, report);
    }

    @Test
    public void testComposeFullReport_PermanentAfibAndAvBlock() {
        HolterMeasurements m = HolterMeasurements.builder().afibPercentage(80.0).avBlockType("AV-blok graad 2").build();
        String report = service.composeFullReport(m, metricsService.compute(m));

        assertTrue(report.contains("Er werd permanent atriumfibrilleren vastgesteld (80.0% van de tijd)."));
        assertTrue(report.contains("Er werd AV-blok graad 2 vastgesteld."));
        assertTrue(report.endsWith("- AV-blok graad 2"));
    }

    @Test
    public void testComposeBrief() {
        HolterMeasurements m = abnormal();
        assertEquals("Holter-monitoring (24u); Gem. HR: 68 bpm; AFIB: 12.5%; Significante pauzes; Frequente VES (1500)",
            service.composeBrief(m, metricsService.compute(m)));
    }

    @Test
    public void testComposeBrief_Fallback() {
        assertEquals(HolterReportService.BRIEF_FALLBACK,
            service.composeBrief(HolterMeasurements.builder().build(), HolterMetrics.builder().build()));
    }
}
