package com.cardiacreport.service.report;

import com.cardiacreport.model.enums.Sex;
import com.cardiacreport.model.metrics.EchoMetrics;
import com.cardiacreport.model.patient.PatientContext;
import com.cardiacreport.model.study.EchoMeasurements;
import com.cardiacreport.service.metrics.EchoMetricsService;
import com.cardiacreport.support.TestServices;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EchoReportServiceTest {

    private final EchoMetricsService metricsService = TestServices.echoMetrics();
    private final EchoReportService service = new EchoReportService();

    private static PatientContext man(Double bsa) {
        return PatientContext.builder().sex(Sex.MAN).bsa(bsa).build();
    }

    @Test
    public void testComposeFullReport_AllMeasurementsMissing() {
        EchoMeasurements m = EchoMeasurements.builder().patient(man(null)).build();
        String report = service.composeFullReport(m, metricsService.compute(m));
        List<String> lines = List.of(report.split("\n", -1));

        assertTrue(report.contains("Normotroof"));
        assertTrue(report.contains("niet gedilateerd"));
        assertEquals("LV: Normotroof, niet gedilateerd, met goede globale en regionale systolische functie.", lines.get(0));
        assertEquals("LA: Niet gedilateerd.", lines.get(2));
        assertEquals("", lines.get(3));
        assertEquals("RV: Normotroof, niet gedilateerd met goede longitudinale systolische functie."
            + " Geen adequaat TR-signaal voor PASP", lines.get(4));
        assertTrue(lines.contains("AK: Normale tricuspiede morfologie. Geen calcificatie. Geen stenose. Geen regurgitatie."));
        assertTrue(lines.contains("MK: Normale morfologie. Geen regurgitatie."));
        assertEquals("IVC is niet gedilateerd met bewaarde ademhalingsvariatie.", lines.get(lines.size() - 1));
    }

    @Test
    public void testComposeFullReport_MeasurementsAndChoices() {
        EchoMeasurements m = EchoMeasurements.builder()
            .patient(man(2.0))
            .ivsd(10.0).lvpw(10.0).lvidd(50.0).lvef(60.0)
            .ea(1.0).ee(8.0)
            .tapse(22.0)
            .paspRaw(20.0).cvd("8")
            .mkRegurgitatie("Milde mitralis regurgitatie")
            .mkEroa(0.1)
            .build();

        String report = service.composeFullReport(m, metricsService.compute(m));

        assertTrue(report.startsWith("LV: Normotroof (IVSd 10.0 mm, LVPWd 10.0 mm, LVMI 91.0 g/m², RWT 0.4),"
            + " niet gedilateerd (LVIDd 50.0 mm), met goede globale en regionale systolische functie (LVEF 60.0%)."));
        assertTrue(report.contains("Normale diastolische functie met normale vullingsdrukken in het linker atrium"
            + " (E/A 1.0, E/e' 8.0)."));
        assertTrue(report.contains("(TAPSE 22.0 mm). Normale pulmonale drukken met PASP 28 mmHg."));
        assertTrue(report.contains("MK: Normale morfologie. Milde mitralis regurgitatie (EROA 0.10 cm²)."));
        assertTrue(report.endsWith("IVC is niet gedilateerd met bewaarde ademhalingsvariatie. CVD bedraagt 8 mmHg."));
    }

    @Test
    public void testComposeFullReport_DilatedAorta() {
        EchoMeasurements m = EchoMeasurements.builder().patient(man(1.91)).ascao(42.0).build();
        String report = service.composeFullReport(m, metricsService.compute(m));

        assertTrue(report.contains("AO: Aorta gedilateerd (AscAo 42 mm, 22.0 mm/m²)."));
        assertTrue(report.contains("Aorta ascendens (AscAo) is gedilateerd (42 mm, 22.0 mm/m²)."));
    }

    @Test
    public void testComposeFullReport_LowFlowLowGradientNote() {
        EchoMeasurements m = EchoMeasurements.builder()
            .patient(man(2.0)).akVmax(3.2).akMean(30.0).ava(0.8).sv(60.0).build();
        String report = service.composeFullReport(m, metricsService.compute(m));

        assertTrue(report.contains("Ernstige stenose (low-flow low-gradient patroon"));
        assertTrue(report.contains("(Vmax 3.20 m/s, MeanG 30 mmHg, AVA 0.80 cm², 0.40 cm²/m², SV 60 mL, SVi 30.0 mL/m²)"));
    }

    @Test
    public void testComposeBrief() {
        EchoMeasurements m = EchoMeasurements.builder()
            .patient(man(2.0))
            .lvidd(50.0).lvef(60.0)
            .mkEroa(0.45)
            .paspRaw(30.0).cvd("8")
            .build();

        String brief = service.composeBrief(m, metricsService.compute(m));

        assertEquals("goede globale en regionale systolische functie LVEF 60%; LV: niet gedilateerd;"
            + " AK: Geen stenose; MK: Ernstige mitralis regurgitatie; TK: Geen regurgitatie;"
            + " PK: Geen regurgitatie; Pulmonale hypertensie met PASP 38 mmHg.", brief);
    }

    @Test
    public void testStenosisLabel_ChoiceWins() {
        EchoMeasurements m = EchoMeasurements.builder()
            .patient(man(2.0)).akVmax(4.5).akStenose("Matige stenose").build();
        assertEquals("Matige stenose", service.stenosisLabel(m, metricsService.compute(m)));

        EchoMeasurements auto = m.toBuilder().akStenose(null).build();
        EchoMetrics metrics = metricsService.compute(auto);
        assertEquals("Ernstige stenose", service.stenosisLabel(auto, metrics));
    }
}
