package com.cardiacreport.service.metrics;

import com.cardiacreport.model.enums.Sex;
import com.cardiacreport.model.metrics.FietstestMetrics;
import com.cardiacreport.model.patient.PatientContext;
import com.cardiacreport.model.study.FietstestMeasurements;
import com.cardiacreport.support.TestServices;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FietstestMetricsServiceTest {

    private final FietstestMetricsService service = TestServices.fietstestMetrics();

    private static FietstestMeasurements.FietstestMeasurementsBuilder study() {
        return FietstestMeasurements.builder()
            .patient(PatientContext.builder().sex(Sex.MAN).age(60.0).weight(75.0).build());
    }

    @Test
    public void testCompute_HeartRateAndVo2() {
        FietstestMetrics metrics = service.compute(study().maxWatt(150).maxHr(150).build());

        assertEquals(166L, metrics.predictedMaxHr());
        assertEquals(90.4, metrics.hrPercentOfPredicted());
        assertEquals(29.0, metrics.vo2());
        assertEquals("25-75%", metrics.vo2Percentile().band());
        assertEquals("Max HR: 150 bpm (90.4% of predicted 166 bpm)", metrics.summaryLines().get(0));
        assertTrue(metrics.summaryLines().get(1).startsWith("Observed VO2: 29.0 ml·kg⁻¹·min⁻¹"));
        assertTrue(metrics.summaryLines().get(2).startsWith("Wattage: 150 W ("));
    }

    @Test
    public void testCompute_NoWorkload() {
        FietstestMetrics metrics = service.compute(study().build());

        assertNull(metrics.vo2());
        assertNull(metrics.hrPercentOfPredicted());
        assertTrue(metrics.summaryLines().get(0).startsWith("Predicted wattage: "));
    }

    @Test
    public void testSuggestEffortType() {
        FietstestMeasurements submaximal = study().maxHr(120).build();
        assertEquals("Submaximale inspanning", service.suggestEffortType(submaximal, service.compute(submaximal)));

        FietstestMeasurements maximal = study().maxHr(150).build();
        assertEquals("Maximale inspanning", service.suggestEffortType(maximal, service.compute(maximal)));
    }
}
