package com.cardiacreport.service.metrics;

import com.cardiacreport.model.enums.Sex;
import com.cardiacreport.model.metrics.CiedMetrics;
import com.cardiacreport.model.patient.PatientContext;
import com.cardiacreport.model.study.CiedMeasurements;
import com.cardiacreport.support.TestServices;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CiedMetricsServiceTest {

    private final CiedMetricsService service = TestServices.ciedMetrics();

    @Test
    public void testCompute_ProgrammingSuggestions() {
        CiedMeasurements m = CiedMeasurements.builder()
            .patient(PatientContext.builder().sex(Sex.MAN).age(60.0).length(175.0).build())
            .lowerRate(60).upperTracking(130)
            .sensedAvDelay(150).pacedAvDelay(180)
            .lvef(60.0)
            .build();

        CiedMetrics metrics = service.compute(m);

        assertEquals(74L, metrics.myPaceLowerRate());
        assertEquals(141L, metrics.upperTrackingSuggestion());
        assertEquals(35L, metrics.avDelayReduction());
        assertEquals(115L, metrics.rateAdaptiveSensedAv());
        assertEquals(145L, metrics.rateAdaptivePacedAv());
        assertEquals(292L, metrics.optimalPvarp());
        assertEquals(150L, metrics.recommendedSensedAv());
        assertEquals("myPACE (if HFpEF) suggested lower rate: 74 bpm", metrics.summaryLines().get(0));
        assertEquals("Suggested upper tracking rate: 141 bpm (≈85% of predicted max HR 166 bpm)",
            metrics.summaryLines().get(1));
        // recommended sensed delay equals the programmed one, so no advice line
        assertTrue(metrics.summaryLines().stream().noneMatch(l -> l.startsWith("Recommended sensed AV delay")));
    }

    @Test
    public void testCompute_RecommendedSensedDelayDiffers() {
        CiedMetrics metrics = service.compute(CiedMeasurements.builder().sensedAvDelay(120).pacedAvDelay(200).build());

        assertTrue(metrics.summaryLines().contains(
            "Recommended sensed AV delay based on paced AV delay: 170 ms (paced - 30)."));
        assertNull(metrics.predictedMaxHr());
    }
}
