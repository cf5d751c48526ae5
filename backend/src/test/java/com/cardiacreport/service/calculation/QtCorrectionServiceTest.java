package com.cardiacreport.service.calculation;

import com.cardiacreport.model.metrics.QtcResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class QtCorrectionServiceTest {

    private final QtCorrectionService service = new QtCorrectionService();

    @Test
    public void testCorrect_BazettAndFridericia() {
        QtcResult result = service.correct(400.0, 75.0, null);
        assertEquals(447.2, result.bazett());
        assertEquals(430.9, result.fridericia());
    }

    @Test
    public void testCorrect_FallsBackToReportedQtc() {
        QtcResult result = service.correct(null, 75.0, 440.0);
        assertEquals(440.0, result.bazett());
        assertEquals(440.0, result.fridericia());
    }

    @Test
    public void testCorrect_NothingKnown() {
        QtcResult result = service.correct(400.0, 0.0, null);
        assertNull(result.bazett());
        assertNull(result.fridericia());
    }

    @Test
    public void testCorrect_ReportedQtcRoundedToOneDecimal() {
        QtcResult result = service.correct(400.0, 0.0, 441.26);
        assertEquals(441.3, result.bazett());
        assertEquals(441.3, result.fridericia());
    }
}
