package com.cardiacreport.service.calculation;

import com.cardiacreport.model.enums.Sex;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ChamberClassificationServiceTest {

    private final ChamberClassificationService service = new ChamberClassificationService();

    @Test
    public void testLaVolumeIndex_NullWithoutBsa() {
        assertEquals(30.0, service.laVolumeIndex(60.0, 2.0));
        assertNull(service.laVolumeIndex(60.0, null));
        assertNull(service.laVolumeIndex(60.0, 0.0));
    }

    @Test
    public void testClassifyLavi() {
        assertEquals("Niet gedilateerd", service.classifyLavi(34.0));
        assertEquals("Mild gedilateerd", service.classifyLavi(40.0));
        assertEquals("Matig gedilateerd", service.classifyLavi(48.0));
        assertEquals("Ernstig gedilateerd", service.classifyLavi(49.0));
    }

    @Test
    public void testClassifyRa_SexSpecificLimit() {
        assertEquals("Niet gedilateerd", service.classifyRa(30.0, Sex.MAN));
        assertEquals("Gedilateerd", service.classifyRa(30.0, Sex.VROUW));
        assertEquals("Niet gedilateerd", service.classifyRa(null, Sex.VROUW));
    }

    @Test
    public void testRightVentricle() {
        assertEquals("Hypertroof", service.classifyRvHypertrophy(6.0));
        assertEquals("Normotroof", service.classifyRvHypertrophy(null));
        assertEquals("gedilateerd", service.classifyRvDilatation(42.0, null));
        assertEquals("niet gedilateerd", service.classifyRvDilatation(40.0, 35.0));
        assertEquals(ChamberClassificationService.RV_NORMAL_FUNCTION, service.classifyTapse(20.0));
        assertEquals("mild verminderde longitudinale systolische functie", service.classifyTapse(15.0));
        assertEquals("ernstig verminderde longitudinale systolische functie", service.classifyTapse(10.0));
    }

    @Test
    public void testSuggestDiastolicFunction() {
        assertEquals(ChamberClassificationService.DIASTOLIC_NORMAL, service.suggestDiastolicFunction(null, 20.0, 50.0, 40.0));
        assertEquals(ChamberClassificationService.DIASTOLIC_GRADE_1, service.suggestDiastolicFunction(0.7, null, null, null));
        assertEquals(ChamberClassificationService.DIASTOLIC_GRADE_3, service.suggestDiastolicFunction(2.5, null, null, null));
        assertEquals(ChamberClassificationService.DIASTOLIC_GRADE_2, service.suggestDiastolicFunction(1.2, 15.0, 40.0, null));
        assertEquals(ChamberClassificationService.DIASTOLIC_NORMAL, service.suggestDiastolicFunction(1.2, 15.0, 30.0, null));
    }

    @Test
    public void testPaspText() {
        assertEquals("Normale pulmonale drukken met PASP 28 mmHg.", service.paspText(20.0, "8"));
        assertEquals("Pulmonale hypertensie met PASP 38 mmHg.", service.paspText(30.0, "8"));
        assertEquals("Pulmonale hypertensie met PASP 45 mmHg.", service.paspText(30.0, "15+"));
        assertEquals(ChamberClassificationService.NO_TR_SIGNAL, service.paspText(null, "8"));
    }

    @Test
    public void testEstimatePasp_MissingCvdCountsAsZero() {
        assertEquals(20L, service.estimatePasp(20.0, null));
    }
}
