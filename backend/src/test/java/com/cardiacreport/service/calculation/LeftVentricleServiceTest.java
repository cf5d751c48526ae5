package com.cardiacreport.service.calculation;

import com.cardiacreport.model.enums.Sex;
import com.cardiacreport.model.metrics.LvMassAssessment;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LeftVentricleServiceTest {

    private final LeftVentricleService service = new LeftVentricleService();

    @Test
    public void testClassifyIvsd_MaleTiers() {
        assertEquals("Normotroof", service.classifyIvsd(10.0, Sex.MAN));
        assertEquals("Mild concentrisch hypertroof", service.classifyIvsd(11.0, Sex.MAN));
        assertEquals("Matig concentrisch hypertroof", service.classifyIvsd(16.0, Sex.MAN));
        assertEquals("Ernstig concentrisch hypertroof", service.classifyIvsd(17.0, Sex.MAN));
    }

    @Test
    public void testClassifyIvsd_FemaleLimitsAreLower() {
        assertEquals("Normotroof", service.classifyIvsd(9.0, Sex.VROUW));
        assertEquals("Mild concentrisch hypertroof", service.classifyIvsd(10.0, Sex.VROUW));
        assertNull(service.classifyIvsd(null, Sex.VROUW));
    }

    @Test
    public void testCalculateMass() {
        assertEquals(182.0, service.calculateMass(10.0, 50.0, 10.0));
        assertNull(service.calculateMass(10.0, null, 10.0));
    }

    @Test
    public void testRelativeWallThickness() {
        assertEquals(0.4, service.relativeWallThickness(10.0, 50.0));
        assertEquals(0.0, service.relativeWallThickness(10.0, 0.0));
    }

    @Test
    public void testClassifyMassIndex_GapFallsThroughToSevere() {
        assertEquals("Normaal", service.classifyMassIndex(100.0, Sex.MAN));
        assertEquals("Mild", service.classifyMassIndex(120.0, Sex.MAN));
        assertEquals("Ernstig", service.classifyMassIndex(115.5, Sex.MAN));
        assertEquals("Matig", service.classifyMassIndex(110.0, Sex.VROUW));
    }

    @Test
    public void testAssessMass_IndexNeedsBsa() {
        LvMassAssessment withoutBsa = service.assessMass(10.0, 50.0, 10.0, null, Sex.MAN);
        assertEquals(182.0, withoutBsa.mass());
        assertNull(withoutBsa.massIndex());
        assertNull(withoutBsa.severity());

        LvMassAssessment withBsa = service.assessMass(10.0, 50.0, 10.0, 2.0, Sex.MAN);
        assertEquals(91.0, withBsa.massIndex());
        assertEquals("Normaal", withBsa.severity());
    }

    @Test
    public void testClassifyGeometry() {
        assertEquals("Normotroof", service.classifyGeometry("Normaal", 0.4));
        assertEquals("Concentrische remodeling", service.classifyGeometry("Normaal", 0.45));
        assertEquals("Mild concentrisch hypertroof", service.classifyGeometry("Mild", 0.5));
        assertEquals("Matig eccentrisch hypertroof", service.classifyGeometry("Matig", 0.3));
    }

    @Test
    public void testClassifyLvidd_IndexedAndAbsoluteTables() {
        assertEquals("niet gedilateerd", service.classifyLvidd(50.0, 2.0, Sex.MAN));
        assertEquals("mild gedilateerd", service.classifyLvidd(64.0, 2.0, Sex.MAN));
        assertEquals("mild gedilateerd", service.classifyLvidd(60.0, null, Sex.MAN));
        // 58 sits between the absolute tiers
        assertEquals("ernstig gedilateerd", service.classifyLvidd(58.0, null, Sex.MAN));
    }

    @Test
    public void testGradeLvids() {
        assertEquals(0, service.gradeLvids(null, null, Sex.MAN));
        assertEquals(1, service.gradeLvids(42.0, null, Sex.MAN));
        assertEquals(3, service.gradeLvids(46.0, null, Sex.MAN));
        assertEquals(2, service.gradeLvids(40.0, null, Sex.VROUW));
        assertEquals("Ernstig vergroot", service.lvidsLabel(3));
    }

    @Test
    public void testTeichholzEf() {
        Double ef = service.teichholzEf(50.0, 30.0);
        assertNotNull(ef);
        assertTrue(ef > 60 && ef < 75);
        assertNull(service.teichholzEf(0.0, 30.0));
    }

    @Test
    public void testClassifyLvef() {
        assertEquals("Matig", service.classifyLvef(40.0, Sex.MAN));
        assertEquals("Mild", service.classifyLvef(41.0, Sex.MAN));
        assertEquals("Normaal", service.classifyLvef(52.0, Sex.MAN));
        assertEquals("Mild", service.classifyLvef(53.0, Sex.VROUW));
        assertEquals("Ernstig", service.classifyLvef(25.0, Sex.VROUW));
        assertEquals("Mild", service.classifyLvef(80.0, Sex.MAN));
    }

    @Test
    public void testSystolicPhrase_DefaultsToGoodFunction() {
        assertEquals(LeftVentricleService.GOOD_SYSTOLIC_FUNCTION, service.systolicPhrase(null));
        assertEquals("matig verminderde globale systolische functie", service.systolicPhrase("Matig"));
    }
}
