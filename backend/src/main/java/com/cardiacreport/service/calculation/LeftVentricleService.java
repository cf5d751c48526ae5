package com.cardiacreport.service.calculation;

import com.cardiacreport.model.enums.Sex;
import com.cardiacreport.model.metrics.LvMassAssessment;
import com.cardiacreport.util.BodySurfaceArea;
import com.cardiacreport.util.ReportFormat;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Left Ventricle Service
 *
 * Threshold classifications of the left ventricle:
 * - wall thickness (IVSd), mass index and geometry
 * - end-diastolic and end-systolic diameters
 * - ejection fraction class and the systolic phrase used in reports
 *
 * All dimensions are entered in mm. Missing input yields null, never an exception.
 */
@Service
public class LeftVentricleService {

    public static final String NORMOTROPHIC = "Normotroof";
    public static final String NOT_DILATED = "niet gedilateerd";
    public static final String GOOD_SYSTOLIC_FUNCTION = "goede globale en regionale systolische functie";

    private static final Map<String, String> SYSTOLIC_PHRASES = Map.of(
        "Normaal", GOOD_SYSTOLIC_FUNCTION,
        "Mild", "mild verminderde globale systolische functie",
        "Matig", "matig verminderde globale systolische functie",
        "Ernstig", "ernstig verminderde globale systolische functie"
    );

    private static final String[] LVIDS_LABELS = {"Normaal", "Mild vergroot", "Matig vergroot", "Ernstig vergroot"};

    // ========================================================================
    // Wall thickness and mass
    // ========================================================================

    /**
     * Septal thickness tiers.
     *   Man:   ≤10 normal, ≤13 mild, ≤16 moderate, else severe
     *   Vrouw: ≤9, ≤12, ≤15
     */
    public String classifyIvsd(Double ivsd, Sex sex) {
        if (ivsd == null || sex == null) return null;
        double[] limits = sex.isMale() ? new double[] {10, 13, 16} : new double[] {9, 12, 15};
        if (ivsd <= limits[0]) return NORMOTROPHIC;
        if (ivsd <= limits[1]) return "Mild concentrisch hypertroof";
        if (ivsd <= limits[2]) return "Matig concentrisch hypertroof";
        return "Ernstig concentrisch hypertroof";
    }

    /**
     * Cube formula: 0.8 * 1.04 * ((IVS + LVIDd + PW)³ - LVIDd³) + 0.6, with inputs in cm.
     * Returns grams rounded to one decimal.
     */
    public Double calculateMass(Double ivsd, Double lvidd, Double lvpw) {
        if (ivsd == null || lvidd == null || lvpw == null) return null;
        double ivs = ivsd / 10.0;
        double lvd = lvidd / 10.0;
        double pw = lvpw / 10.0;
        double mass = 0.8 * (1.04 * (Math.pow(ivs + lvd + pw, 3) - Math.pow(lvd, 3))) + 0.6;
        return ReportFormat.round(mass, 1);
    }

    /**
     * Relative wall thickness 2 * PW / LVIDd, three decimals. A zero diameter gives 0.0.
     */
    public Double relativeWallThickness(Double lvpw, Double lvidd) {
        if (lvpw == null || lvidd == null) return null;
        if (lvidd == 0) return 0.0;
        return ReportFormat.round(2.0 * lvpw / lvidd, 3);
    }

    /**
     * Mass index in g/m² (mass / max(0.1, BSA), one decimal).
     */
    public Double massIndex(Double mass, Double bsa) {
        if (mass == null || bsa == null) return null;
        return ReportFormat.round(mass / Math.max(0.1, bsa), 1);
    }

    /**
     * Mass index severity. Values between two tiers (e.g. 115.5 for men) fall through to "Ernstig".
     *   Man:   <115 Normaal, 116-131 Mild, 132-148 Matig
     *   Vrouw: <95 Normaal, 95-108 Mild, 109-121 Matig
     */
    public String classifyMassIndex(Double massIndex, Sex sex) {
        if (massIndex == null || sex == null) return null;
        if (sex.isMale()) {
            if (massIndex < 115) return "Normaal";
            if (massIndex >= 116 && massIndex <= 131) return "Mild";
            if (massIndex >= 132 && massIndex <= 148) return "Matig";
            return "Ernstig";
        }
        if (massIndex < 95) return "Normaal";
        if (massIndex >= 95 && massIndex <= 108) return "Mild";
        if (massIndex >= 109 && massIndex <= 121) return "Matig";
        return "Ernstig";
    }

    /**
     * Full mass assessment. Index and severity need a BSA.
     */
    public LvMassAssessment assessMass(Double ivsd, Double lvidd, Double lvpw, Double bsa, Sex sex) {
        Double mass = calculateMass(ivsd, lvidd, lvpw);
        if (mass == null) return null;
        Double rwt = relativeWallThickness(lvpw, lvidd);
        Double index = BodySurfaceArea.isUsable(bsa) ? massIndex(mass, bsa) : null;
        return new LvMassAssessment(mass, rwt, index, classifyMassIndex(index, sex));
    }

    /**
     * Geometry from mass severity and RWT (0.32 / 0.42 cut points).
     */
    public String classifyGeometry(String massSeverity, double rwt) {
        if (!"Normaal".equals(massSeverity)) {
            if (rwt > 0.42) return massSeverity + " concentrisch hypertroof";
            if (rwt < 0.32) return massSeverity + " eccentrisch hypertroof";
            return massSeverity + " gemengd hypertroof";
        }
        if (rwt > 0.42) return "Concentrische remodeling";
        if (rwt < 0.32) return "Eccentrische remodeling";
        return NORMOTROPHIC;
    }

    // ========================================================================
    // Diameters
    // ========================================================================

    /**
     * LVIDd dilatation. Uses the BSA-indexed table when BSA is positive, otherwise the absolute mm table.
     * Gaps between tiers of the absolute table fall through to "ernstig gedilateerd".
     */
    public String classifyLvidd(Double lvidd, Double bsa, Sex sex) {
        if (lvidd == null || sex == null) return null;
        boolean male = sex.isMale();
        Double indexed = BodySurfaceArea.index(lvidd, bsa, 1);
        if (indexed != null) {
            double low = male ? 31 : 32;
            double mild = male ? 34 : 35;
            double moderate = male ? 36 : 37;
            if (indexed < low) return NOT_DILATED;
            if (indexed <= mild) return "mild gedilateerd";
            if (indexed <= moderate) return "matig gedilateerd";
            return "ernstig gedilateerd";
        }
        if (male) {
            if (lvidd < 58) return NOT_DILATED;
            if (lvidd >= 59 && lvidd <= 63) return "mild gedilateerd";
            if (lvidd >= 64 && lvidd <= 68) return "matig gedilateerd";
            return "ernstig gedilateerd";
        }
        if (lvidd < 52) return NOT_DILATED;
        if (lvidd >= 53 && lvidd <= 56) return "mild gedilateerd";
        if (lvidd >= 57 && lvidd <= 61) return "matig gedilateerd";
        return "ernstig gedilateerd";
    }

    /**
     * LVIDs grade 0-3 from the absolute diameter or the index (mm/m², two decimals), whichever is worse.
     */
    public int gradeLvids(Double lvids, Double lvidsIndexed, Sex sex) {
        if (lvids == null && lvidsIndexed == null) return 0;
        if (sex != null && sex.isMale()) {
            if (above(lvids, 45) || above(lvidsIndexed, 25)) return 3;
            if (between(lvids, 44, false, 45) || between(lvidsIndexed, 24, true, 25)) return 2;
            if (between(lvids, 41, true, 44) || halfOpen(lvidsIndexed, 22, 24)) return 1;
            return 0;
        }
        if (above(lvids, 41) || above(lvidsIndexed, 26)) return 3;
        if (between(lvids, 39, false, 41) || between(lvidsIndexed, 24, true, 26)) return 2;
        if (between(lvids, 36, true, 39) || halfOpen(lvidsIndexed, 22, 24)) return 1;
        return 0;
    }

    public String lvidsLabel(int grade) {
        return LVIDS_LABELS[Math.max(0, Math.min(3, grade))];
    }

    /**
     * Teichholz EF from end-diastolic and end-systolic diameters, one decimal.
     * Volume = 7 / (2.4 + D) * D³ with D in cm.
     */
    public Double teichholzEf(Double lvidd, Double lvids) {
        if (lvidd == null || lvids == null || lvidd <= 0) return null;
        double edv = teichholzVolume(lvidd / 10.0);
        double esv = teichholzVolume(lvids / 10.0);
        if (edv == 0) return null;
        return ReportFormat.round((edv - esv) / edv * 100.0, 1);
    }

    // ========================================================================
    // Ejection fraction
    // ========================================================================

    /**
     * LVEF class.
     *   <30 Ernstig, 30-40 Matig
     *   Man:   41-51 Mild, 52-72 Normaal
     *   Vrouw: 41-53 Mild, 54-74 Normaal
     * Anything left over is Matig below 41, Mild otherwise.
     */
    public String classifyLvef(Double lvef, Sex sex) {
        if (lvef == null || sex == null) return null;
        if (lvef < 30) return "Ernstig";
        if (lvef <= 40) return "Matig";
        boolean male = sex.isMale();
        double mildUpper = male ? 51 : 53;
        double normalLower = male ? 52 : 54;
        double normalUpper = male ? 72 : 74;
        if (lvef >= 41 && lvef <= mildUpper) return "Mild";
        if (lvef >= normalLower && lvef <= normalUpper) return "Normaal";
        if (lvef < 41) return "Matig";
        return "Mild";
    }

    /**
     * Report phrase for an LVEF class. Unknown classes read as good function.
     */
    public String systolicPhrase(String lvefClass) {
        if (lvefClass == null) return GOOD_SYSTOLIC_FUNCTION;
        return SYSTOLIC_PHRASES.getOrDefault(lvefClass, GOOD_SYSTOLIC_FUNCTION);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static double teichholzVolume(double diameterCm) {
        return 7.0 / (2.4 + diameterCm) * Math.pow(diameterCm, 3);
    }

    private static boolean above(Double value, double limit) {
        return value != null && value > limit;
    }

    private static boolean between(Double value, double lower, boolean lowerInclusive, double upper) {
        if (value == null) return false;
        boolean aboveLower = lowerInclusive ? value >= lower : value > lower;
        return aboveLower && value <= upper;
    }

    private static boolean halfOpen(Double value, double lower, double upper) {
        return value != null && value >= lower && value < upper;
    }
}
