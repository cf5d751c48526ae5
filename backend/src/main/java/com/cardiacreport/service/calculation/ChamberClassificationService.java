package com.cardiacreport.service.calculation;

import com.cardiacreport.model.enums.Sex;
import com.cardiacreport.util.BodySurfaceArea;
import com.cardiacreport.util.MeasurementParser;
import com.cardiacreport.util.ReportFormat;
import org.springframework.stereotype.Service;

/**
 * Atria, right ventricle, diastolic function and pulmonary pressure.
 */
@Service
public class ChamberClassificationService {

    public static final String LA_NOT_DILATED = "Niet gedilateerd";
    public static final String RV_NORMAL_FUNCTION = "goede longitudinale systolische functie";
    public static final String NO_TR_SIGNAL = "Geen adequaat TR-signaal voor PASP";

    static final String DIASTOLIC_NORMAL =
        "Normale diastolische functie met normale vullingsdrukken in het linker atrium";
    static final String DIASTOLIC_GRADE_1 =
        "Diastolische dysfunctie graad 1 met normale vullingsdrukken in het linker atrium";
    static final String DIASTOLIC_GRADE_2 =
        "Diastolische dysfunctie graad 2 met gestegen vullingsdrukken in het linker atrium";
    static final String DIASTOLIC_GRADE_3 =
        "Diastolische dysfunctie graad 3 met ernstig gestegen vullingsdrukken in het linker atrium";

    // ========================================================================
    // Atria
    // ========================================================================

    /**
     * LA volume index (mL/m², one decimal). Null without a usable BSA.
     */
    public Double laVolumeIndex(Double laVolume, Double bsa) {
        if (laVolume == null || !BodySurfaceArea.isUsable(bsa)) return null;
        return ReportFormat.round(laVolume / Math.max(0.01, bsa), 1);
    }

    /**
     * LAVI tiers: ≤34 normal, ≤41 mild, ≤48 moderate, else severe dilatation.
     */
    public String classifyLavi(Double lavi) {
        if (lavi == null) return null;
        if (lavi <= 34) return LA_NOT_DILATED;
        if (lavi <= 41) return "Mild gedilateerd";
        if (lavi <= 48) return "Matig gedilateerd";
        return "Ernstig gedilateerd";
    }

    public Double raVolumeIndex(Double raVolume, Double bsa) {
        return BodySurfaceArea.index(raVolume, bsa, 1);
    }

    /**
     * RA is dilated above 32 mL/m² in men and 28 mL/m² in women.
     */
    public String classifyRa(Double ravi, Sex sex) {
        if (ravi == null) return LA_NOT_DILATED;
        double limit = sex != null && sex.isMale() ? 32 : 28;
        return ravi > limit ? "Gedilateerd" : LA_NOT_DILATED;
    }

    // ========================================================================
    // Right ventricle
    // ========================================================================

    public String classifyRvHypertrophy(Double rvfwd) {
        return rvfwd != null && rvfwd > 5 ? "Hypertroof" : "Normotroof";
    }

    /**
     * Dilated when the basal diameter exceeds 41 mm or the mid diameter 35 mm.
     */
    public String classifyRvDilatation(Double rvbd, Double rvmd) {
        boolean dilated = (rvbd != null && rvbd > 41) || (rvmd != null && rvmd > 35);
        return dilated ? "gedilateerd" : "niet gedilateerd";
    }

    /**
     * TAPSE tiers: >17 good, 13-17 mild, 11-13 moderate, else severe reduction.
     * Missing TAPSE reads as good function.
     */
    public String classifyTapse(Double tapse) {
        if (tapse == null) return RV_NORMAL_FUNCTION;
        if (tapse > 17) return RV_NORMAL_FUNCTION;
        if (tapse >= 13) return "mild verminderde longitudinale systolische functie";
        if (tapse >= 11) return "matig verminderde longitudinale systolische functie";
        return "ernstig verminderde longitudinale systolische functie";
    }

    // ========================================================================
    // Diastolic function and pulmonary pressure
    // ========================================================================

    /**
     * Diastolic function from E/A, with E/e', LAVI and the TR gradient as tie-breakers
     * when E/A lies between 0.8 and 2.
     */
    public String suggestDiastolicFunction(Double ea, Double ee, Double lavi, Double paspRaw) {
        if (ea == null) return DIASTOLIC_NORMAL;
        if (ea < 0.8) return DIASTOLIC_GRADE_1;
        if (ea > 2) return DIASTOLIC_GRADE_3;
        int positive = 0;
        if (ee != null && ee > 13) positive++;
        if (lavi != null && lavi > 34) positive++;
        if (paspRaw != null && paspRaw > 31) positive++;
        return positive >= 2 ? DIASTOLIC_GRADE_2 : DIASTOLIC_NORMAL;
    }

    /**
     * Estimated PASP = TR gradient + CVD, rounded to whole mmHg. Null without a TR gradient.
     */
    public Long estimatePasp(Double paspRaw, String cvd) {
        if (paspRaw == null) return null;
        return ReportFormat.roundToLong(paspRaw + MeasurementParser.parseCvd(cvd));
    }

    /**
     * Report sentence for the pulmonary pressure. Above 35 mmHg counts as pulmonary hypertension.
     */
    public String paspText(Double paspRaw, String cvd) {
        Long total = estimatePasp(paspRaw, cvd);
        if (total == null) return NO_TR_SIGNAL;
        if (total > 35) return "Pulmonale hypertensie met PASP " + total + " mmHg.";
        return "Normale pulmonale drukken met PASP " + total + " mmHg.";
    }
}
