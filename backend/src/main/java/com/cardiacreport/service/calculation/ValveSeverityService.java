package com.cardiacreport.service.calculation;

import com.cardiacreport.model.enums.StenosisGrade;
import com.cardiacreport.model.metrics.AorticStenosisAssessment;
import com.cardiacreport.util.BodySurfaceArea;
import org.springframework.stereotype.Service;

/**
 * Valve Severity Service
 *
 * Regurgitation scores (0 none, 1 mild, 2 moderate, 3 severe) take the worst grade
 * over all quantitative parameters that were measured.
 *
 * Aortic stenosis is graded once here and shared by the full report, the brief
 * and the guideline engine so the three can never disagree.
 */
@Service
public class ValveSeverityService {

    // ========================================================================
    // Regurgitation
    // ========================================================================

    /**
     * MR: EROA ≥0.4 / ≥0.2 cm², RegVol ≥60 / ≥30 mL, RF >50 / ≥30 %.
     */
    public int scoreMitralRegurgitation(Double eroa, Double regVol, Double rf) {
        int score = 0;
        score = Math.max(score, gradeAscending(eroa, 0.4, 0.2));
        score = Math.max(score, gradeAscending(regVol, 60, 30));
        score = Math.max(score, gradeFraction(rf));
        return score;
    }

    /**
     * TR: EROA ≥0.4 / ≥0.2 cm², RegVol ≥45 / ≥30 mL, vena contracta ≥0.7 / ≥0.3 cm, RF >50 / ≥30 %.
     */
    public int scoreTricuspidRegurgitation(Double eroa, Double regVol, Double vcw, Double rf) {
        int score = 0;
        score = Math.max(score, gradeAscending(eroa, 0.4, 0.2));
        score = Math.max(score, gradeAscending(regVol, 45, 30));
        score = Math.max(score, gradeAscending(vcw, 0.7, 0.3));
        score = Math.max(score, gradeFraction(rf));
        return score;
    }

    /**
     * PR: the MR thresholds plus jet deceleration time (<260 / <400 ms),
     * pressure half time (<100 / <200 ms) and PR index (<0.77 / <0.9). Short times and low index are worse.
     */
    public int scorePulmonaryRegurgitation(Double eroa, Double regVol, Double rf,
                                           Double decelerationTime, Double pressureHalfTime, Double prIndex) {
        int score = scoreMitralRegurgitation(eroa, regVol, rf);
        score = Math.max(score, gradeDescending(decelerationTime, 260, 400));
        score = Math.max(score, gradeDescending(pressureHalfTime, 100, 200));
        score = Math.max(score, gradeDescending(prIndex, 0.77, 0.9));
        return score;
    }

    // ========================================================================
    // Aortic stenosis
    // ========================================================================

    /**
     * Worst tier over Vmax, mean gradient, AVA and indexed AVA.
     *   Very severe: Vmax >5 or mean >60
     *   Severe:      Vmax ≥4, mean ≥40, AVA <1.0 or AVAi <0.6
     *   Moderate:    Vmax ≥3, mean ≥20, AVA ≤1.5 or AVAi ≤0.85
     *   Mild:        Vmax ≥2.5, mean ≥10 or AVA ≤2.0
     */
    public StenosisGrade gradeAorticStenosis(Double vmax, Double meanGradient, Double ava, Double avaIndexed) {
        if (gt(vmax, 5.0) || gt(meanGradient, 60)) return StenosisGrade.VERY_SEVERE;
        if (ge(vmax, 4.0) || ge(meanGradient, 40) || lt(ava, 1.0) || lt(avaIndexed, 0.6)) {
            return StenosisGrade.SEVERE;
        }
        if (ge(vmax, 3.0) || ge(meanGradient, 20) || le(ava, 1.5) || le(avaIndexed, 0.85)) {
            return StenosisGrade.MODERATE;
        }
        if (ge(vmax, 2.5) || ge(meanGradient, 10) || le(ava, 2.0)) return StenosisGrade.MILD;
        return StenosisGrade.NONE;
    }

    /**
     * Grade plus indexed values and the low-flow low-gradient pattern:
     * (AVA <1.0 or AVAi <0.6) with mean <40 mmHg and SVi ≤35 mL/m².
     */
    public AorticStenosisAssessment assessAorticStenosis(Double vmax, Double meanGradient, Double ava,
                                                         Double strokeVolume, Double bsa) {
        Double avaIndexed = BodySurfaceArea.index(ava, bsa, 2);
        Double svIndexed = BodySurfaceArea.index(strokeVolume, bsa, 1);
        StenosisGrade grade = gradeAorticStenosis(vmax, meanGradient, ava, avaIndexed);
        boolean smallArea = lt(ava, 1.0) || lt(avaIndexed, 0.6);
        boolean lowFlow = smallArea && lt(meanGradient, 40) && le(svIndexed, 35);
        return new AorticStenosisAssessment(grade, avaIndexed, svIndexed, lowFlow);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static int gradeAscending(Double value, double severe, double moderate) {
        if (value == null) return 0;
        if (value >= severe) return 3;
        if (value >= moderate) return 2;
        return 1;
    }

    private static int gradeDescending(Double value, double severeBelow, double moderateBelow) {
        if (value == null) return 0;
        if (value < severeBelow) return 3;
        if (value < moderateBelow) return 2;
        return 1;
    }

    private static int gradeFraction(Double rf) {
        if (rf == null) return 0;
        if (rf > 50) return 3;
        if (rf >= 30) return 2;
        return 1;
    }

    private static boolean gt(Double v, double limit) {
        return v != null && v > limit;
    }

    private static boolean ge(Double v, double limit) {
        return v != null && v >= limit;
    }

    private static boolean lt(Double v, double limit) {
        return v != null && v < limit;
    }

    private static boolean le(Double v, double limit) {
        return v != null && v <= limit;
    }
}
