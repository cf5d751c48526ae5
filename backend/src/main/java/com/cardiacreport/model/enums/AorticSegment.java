package com.cardiacreport.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Aortic root and ascending aorta segments.
 *
 * Each segment carries the coefficients of its predicted lower and upper
 * diameter formula (intercept, age, male, height cm, weight kg) and the
 * BSA-indexed cutoff above which the segment is reported as dilated.
 */
public enum AorticSegment {
    AOA("AoA", "Aorta annulus",
        new double[] {10.828, 0.001, 0.871, 0.013, 0.020},
        new double[] {14.970, 0.020, 1.278, 0.037, 0.034},
        14.0),
    AOSV("AoSV", "Aorta sinus valsalva",
        new double[] {3.483, 0.086, 1.731, 0.062, 0.036},
        new double[] {12.129, 0.125, 2.589, 0.113, 0.065},
        20.0),
    AOSTJ("AoSTJ", "Aorta sinotubulaire junctie",
        new double[] {0.600, 0.061, 0.707, 0.056, 0.026},
        new double[] {8.562, 0.097, 1.499, 0.103, 0.054},
        16.0),
    ASCAO("AscAo", "Aorta ascendens",
        new double[] {8.189, 0.041, 0.655, -0.007, 0.040},
        new double[] {21.214, 0.101, 1.961, 0.069, 0.087},
        17.0);

    private final String abbreviation;
    private final String description;
    private final double[] lowerCoefficients;
    private final double[] upperCoefficients;
    private final double indexCutoff;

    AorticSegment(String abbreviation, String description,
                  double[] lowerCoefficients, double[] upperCoefficients, double indexCutoff) {
        this.abbreviation = abbreviation;
        this.description = description;
        this.lowerCoefficients = lowerCoefficients;
        this.upperCoefficients = upperCoefficients;
        this.indexCutoff = indexCutoff;
    }

    @JsonValue
    public String getAbbreviation() {
        return abbreviation;
    }

    public String getDescription() {
        return description;
    }

    /** Dilation cutoff in mm/m². */
    public double getIndexCutoff() {
        return indexCutoff;
    }

    public double predictLower(double age, boolean male, double heightCm, double weightKg) {
        return evaluate(lowerCoefficients, age, male, heightCm, weightKg);
    }

    public double predictUpper(double age, boolean male, double heightCm, double weightKg) {
        return evaluate(upperCoefficients, age, male, heightCm, weightKg);
    }

    private static double evaluate(double[] c, double age, boolean male, double heightCm, double weightKg) {
        return c[0] + c[1] * age + c[2] * (male ? 1 : 0) + c[3] * heightCm + c[4] * weightKg;
    }
}
