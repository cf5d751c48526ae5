package com.cardiacreport.util;

/**
 * Body surface area (Mosteller) and BSA indexing.
 */
public final class BodySurfaceArea {

    private BodySurfaceArea() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Mosteller: sqrt(length_cm * weight_kg / 3600). Returns null unless both inputs are positive.
     */
    public static Double mosteller(Double lengthCm, Double weightKg) {
        if (lengthCm == null || weightKg == null || lengthCm <= 0 || weightKg <= 0) {
            return null;
        }
        return Math.sqrt(lengthCm * weightKg / 3600.0);
    }

    public static boolean isUsable(Double bsa) {
        return bsa != null && bsa > 0;
    }

    /**
     * Value divided by BSA, rounded to the given decimals. Null when either input is missing or BSA is not positive.
     */
    public static Double index(Double value, Double bsa, int decimals) {
        if (value == null || !isUsable(bsa)) {
            return null;
        }
        return ReportFormat.round(value / bsa, decimals);
    }
}
