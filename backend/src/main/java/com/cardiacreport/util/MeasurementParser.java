package com.cardiacreport.util;

/**
 * Lenient parsing of free-text measurement fields.
 *
 * <p>Blank or malformed text is treated as a missing measurement and yields null.
 * Both "12.5" and "12,5" are accepted.
 */
public final class MeasurementParser {

    private MeasurementParser() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    public static Double parseDouble(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            double value = Double.parseDouble(trimmed.replace(',', '.'));
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return null;
            }
            return value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Parse to an integer, truncating any fraction ("95.7" gives 95).
     */
    public static Integer parseInteger(String text) {
        Double value = parseDouble(text);
        return value != null ? (int) value.doubleValue() : null;
    }

    /**
     * Central venous pressure estimate from the enumerated choices "3", "8" and "15+".
     * Unparsable text counts as 0 mmHg.
     */
    public static double parseCvd(String cvd) {
        if (cvd == null) {
            return 0.0;
        }
        String trimmed = cvd.trim();
        while (trimmed.endsWith("+")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        Double value = parseDouble(trimmed);
        return value != null ? value : 0.0;
    }
}
