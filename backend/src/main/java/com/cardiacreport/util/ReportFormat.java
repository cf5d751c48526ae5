package com.cardiacreport.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Number rounding and text helpers shared by the calculators and report composers.
 *
 * <p>Rounding is half-even on the exact binary value of the double, so 2.675
 * rounds to 2.67 and 0.5 rounds to 0. Report text depends on this, keep it stable.
 */
public final class ReportFormat {

    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    private ReportFormat() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Round to the given number of decimals. Null, NaN and infinite values give null.
     */
    public static Double round(Double value, int decimals) {
        if (!isFinite(value)) {
            return null;
        }
        return new BigDecimal(value).setScale(decimals, RoundingMode.HALF_EVEN).doubleValue();
    }

    /**
     * Round to the nearest whole number. Values outside the long range saturate.
     */
    public static long roundToLong(double value) {
        BigDecimal rounded = roundWhole(value);
        if (rounded.compareTo(LONG_MAX) > 0) return Long.MAX_VALUE;
        if (rounded.compareTo(LONG_MIN) < 0) return Long.MIN_VALUE;
        return rounded.longValueExact();
    }

    /**
     * Fixed-point rendering, e.g. fixed(1.0, 2) gives "1.00".
     */
    public static String fixed(double value, int decimals) {
        return new BigDecimal(value).setScale(decimals, RoundingMode.HALF_EVEN).toPlainString();
    }

    /**
     * Whole-number rendering of a measurement, e.g. 41.6 gives "42".
     */
    public static String whole(double value) {
        return roundWhole(value).toPlainString();
    }

    private static BigDecimal roundWhole(double value) {
        return new BigDecimal(value).setScale(0, RoundingMode.HALF_EVEN);
    }

    /**
     * Render a measurement the way it was entered: 10.0 stays "10.0", 12.5 stays "12.5".
     */
    public static String plain(Number value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double || value instanceof Float) {
            String text = Double.toString(value.doubleValue());
            if (text.indexOf('E') >= 0) {
                return BigDecimal.valueOf(value.doubleValue()).stripTrailingZeros().toPlainString();
            }
            return text;
        }
        return value.toString();
    }

    /**
     * Join with commas and a final "en": [a, b, c] gives "a, b en c".
     * Blank items are skipped.
     */
    public static String joinDutch(List<String> items) {
        List<String> present = items.stream()
            .filter(ReportFormat::hasText)
            .collect(Collectors.toList());
        if (present.isEmpty()) {
            return "";
        }
        if (present.size() == 1) {
            return present.get(0);
        }
        String head = String.join(", ", present.subList(0, present.size() - 1));
        return head + " en " + present.get(present.size() - 1);
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public static String orEmpty(String value) {
        return value != null ? value : "";
    }

    public static String firstNonBlank(String preferred, String fallback) {
        return hasText(preferred) ? preferred : fallback;
    }

    public static boolean isFinite(Double value) {
        return value != null && !value.isNaN() && !value.isInfinite();
    }
}
