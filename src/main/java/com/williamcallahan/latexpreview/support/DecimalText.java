package com.williamcallahan.latexpreview.support;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Locale-independent number rendering for generated TikZ and CSS values.
 */
public final class DecimalText {

    private static final int MAX_FRACTION_DIGITS = 4;

    private DecimalText() {
    }

    /**
     * Renders {@code value} with at most four fraction digits and no trailing zeros ({@code 5}, {@code 0.85}).
     *
     * @param value finite number
     * @return plain decimal text
     */
    public static String plain(double value) {
        if (!Double.isFinite(value)) {
            return "0";
        }
        BigDecimal rounded = BigDecimal.valueOf(value).setScale(MAX_FRACTION_DIGITS, RoundingMode.HALF_UP).stripTrailingZeros();
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.toPlainString();
    }

    /**
     * Renders {@code value} with exactly {@code digits} fraction digits.
     */
    public static String fixed(double value, int digits) {
        return String.format(Locale.ROOT, "%." + digits + "f", value);
    }
}
