package com.askdata.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Formats cell values as labels and computed numbers for plain-text output.
 */
public final class ValueFormat {
    private static final int MAX_FRACTION_DIGITS = 4;

    private ValueFormat() {
    }

    /**
     * Renders a number with at most four fraction digits and no trailing zeros.
     *
     * @param v number
     * @return text form, {@code "undefined"} for NaN or infinity
     */
    public static String number(double v) {
        if (!Double.isFinite(v)) {
            return "undefined";
        }
        BigDecimal bd = BigDecimal.valueOf(v).setScale(MAX_FRACTION_DIGITS, RoundingMode.HALF_UP).stripTrailingZeros();
        if (bd.signum() == 0) {
            return "0";
        }
        return bd.toPlainString();
    }

    /**
     * Renders a dataset cell as a label. Decimals keep full precision so distinct values never
     * share a label.
     *
     * @param cell cell value
     * @return label text, null for a missing cell
     */
    public static String label(Object cell) {
        if (cell == null) {
            return null;
        }
        if (cell instanceof Double d) {
            return exact(d);
        }
        if (cell instanceof Float f) {
            return exact(f.doubleValue());
        }
        return String.valueOf(cell);
    }

    private static String exact(double v) {
        if (!Double.isFinite(v)) {
            return "undefined";
        }
        BigDecimal bd = BigDecimal.valueOf(v).stripTrailingZeros();
        if (bd.signum() == 0) {
            return "0";
        }
        return bd.toPlainString();
    }
}
