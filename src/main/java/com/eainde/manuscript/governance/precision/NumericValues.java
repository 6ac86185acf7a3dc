package com.eainde.manuscript.governance.precision;

import java.math.BigDecimal;

/**
 * Parsing helpers for table cells.
 */
final class NumericValues {

    /** Largest decimal exponent, either direction, a cell may carry and still count as numeric. */
    static final int MAX_MAGNITUDE = 1000;

    private NumericValues() {
    }

    /**
     * Canonical text of a cell, or {@code null} when the cell is not a plain number: percent signs,
     * units and any letter other than the exponent marker disqualify it. Thousands separators are dropped.
     */
    static String normalize(Object value) {
        if (value == null || value instanceof Boolean) {
            return null;
        }
        String text = value instanceof BigDecimal decimal ? decimal.toPlainString() : String.valueOf(value).trim();
        if (text.isEmpty() || text.contains("%")) {
            return null;
        }
        text = text.replace(",", "");
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLetter(c) && c != 'e' && c != 'E') {
                return null;
            }
        }
        return text;
    }

    static BigDecimal parse(String normalized) {
        if (normalized == null) {
            return null;
        }
        try {
            BigDecimal number = new BigDecimal(normalized);
            if (Math.abs((long) number.precision() - number.scale()) > MAX_MAGNITUDE
                    || Math.abs((long) number.scale()) > MAX_MAGNITUDE) {
                return null;
            }
            return number;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Decimal places written in the mantissa, e.g. 2 for {@code 1.25e3}. */
    static int decimalPlaces(String normalized) {
        String mantissa = normalized.split("[eE]", 2)[0];
        int dot = mantissa.indexOf('.');
        return dot < 0 ? 0 : mantissa.length() - dot - 1;
    }

    /** Significant digits ignoring trailing zeros; zero counts as one digit. */
    static int significantDigits(BigDecimal number) {
        if (number.signum() == 0) {
            return 1;
        }
        return number.stripTrailingZeros().precision();
    }
}
