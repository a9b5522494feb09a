package com.sysmuse.math.format;

import java.math.BigInteger;

/**
 * Formats exact integers for rendered results. Very large values always
 * switch to scientific form; whole-number results follow the SCIENTIFIC setting.
 */
public final class ExactNumberFormatter {

    public static final BigInteger SCIENTIFIC_THRESHOLD = BigInteger.TEN.pow(15);

    static final String MINUS_SIGN = "−";

    private ExactNumberFormatter() {
    }

    public static String formatBigInteger(BigInteger value, boolean isWholeNumber, FormatSettings settings) {
        BigInteger absVal = value.abs();
        boolean useScientific = false;

        if (absVal.compareTo(SCIENTIFIC_THRESHOLD) >= 0) {
            useScientific = true;
        } else if (isWholeNumber && settings.getNumberFormat() == NumberFormat.SCIENTIFIC
                && absVal.signum() > 0) {
            useScientific = true;
        }

        if (!useScientific) {
            return value.toString();
        }

        String digits = absVal.toString();
        if (digits.length() <= 1) {
            return value.toString();
        }

        int p = settings.getPrecision();
        int exponent = digits.length() - 1;

        // Keep p + 1 significant digits, rounding half up
        if (digits.length() > p + 1) {
            String prefix = digits.substring(0, p + 1);
            int nextDigit = digits.charAt(p + 1) - '0';
            if (nextDigit >= 5) {
                String rounded = new BigInteger(prefix).add(BigInteger.ONE).toString();
                if (rounded.length() > prefix.length()) {
                    exponent += 1;
                }
                digits = rounded;
            } else {
                digits = prefix;
            }
        }

        String mantissa = digits.substring(0, 1);
        String rest = digits.substring(1).replaceAll("0+$", "");
        if (!rest.isEmpty()) {
            mantissa += "." + rest;
        }

        String result = mantissa + NumberFormatter.SMALL_CAPS_E + exponent;
        return value.signum() < 0 ? MINUS_SIGN + result : result;
    }
}
