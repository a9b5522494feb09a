package com.sysmuse.math.format;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Renders doubles and complex values according to a {@link FormatSettings}.
 */
public class NumberFormatter {

    public static final String SMALL_CAPS_E = "ᴇ";
    public static final String INFINITY = "∞";

    private static final double ZERO_CUTOFF = 1e-30;
    private static final double INTEGER_TOLERANCE = 1e-10;

    private final FormatSettings settings;

    public NumberFormatter(FormatSettings settings) {
        this.settings = settings;
    }

    public FormatSettings getSettings() {
        return settings;
    }

    public String format(double value) {
        if (Double.isNaN(value)) return "NaN";
        if (Double.isInfinite(value)) return value > 0 ? INFINITY : "-" + INFINITY;

        // Physical constants are tiny but not zero, so the cutoff sits far below them
        if (Math.abs(value) < ZERO_CUTOFF) {
            return "0";
        }

        switch (settings.getNumberFormat()) {
            case SCIENTIFIC:
                return formatScientific(value);
            case PLAIN:
                return formatPlain(value);
            case AUTOMATIC:
            default:
                return formatAutomatic(value);
        }
    }

    /**
     * Format a complex value as {@code a + bi}, {@code a - bi}, {@code bi}, {@code i} or {@code -i}.
     */
    public String formatComplex(double real, double imag) {
        if (Math.abs(imag) < INTEGER_TOLERANCE) {
            return format(real);
        }

        if (Math.abs(real) < INTEGER_TOLERANCE) {
            if (Math.abs(imag - 1) < INTEGER_TOLERANCE) return "i";
            if (Math.abs(imag + 1) < INTEGER_TOLERANCE) return "-i";
            return format(imag) + "i";
        }

        String realStr = format(real);
        String imagStr = format(Math.abs(imag));

        if (imag >= 0) {
            if (Math.abs(imag - 1) < INTEGER_TOLERANCE) return realStr + " + i";
            return realStr + " + " + imagStr + "i";
        }
        if (Math.abs(imag + 1) < INTEGER_TOLERANCE) return realStr + " - i";
        return realStr + " - " + imagStr + "i";
    }

    private String formatAutomatic(double value) {
        double abs = Math.abs(value);
        if (abs >= settings.getUpperThreshold() || (abs <= settings.getLowerThreshold() && abs > 0)) {
            return formatScientific(value);
        }

        if (isNearInteger(value)) {
            return integerString(value);
        }

        return fixed(value);
    }

    private String formatPlain(double value) {
        if (isNearInteger(value)) {
            return addCommas(integerString(value));
        }

        String formatted = fixed(value);
        int dot = formatted.indexOf('.');
        if (dot < 0) {
            return addCommas(formatted);
        }
        return addCommas(formatted.substring(0, dot)) + formatted.substring(dot);
    }

    private String formatScientific(double value) {
        String expStr = String.format(Locale.ROOT, "%." + settings.getPrecision() + "e", value);

        int marker = expStr.toLowerCase(Locale.ROOT).indexOf('e');
        String mantissa = stripTrailingZeros(expStr.substring(0, marker));
        int exponent = Integer.parseInt(expStr.substring(marker + 1));

        if (exponent == 0) {
            return mantissa;
        }
        return mantissa + SMALL_CAPS_E + exponent;
    }

    private String fixed(double value) {
        String formatted = new BigDecimal(value)
                .setScale(settings.getPrecision(), RoundingMode.HALF_UP)
                .toPlainString();
        formatted = stripTrailingZeros(formatted);
        return "-0".equals(formatted) ? "0" : formatted;
    }

    static boolean isNearInteger(double value) {
        return Math.abs(value - Math.rint(value)) < INTEGER_TOLERANCE;
    }

    static String integerString(double value) {
        return BigDecimal.valueOf(Math.rint(value)).toBigInteger().toString();
    }

    static String stripTrailingZeros(String number) {
        if (!number.contains(".")) {
            return number;
        }
        String result = number.replaceAll("0+$", "");
        if (result.endsWith(".")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    static String addCommas(String digits) {
        boolean negative = digits.startsWith("-");
        String body = negative ? digits.substring(1) : digits;

        StringBuilder result = new StringBuilder();
        int count = 0;
        for (int i = body.length() - 1; i >= 0; i--) {
            if (count > 0 && count % 3 == 0) {
                result.append(',');
            }
            result.append(body.charAt(i));
            count++;
        }
        result.reverse();
        return negative ? "-" + result : result.toString();
    }
}
