package com.sysmuse.math.format;

import java.util.Objects;

/**
 * Immutable formatting parameters handed to every formatting call.
 */
public final class FormatSettings {

    public static final int MIN_PRECISION = 0;
    public static final int MAX_PRECISION = 16;
    public static final int DEFAULT_PRECISION = 6;

    private static final FormatSettings DEFAULTS =
            new FormatSettings(DEFAULT_PRECISION, NumberFormat.AUTOMATIC, ThresholdProfile.EXTENDED);

    private final int precision;
    private final NumberFormat numberFormat;
    private final double upperThreshold;
    private final double lowerThreshold;

    public FormatSettings(int precision, NumberFormat numberFormat, ThresholdProfile profile) {
        this(precision, numberFormat, profile.getUpper(), profile.getLower());
    }

    public FormatSettings(int precision, NumberFormat numberFormat, double upperThreshold, double lowerThreshold) {
        if (precision < MIN_PRECISION || precision > MAX_PRECISION) {
            throw new IllegalArgumentException("Precision must be between " + MIN_PRECISION
                    + " and " + MAX_PRECISION + ": " + precision);
        }
        if (upperThreshold <= 0 || lowerThreshold <= 0 || lowerThreshold >= upperThreshold) {
            throw new IllegalArgumentException("Invalid thresholds: upper=" + upperThreshold
                    + ", lower=" + lowerThreshold);
        }
        this.precision = precision;
        this.numberFormat = Objects.requireNonNull(numberFormat, "numberFormat");
        this.upperThreshold = upperThreshold;
        this.lowerThreshold = lowerThreshold;
    }

    public static FormatSettings defaults() {
        return DEFAULTS;
    }

    public FormatSettings withPrecision(int newPrecision) {
        return new FormatSettings(newPrecision, numberFormat, upperThreshold, lowerThreshold);
    }

    public FormatSettings withNumberFormat(NumberFormat newFormat) {
        return new FormatSettings(precision, newFormat, upperThreshold, lowerThreshold);
    }

    public FormatSettings withThresholds(ThresholdProfile profile) {
        return new FormatSettings(precision, numberFormat, profile.getUpper(), profile.getLower());
    }

    public int getPrecision() {
        return precision;
    }

    public NumberFormat getNumberFormat() {
        return numberFormat;
    }

    public double getUpperThreshold() {
        return upperThreshold;
    }

    public double getLowerThreshold() {
        return lowerThreshold;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FormatSettings)) return false;
        FormatSettings that = (FormatSettings) o;
        return precision == that.precision
                && numberFormat == that.numberFormat
                && Double.compare(upperThreshold, that.upperThreshold) == 0
                && Double.compare(lowerThreshold, that.lowerThreshold) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(precision, numberFormat, upperThreshold, lowerThreshold);
    }

    @Override
    public String toString() {
        return "FormatSettings{precision=" + precision + ", numberFormat=" + numberFormat
                + ", upper=" + upperThreshold + ", lower=" + lowerThreshold + "}";
    }
}
