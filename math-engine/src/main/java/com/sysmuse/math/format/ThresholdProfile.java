package com.sysmuse.math.format;

/**
 * Magnitude bounds at which AUTOMATIC formatting switches to scientific notation.
 */
public enum ThresholdProfile {
    SIMPLE(1e6, 1e-6),
    EXTENDED(1e12, 1e-4);

    private final double upper;
    private final double lower;

    ThresholdProfile(double upper, double lower) {
        this.upper = upper;
        this.lower = lower;
    }

    public double getUpper() {
        return upper;
    }

    public double getLower() {
        return lower;
    }
}
