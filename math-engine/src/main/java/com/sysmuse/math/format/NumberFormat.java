package com.sysmuse.math.format;

/**
 * How numeric results are rendered.
 */
public enum NumberFormat {
    AUTOMATIC,   // Plain for ordinary magnitudes, scientific beyond the thresholds
    SCIENTIFIC,  // Always mantissa and exponent
    PLAIN        // Thousands separators, never scientific
}
