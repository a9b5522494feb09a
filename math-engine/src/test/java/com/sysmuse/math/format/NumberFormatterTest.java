package com.sysmuse.math.format;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NumberFormatterTest {

    private NumberFormatter automatic;

    @BeforeEach
    public void setup() {
        automatic = new NumberFormatter(FormatSettings.defaults());
    }

    @Test
    public void testThresholdProfiles() {
        NumberFormatter simple = new NumberFormatter(FormatSettings.defaults().withThresholds(ThresholdProfile.SIMPLE));

        assertEquals("1.234567ᴇ6", simple.format(1234567));
        assertEquals("1234567", automatic.format(1234567));
        assertEquals("1ᴇ-7", simple.format(0.0000001));
        assertEquals("1ᴇ-7", automatic.format(0.0000001));
    }

    @Test
    public void testAutomaticFixedPoint() {
        assertEquals("14", automatic.format(14.0));
        assertEquals("0.3", automatic.format(0.1 + 0.2));
        assertEquals("0.333333", automatic.format(1.0 / 3));
        assertEquals("-2.5", automatic.format(-2.5));
        assertEquals("0", automatic.format(1e-31));
    }

    @Test
    public void testSpecialValues() {
        assertEquals("NaN", automatic.format(Double.NaN));
        assertEquals("∞", automatic.format(Double.POSITIVE_INFINITY));
        assertEquals("-∞", automatic.format(Double.NEGATIVE_INFINITY));
    }

    @Test
    public void testScientificFormat() {
        NumberFormatter scientific = new NumberFormatter(FormatSettings.defaults().withNumberFormat(NumberFormat.SCIENTIFIC));

        assertEquals("1.5ᴇ3", scientific.format(1500));
        assertEquals("5", scientific.format(5));
        assertEquals("-2.5ᴇ-3", scientific.format(-0.0025));
    }

    @Test
    public void testPlainFormatUsesSeparators() {
        NumberFormatter plain = new NumberFormatter(FormatSettings.defaults().withNumberFormat(NumberFormat.PLAIN));

        assertEquals("1,234,567", plain.format(1234567));
        assertEquals("1,234,567.5", plain.format(1234567.5));
        assertEquals("-1,000", plain.format(-1000));
        assertEquals("100,000,000,000,000,000,000", plain.format(1e20));
    }

    @Test
    public void testPrecisionLimitsDecimals() {
        NumberFormatter twoDigits = new NumberFormatter(FormatSettings.defaults().withPrecision(2));
        assertEquals("3.14", twoDigits.format(Math.PI));
    }

    @Test
    public void testComplexFormatting() {
        assertEquals("i", automatic.formatComplex(0, 1));
        assertEquals("-i", automatic.formatComplex(0, -1));
        assertEquals("2i", automatic.formatComplex(0, 2));
        assertEquals("2 + i", automatic.formatComplex(2, 1));
        assertEquals("3 - 2i", automatic.formatComplex(3, -2));
        assertEquals("4", automatic.formatComplex(4, 1e-12));
    }

    @Test
    public void testInvalidSettingsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new FormatSettings(17, NumberFormat.AUTOMATIC, ThresholdProfile.EXTENDED));
        assertThrows(IllegalArgumentException.class,
                () -> new FormatSettings(6, NumberFormat.AUTOMATIC, 1e-6, 1e6));
    }
}
