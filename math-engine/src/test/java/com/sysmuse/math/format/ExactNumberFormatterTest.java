package com.sysmuse.math.format;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class ExactNumberFormatterTest {

    @Test
    public void testSmallIntegersStayPlain() {
        assertEquals("123456", ExactNumberFormatter.formatBigInteger(BigInteger.valueOf(123456), true,
                FormatSettings.defaults()));
        assertEquals("-42", ExactNumberFormatter.formatBigInteger(BigInteger.valueOf(-42), false,
                FormatSettings.defaults()));
    }

    @Test
    public void testLargeIntegersUseScientific() {
        assertEquals("1ᴇ15", ExactNumberFormatter.formatBigInteger(BigInteger.TEN.pow(15), false,
                FormatSettings.defaults()));
        assertEquals("−1.234568ᴇ15", ExactNumberFormatter.formatBigInteger(new BigInteger("-1234567890123456"),
                false, FormatSettings.defaults()));
    }

    @Test
    public void testScientificSettingAppliesToWholeNumbers() {
        FormatSettings scientific = FormatSettings.defaults().withNumberFormat(NumberFormat.SCIENTIFIC);
        assertEquals("1.2ᴇ3", ExactNumberFormatter.formatBigInteger(BigInteger.valueOf(1200), true, scientific));
        assertEquals("1200", ExactNumberFormatter.formatBigInteger(BigInteger.valueOf(1200), false, scientific));
    }
}
