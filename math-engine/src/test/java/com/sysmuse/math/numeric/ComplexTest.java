package com.sysmuse.math.numeric;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ComplexTest {

    private static final double EPS = 1e-12;

    @Test
    public void testArithmetic() {
        Complex a = new Complex(1, 2);
        Complex b = new Complex(3, -1);

        assertEquals(new Complex(4, 1), a.plus(b));
        assertEquals(new Complex(5, 5), a.times(b));
        Complex quotient = a.times(b).dividedBy(b);
        assertEquals(1, quotient.getReal(), EPS);
        assertEquals(2, quotient.getImag(), EPS);
    }

    @Test
    public void testDemoteDropsTinyImaginaryPart() {
        Complex almostReal = new Complex(2, 1e-12).demote();
        assertTrue(almostReal.isReal());
        assertEquals(2, almostReal.getReal(), EPS);
        assertFalse(new Complex(2, 1e-3).demote().isReal());
    }

    @Test
    public void testSquareRootOfNegativeOne() {
        Complex root = Complex.ofReal(-1).sqrt();
        assertEquals(0, root.getReal(), EPS);
        assertEquals(1, root.getImag(), EPS);
    }

    @Test
    public void testEulerIdentity() {
        Complex value = Complex.I.scale(Math.PI).exp();
        assertEquals(-1, value.getReal(), EPS);
        assertEquals(0, value.getImag(), EPS);
    }
}
