package com.sysmuse.math.numeric;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class CombinatoricsTest {

    @Test
    public void testFactorial() {
        assertEquals(BigInteger.ONE, Combinatorics.factorial(0));
        assertEquals(new BigInteger("2432902008176640000"), Combinatorics.factorial(20));
        assertThrows(NumericParseException.class, () -> Combinatorics.factorial(Combinatorics.MAX_FACTORIAL + 1));
    }

    @Test
    public void testPermutationsAndCombinations() {
        assertEquals(20.0, Combinatorics.permutation(5, 2));
        assertEquals(10.0, Combinatorics.combination(5, 2));
        assertEquals(1.0, Combinatorics.combination(5, 0));
        assertEquals(0.0, Combinatorics.combination(5, 6));
        assertEquals(0.0, Combinatorics.permutation(3, -1));
    }

    @Test
    public void testTermLimit() {
        assertThrows(NumericParseException.class,
                () -> Combinatorics.permutation(20_000_000_000L, 20_000_000_000L));
        assertThrows(NumericParseException.class,
                () -> Combinatorics.combination(40_000, 20_000));
        assertEquals(1.0, Combinatorics.combination(20_000_000_000L, 20_000_000_000L));
        assertTrue(Double.isInfinite(Combinatorics.permutation(5000, 5000)));
    }
}
