package com.sysmuse.math.numeric;

import java.math.BigInteger;

/**
 * Counting functions used by the numeric parser.
 */
public final class Combinatorics {

    /** Largest n accepted by {@link #factorial(int)}. */
    public static final int MAX_FACTORIAL = 1000;

    /** Largest r accepted by {@link #permutation} and, after r is folded to min(r, n-r), {@link #combination}. */
    public static final long MAX_TERMS = 10_000;

    private Combinatorics() {
    }

    public static BigInteger factorial(int n) {
        if (n > MAX_FACTORIAL) {
            throw new NumericParseException("Factorial argument too large: " + n);
        }
        BigInteger result = BigInteger.ONE;
        for (int i = 2; i <= n; i++) {
            result = result.multiply(BigInteger.valueOf(i));
        }
        return result;
    }

    /**
     * nPr as a double; 0 when r is out of range.
     */
    public static double permutation(long n, long r) {
        if (r > n || r < 0 || n < 0) return 0;
        checkTerms(r);

        double result = 1;
        for (long i = 0; i < r && !Double.isInfinite(result); i++) {
            result *= (n - i);
        }
        return result;
    }

    /**
     * nCr as a double; 0 when r is out of range.
     */
    public static double combination(long n, long r) {
        if (r > n || r < 0 || n < 0) return 0;

        if (r > n - r) {
            r = n - r;
        }
        checkTerms(r);

        double result = 1;
        for (long i = 0; i < r && !Double.isInfinite(result); i++) {
            result *= (n - i);
            result /= (i + 1);
        }
        return result;
    }

    private static void checkTerms(long r) {
        if (r > MAX_TERMS) {
            throw new NumericParseException("Too many terms for nPr/nCr: " + r);
        }
    }
}
