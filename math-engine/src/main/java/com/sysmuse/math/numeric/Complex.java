package com.sysmuse.math.numeric;

import java.util.Objects;

/**
 * Immutable complex number. A value with a zero imaginary part is treated as real
 * by the parser, so arithmetic results are demoted once |imag| drops below 1e-10.
 */
public final class Complex {

    static final double DEMOTION_TOLERANCE = 1e-10;

    public static final Complex ZERO = new Complex(0, 0);
    public static final Complex I = new Complex(0, 1);

    private final double real;
    private final double imag;

    public Complex(double real, double imag) {
        this.real = real;
        this.imag = imag;
    }

    public static Complex ofReal(double real) {
        return new Complex(real, 0);
    }

    public double getReal() {
        return real;
    }

    public double getImag() {
        return imag;
    }

    public boolean isReal() {
        return imag == 0;
    }

    /**
     * Drop a negligible imaginary part.
     */
    public Complex demote() {
        if (imag != 0 && Math.abs(imag) < DEMOTION_TOLERANCE) {
            return ofReal(real);
        }
        return this;
    }

    public Complex plus(Complex other) {
        return new Complex(real + other.real, imag + other.imag);
    }

    public Complex minus(Complex other) {
        return new Complex(real - other.real, imag - other.imag);
    }

    public Complex times(Complex other) {
        return new Complex(real * other.real - imag * other.imag,
                real * other.imag + imag * other.real);
    }

    public Complex dividedBy(Complex other) {
        double denom = other.real * other.real + other.imag * other.imag;
        return new Complex((real * other.real + imag * other.imag) / denom,
                (imag * other.real - real * other.imag) / denom);
    }

    public Complex scale(double factor) {
        return new Complex(real * factor, imag * factor);
    }

    public Complex negate() {
        return new Complex(-real, -imag);
    }

    public double magnitude() {
        return Math.hypot(real, imag);
    }

    public double phase() {
        return Math.atan2(imag, real);
    }

    public Complex exp() {
        double expReal = Math.exp(real);
        return new Complex(expReal * Math.cos(imag), expReal * Math.sin(imag));
    }

    public Complex ln() {
        return new Complex(Math.log(magnitude()), phase());
    }

    public Complex sqrt() {
        double sqrtR = Math.sqrt(magnitude());
        double theta = phase();
        return new Complex(sqrtR * Math.cos(theta / 2), sqrtR * Math.sin(theta / 2));
    }

    /**
     * z^w = e^(w·ln z), with 0^w = 0.
     */
    public Complex pow(Complex exponent) {
        if (real == 0 && imag == 0) {
            return ZERO;
        }
        return exponent.times(ln()).exp();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Complex complex = (Complex) o;
        return Double.compare(complex.real, real) == 0 && Double.compare(complex.imag, imag) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(real, imag);
    }

    @Override
    public String toString() {
        return imag >= 0 ? real + " + " + imag + "i" : real + " - " + (-imag) + "i";
    }
}
