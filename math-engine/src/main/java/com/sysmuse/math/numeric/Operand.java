package com.sysmuse.math.numeric;

/**
 * Intermediate parser value: a number, possibly tagged with a trailing {@code %}.
 */
final class Operand {

    private final Complex value;
    private final boolean percent;

    private Operand(Complex value, boolean percent) {
        this.value = value;
        this.percent = percent;
    }

    static Operand of(Complex value) {
        return new Operand(value, false);
    }

    static Operand percent(Complex value) {
        return new Operand(value, true);
    }

    boolean isPercent() {
        return percent;
    }

    /**
     * The raw value, ignoring any percent tag.
     */
    Complex raw() {
        return value;
    }

    /**
     * The value as a plain number; a percent becomes value/100.
     */
    Complex resolve() {
        return percent ? value.scale(0.01) : value;
    }

    /**
     * This percentage taken of the given base, e.g. 20% of 50 is 10.
     */
    Complex percentOf(Complex base) {
        return base.times(value.scale(0.01));
    }

    Operand negate() {
        return new Operand(value.negate(), percent);
    }
}
