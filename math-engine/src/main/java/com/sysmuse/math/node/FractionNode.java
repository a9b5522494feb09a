package com.sysmuse.math.node;

import java.util.List;
import java.util.Objects;

/**
 * Stacked fraction.
 */
public final class FractionNode extends MathNode {

    private final List<MathNode> numerator;
    private final List<MathNode> denominator;

    public FractionNode(List<MathNode> numerator, List<MathNode> denominator) {
        this.numerator = slot(numerator);
        this.denominator = slot(denominator);
    }

    public List<MathNode> getNumerator() {
        return numerator;
    }

    public List<MathNode> getDenominator() {
        return denominator;
    }

    @Override
    public String getType() {
        return "fraction";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FractionNode)) return false;
        FractionNode other = (FractionNode) o;
        return numerator.equals(other.numerator) && denominator.equals(other.denominator);
    }

    @Override
    public int hashCode() {
        return Objects.hash("fraction", numerator, denominator);
    }

    @Override
    public String toString() {
        return "Fraction(" + numerator + ", " + denominator + ")";
    }
}
