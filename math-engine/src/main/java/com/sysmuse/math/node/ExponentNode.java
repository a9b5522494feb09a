package com.sysmuse.math.node;

import java.util.List;
import java.util.Objects;

/**
 * Base raised to a superscript power.
 */
public final class ExponentNode extends MathNode {

    private final List<MathNode> base;
    private final List<MathNode> power;

    public ExponentNode(List<MathNode> base, List<MathNode> power) {
        this.base = slot(base);
        this.power = slot(power);
    }

    public List<MathNode> getBase() {
        return base;
    }

    public List<MathNode> getPower() {
        return power;
    }

    @Override
    public String getType() {
        return "exponent";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExponentNode)) return false;
        ExponentNode other = (ExponentNode) o;
        return base.equals(other.base) && power.equals(other.power);
    }

    @Override
    public int hashCode() {
        return Objects.hash("exponent", base, power);
    }

    @Override
    public String toString() {
        return "Exponent(" + base + ", " + power + ")";
    }
}
