package com.sysmuse.math.node;

import java.util.Objects;

/**
 * Named physical or mathematical constant: π, e, ε₀, μ₀, c₀, e⁻.
 */
public final class ConstantNode extends MathNode {

    private final String constant;

    public ConstantNode(String constant) {
        this.constant = constant == null ? "" : constant;
    }

    public String getConstant() {
        return constant;
    }

    @Override
    public String getType() {
        return "constant";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConstantNode)) return false;
        return constant.equals(((ConstantNode) o).constant);
    }

    @Override
    public int hashCode() {
        return Objects.hash("constant", constant);
    }

    @Override
    public String toString() {
        return "Const(" + constant + ")";
    }
}
