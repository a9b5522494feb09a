package com.sysmuse.math.node;

import java.util.Objects;

/**
 * Unit vector along an axis, rendered as e with the axis subscript.
 */
public final class UnitVectorNode extends MathNode {

    private final String axis;

    public UnitVectorNode(String axis) {
        this.axis = axis == null || axis.isEmpty() ? "x" : axis;
    }

    public String getAxis() {
        return axis;
    }

    @Override
    public String getType() {
        return "unit_vector";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnitVectorNode)) return false;
        return axis.equals(((UnitVectorNode) o).axis);
    }

    @Override
    public int hashCode() {
        return Objects.hash("unit_vector", axis);
    }

    @Override
    public String toString() {
        return "e_" + axis;
    }
}
