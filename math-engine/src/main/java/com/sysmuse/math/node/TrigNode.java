package com.sysmuse.math.node;

import java.util.List;
import java.util.Objects;

/**
 * Named single-argument function: sin, cos, tan, their inverse and
 * hyperbolic forms, and abs.
 */
public final class TrigNode extends MathNode {

    private final String function;
    private final List<MathNode> argument;

    public TrigNode(String function, List<MathNode> argument) {
        this.function = function == null ? "sin" : function;
        this.argument = slot(argument);
    }

    public String getFunction() {
        return function;
    }

    public List<MathNode> getArgument() {
        return argument;
    }

    @Override
    public String getType() {
        return "trig";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TrigNode)) return false;
        TrigNode other = (TrigNode) o;
        return function.equals(other.function) && argument.equals(other.argument);
    }

    @Override
    public int hashCode() {
        return Objects.hash("trig", function, argument);
    }

    @Override
    public String toString() {
        return function + "(" + argument + ")";
    }
}
