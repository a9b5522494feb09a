package com.sysmuse.math.node;

import java.util.List;
import java.util.Objects;

/**
 * Σ over an integer range of the bound variable.
 */
public final class SummationNode extends MathNode {

    private final List<MathNode> variable;
    private final List<MathNode> lower;
    private final List<MathNode> upper;
    private final List<MathNode> body;

    public SummationNode(List<MathNode> variable, List<MathNode> lower, List<MathNode> upper, List<MathNode> body) {
        this.variable = slot(variable);
        this.lower = slot(lower);
        this.upper = slot(upper);
        this.body = slot(body);
    }

    public List<MathNode> getVariable() {
        return variable;
    }

    public List<MathNode> getLower() {
        return lower;
    }

    public List<MathNode> getUpper() {
        return upper;
    }

    public List<MathNode> getBody() {
        return body;
    }

    @Override
    public String getType() {
        return "summation";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SummationNode)) return false;
        SummationNode other = (SummationNode) o;
        return variable.equals(other.variable) && lower.equals(other.lower)
                && upper.equals(other.upper) && body.equals(other.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash("summation", variable, lower, upper, body);
    }

    @Override
    public String toString() {
        return "Summation(" + variable + ", " + lower + ", " + upper + ", " + body + ")";
    }
}
