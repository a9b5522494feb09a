package com.sysmuse.math.node;

import java.util.List;
import java.util.Objects;

/**
 * Definite integral of the body with respect to the bound variable.
 */
public final class IntegralNode extends MathNode {

    private final List<MathNode> variable;
    private final List<MathNode> lower;
    private final List<MathNode> upper;
    private final List<MathNode> body;

    public IntegralNode(List<MathNode> variable, List<MathNode> lower, List<MathNode> upper, List<MathNode> body) {
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
        return "integral";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntegralNode)) return false;
        IntegralNode other = (IntegralNode) o;
        return variable.equals(other.variable) && lower.equals(other.lower)
                && upper.equals(other.upper) && body.equals(other.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash("integral", variable, lower, upper, body);
    }

    @Override
    public String toString() {
        return "Integral(" + variable + ", " + lower + ", " + upper + ", " + body + ")";
    }
}
