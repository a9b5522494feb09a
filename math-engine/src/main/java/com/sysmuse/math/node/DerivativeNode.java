package com.sysmuse.math.node;

import java.util.List;
import java.util.Objects;

/**
 * Derivative of the body with respect to the bound variable, evaluated at a point.
 */
public final class DerivativeNode extends MathNode {

    private final List<MathNode> variable;
    private final List<MathNode> at;
    private final List<MathNode> body;

    public DerivativeNode(List<MathNode> variable, List<MathNode> at, List<MathNode> body) {
        this.variable = slot(variable);
        this.at = slot(at);
        this.body = slot(body);
    }

    public List<MathNode> getVariable() {
        return variable;
    }

    public List<MathNode> getAt() {
        return at;
    }

    public List<MathNode> getBody() {
        return body;
    }

    @Override
    public String getType() {
        return "derivative";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DerivativeNode)) return false;
        DerivativeNode other = (DerivativeNode) o;
        return variable.equals(other.variable) && at.equals(other.at) && body.equals(other.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash("derivative", variable, at, body);
    }

    @Override
    public String toString() {
        return "Derivative(" + variable + ", " + at + ", " + body + ")";
    }
}
