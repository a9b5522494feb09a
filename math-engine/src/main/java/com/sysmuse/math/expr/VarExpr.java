package com.sysmuse.math.expr;

import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.node.LiteralNode;
import com.sysmuse.math.node.MathNode;

import java.util.List;
import java.util.Set;

/**
 * Free variable such as x, or an unresolved ans reference.
 */
public final class VarExpr extends Expr {

    private final String name;

    public VarExpr(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public Expr simplify() {
        return this;
    }

    @Override
    public double toDouble() {
        throw new UnsupportedOperationException("Cannot convert variable " + name + " to a number");
    }

    @Override
    public boolean structurallyEquals(Expr other) {
        return other instanceof VarExpr && ((VarExpr) other).name.equals(name);
    }

    @Override
    public String termSignature() {
        return "var:" + name;
    }

    @Override
    public boolean isRational() {
        return false;
    }

    @Override
    public boolean isInteger() {
        return false;
    }

    @Override
    public List<MathNode> toMathNode(FormatSettings settings) {
        return List.of(new LiteralNode(name));
    }

    @Override
    public Expr substitute(String variable, Expr replacement) {
        return name.equals(variable) ? replacement : this;
    }

    @Override
    public void collectVariables(Set<String> names) {
        names.add(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
