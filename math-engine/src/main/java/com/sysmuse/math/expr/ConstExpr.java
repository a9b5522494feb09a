package com.sysmuse.math.expr;

import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.node.ConstantNode;
import com.sysmuse.math.node.LiteralNode;
import com.sysmuse.math.node.MathNode;

import java.util.List;
import java.util.Set;

public final class ConstExpr extends Expr {

    public static final ConstExpr PI = new ConstExpr(ConstType.PI);
    public static final ConstExpr E = new ConstExpr(ConstType.E);
    public static final ConstExpr PHI = new ConstExpr(ConstType.PHI);

    private final ConstType type;

    public ConstExpr(ConstType type) {
        this.type = type;
    }

    public ConstType getType() {
        return type;
    }

    @Override
    public Expr simplify() {
        return this;
    }

    @Override
    public double toDouble() {
        return type.getValue();
    }

    @Override
    public boolean structurallyEquals(Expr other) {
        return other instanceof ConstExpr && ((ConstExpr) other).type == type;
    }

    @Override
    public String termSignature() {
        return "const:" + type.name();
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
        if (type.isPlainLiteral()) {
            return List.of(new LiteralNode(type.getSymbol()));
        }
        return List.of(new ConstantNode(type.getSymbol()));
    }

    @Override
    public Expr substitute(String name, Expr replacement) {
        return this;
    }

    @Override
    public void collectVariables(Set<String> names) {
    }

    @Override
    public String toString() {
        return type.getSymbol();
    }
}
