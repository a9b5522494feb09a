package com.sysmuse.math.expr;

import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.node.MathNode;
import com.sysmuse.math.node.TrigNode;

import java.util.List;
import java.util.Set;

public final class AbsExpr extends Expr {

    private final Expr operand;

    public AbsExpr(Expr operand) {
        this.operand = operand;
    }

    public Expr getOperand() {
        return operand;
    }

    @Override
    public Expr simplify() {
        Expr op = operand.simplify();
        if (op instanceof IntExpr) {
            return new IntExpr(((IntExpr) op).getValue().abs());
        }
        if (op instanceof FracExpr) {
            FracExpr frac = (FracExpr) op;
            return new FracExpr(new IntExpr(frac.getNumerator().getValue().abs()),
                    new IntExpr(frac.getDenominator().getValue().abs())).simplify();
        }
        // Real roots are non-negative
        if (op instanceof RootExpr) {
            return op;
        }
        return new AbsExpr(op);
    }

    @Override
    public double toDouble() {
        return Math.abs(operand.toDouble());
    }

    @Override
    public boolean structurallyEquals(Expr other) {
        return other instanceof AbsExpr && operand.structurallyEquals(((AbsExpr) other).operand);
    }

    @Override
    public String termSignature() {
        return "abs:" + operand.simplify();
    }

    @Override
    public boolean isZero() {
        return operand.isZero();
    }

    @Override
    public boolean isOne() {
        return operand.isOne() || operand.negate().simplify().isOne();
    }

    @Override
    public List<MathNode> toMathNode(FormatSettings settings) {
        Expr simplified = simplify();
        if (!(simplified instanceof AbsExpr)) {
            return simplified.toMathNode(settings);
        }
        return List.of(new TrigNode("abs", operand.toMathNode(settings)));
    }

    @Override
    public Expr substitute(String name, Expr value) {
        return new AbsExpr(operand.substitute(name, value));
    }

    @Override
    public void collectVariables(Set<String> names) {
        operand.collectVariables(names);
    }

    @Override
    public String toString() {
        return "|" + operand + "|";
    }
}
