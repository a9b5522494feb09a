package com.sysmuse.math.expr;

import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.node.ExponentNode;
import com.sysmuse.math.node.MathNode;

import java.math.BigInteger;
import java.util.List;
import java.util.Set;

public final class PowExpr extends Expr {

    /** Largest integer exponent that is expanded exactly. */
    static final int MAX_EXACT_EXPONENT = 100;

    private final Expr base;
    private final Expr exponent;

    public PowExpr(Expr base, Expr exponent) {
        this.base = base;
        this.exponent = exponent;
    }

    public Expr getBase() {
        return base;
    }

    public Expr getExponent() {
        return exponent;
    }

    @Override
    public Expr simplify() {
        Expr b = base.simplify();
        Expr e = exponent.simplify();

        if (e.isZero()) return IntExpr.ONE;
        if (e.isOne()) return b;
        if (b.isZero()) return IntExpr.ZERO;
        if (b.isOne()) return IntExpr.ONE;

        if (e instanceof IntExpr && isNumber(b)) {
            Expr exact = exactRationalPower(b, ((IntExpr) e).getValue());
            if (exact != null) {
                return exact;
            }
        }

        // (a^m)^n = a^(m·n)
        if (b instanceof PowExpr) {
            PowExpr inner = (PowExpr) b;
            Expr newExp = new ProdExpr(List.of(inner.exponent, e)).simplify();
            return new PowExpr(inner.base, newExp).simplify();
        }

        // a^(p/q) = q-th root of a^p
        if (e instanceof FracExpr) {
            FracExpr frac = (FracExpr) e;
            Expr raised = new PowExpr(b, frac.getNumerator()).simplify();
            return new RootExpr(raised, frac.getDenominator()).simplify();
        }

        return new PowExpr(b, e);
    }

    private static Expr exactRationalPower(Expr b, BigInteger exp) {
        if (exp.abs().compareTo(BigInteger.valueOf(MAX_EXACT_EXPONENT)) > 0) {
            return null;
        }
        int n = exp.abs().intValue();
        BigInteger num;
        BigInteger den;
        if (b instanceof IntExpr) {
            num = ((IntExpr) b).getValue().pow(n);
            den = BigInteger.ONE;
        } else {
            FracExpr frac = (FracExpr) b;
            num = frac.getNumerator().getValue().pow(n);
            den = frac.getDenominator().getValue().pow(n);
        }
        if (exp.signum() < 0) {
            BigInteger swap = num;
            num = den;
            den = swap;
        }
        return new FracExpr(new IntExpr(num), new IntExpr(den)).simplify();
    }

    @Override
    public double toDouble() {
        return Math.pow(base.toDouble(), exponent.toDouble());
    }

    @Override
    public boolean structurallyEquals(Expr other) {
        return other instanceof PowExpr
                && base.structurallyEquals(((PowExpr) other).base)
                && exponent.structurallyEquals(((PowExpr) other).exponent);
    }

    @Override
    public String termSignature() {
        return "pow:" + base.simplify() + "^" + exponent.simplify();
    }

    @Override
    public boolean isZero() {
        return base.isZero();
    }

    @Override
    public boolean isOne() {
        return base.isOne() || exponent.isZero();
    }

    @Override
    public boolean isRational() {
        return base.isRational() && exponent instanceof IntExpr && ((IntExpr) exponent).getValue().signum() >= 0;
    }

    @Override
    public boolean isInteger() {
        return base instanceof IntExpr && exponent instanceof IntExpr && ((IntExpr) exponent).getValue().signum() >= 0;
    }

    @Override
    public List<MathNode> toMathNode(FormatSettings settings) {
        return List.of(new ExponentNode(base.toMathNode(settings), exponent.toMathNode(settings)));
    }

    @Override
    public Expr substitute(String name, Expr value) {
        return new PowExpr(base.substitute(name, value), exponent.substitute(name, value));
    }

    @Override
    public void collectVariables(Set<String> names) {
        base.collectVariables(names);
        exponent.collectVariables(names);
    }

    @Override
    public String toString() {
        return "(" + base + ")^(" + exponent + ")";
    }
}
