package com.sysmuse.math.expr;

import com.sysmuse.math.format.ExactNumberFormatter;
import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.node.LiteralNode;
import com.sysmuse.math.node.MathNode;

import java.math.BigInteger;
import java.util.List;
import java.util.Set;

/**
 * Exact integer of arbitrary size.
 */
public final class IntExpr extends Expr {

    public static final IntExpr ZERO = new IntExpr(BigInteger.ZERO);
    public static final IntExpr ONE = new IntExpr(BigInteger.ONE);
    public static final IntExpr TWO = new IntExpr(BigInteger.TWO);
    public static final IntExpr NEG_ONE = new IntExpr(BigInteger.ONE.negate());

    private final BigInteger value;

    public IntExpr(BigInteger value) {
        this.value = value;
    }

    public static IntExpr of(long value) {
        return new IntExpr(BigInteger.valueOf(value));
    }

    public BigInteger getValue() {
        return value;
    }

    @Override
    public Expr simplify() {
        return this;
    }

    @Override
    public double toDouble() {
        return value.doubleValue();
    }

    @Override
    public boolean structurallyEquals(Expr other) {
        if (other instanceof FracExpr) {
            // 4/2 equals 2 from either side
            return other.structurallyEquals(this);
        }
        return other instanceof IntExpr && ((IntExpr) other).value.equals(value);
    }

    // All rationals combine together
    @Override
    public String termSignature() {
        return "int:1";
    }

    @Override
    public Expr coefficient() {
        return this;
    }

    @Override
    public Expr baseExpr() {
        return ONE;
    }

    @Override
    public boolean isZero() {
        return value.signum() == 0;
    }

    @Override
    public boolean isOne() {
        return value.equals(BigInteger.ONE);
    }

    @Override
    public boolean isRational() {
        return true;
    }

    @Override
    public boolean isInteger() {
        return true;
    }

    @Override
    public Expr negate() {
        return new IntExpr(value.negate());
    }

    @Override
    public List<MathNode> toMathNode(FormatSettings settings) {
        return List.of(new LiteralNode(ExactNumberFormatter.formatBigInteger(value, true, settings)));
    }

    @Override
    public Expr substitute(String name, Expr replacement) {
        return this;
    }

    @Override
    public void collectVariables(Set<String> names) {
    }

    public Expr add(Expr other) {
        if (other instanceof IntExpr) {
            return new IntExpr(value.add(((IntExpr) other).value));
        }
        if (other instanceof FracExpr) {
            FracExpr frac = (FracExpr) other;
            BigInteger d = frac.getDenominator().getValue();
            return new FracExpr(new IntExpr(value.multiply(d).add(frac.getNumerator().getValue())),
                    frac.getDenominator()).simplify();
        }
        return new SumExpr(List.of(this, other)).simplify();
    }

    public Expr subtract(Expr other) {
        return add(other.negate());
    }

    public Expr multiply(Expr other) {
        if (other instanceof IntExpr) {
            return new IntExpr(value.multiply(((IntExpr) other).value));
        }
        if (other instanceof FracExpr) {
            FracExpr frac = (FracExpr) other;
            return new FracExpr(new IntExpr(value.multiply(frac.getNumerator().getValue())),
                    frac.getDenominator()).simplify();
        }
        return new ProdExpr(List.of(this, other)).simplify();
    }

    public Expr divide(Expr other) {
        if (other instanceof IntExpr) {
            return new FracExpr(this, (IntExpr) other).simplify();
        }
        if (other instanceof FracExpr) {
            FracExpr frac = (FracExpr) other;
            return new FracExpr(new IntExpr(value.multiply(frac.getDenominator().getValue())),
                    frac.getNumerator()).simplify();
        }
        return new DivExpr(this, other).simplify();
    }

    public Expr power(Expr exponent) {
        return new PowExpr(this, exponent).simplify();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
