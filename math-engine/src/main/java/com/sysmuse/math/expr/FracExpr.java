package com.sysmuse.math.expr;

import com.sysmuse.math.format.ExactNumberFormatter;
import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.node.FractionNode;
import com.sysmuse.math.node.LiteralNode;
import com.sysmuse.math.node.MathNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Exact fraction n/d of two integers. Only {@link #simplify()} reduces it.
 */
public final class FracExpr extends Expr {

    private final IntExpr numerator;
    private final IntExpr denominator;

    public FracExpr(IntExpr numerator, IntExpr denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public static FracExpr of(long numerator, long denominator) {
        return new FracExpr(IntExpr.of(numerator), IntExpr.of(denominator));
    }

    public IntExpr getNumerator() {
        return numerator;
    }

    public IntExpr getDenominator() {
        return denominator;
    }

    @Override
    public Expr simplify() {
        BigInteger n = numerator.getValue();
        BigInteger d = denominator.getValue();

        if (n.signum() == 0) return IntExpr.ZERO;
        // Division by zero stays as written
        if (d.signum() == 0) return this;

        if (d.signum() < 0) {
            n = n.negate();
            d = d.negate();
        }

        BigInteger g = n.gcd(d);
        n = n.divide(g);
        d = d.divide(g);

        if (d.equals(BigInteger.ONE)) {
            return new IntExpr(n);
        }
        return new FracExpr(new IntExpr(n), new IntExpr(d));
    }

    @Override
    public double toDouble() {
        BigInteger n = numerator.getValue();
        BigInteger d = denominator.getValue();
        if (d.signum() == 0) {
            return n.signum() == 0 ? Double.NaN : n.signum() * Double.POSITIVE_INFINITY;
        }
        return new BigDecimal(n).divide(new BigDecimal(d), MathContext.DECIMAL64).doubleValue();
    }

    @Override
    public boolean structurallyEquals(Expr other) {
        Expr thisSimp = simplify();
        if (other instanceof FracExpr) {
            Expr otherSimp = other.simplify();
            if (thisSimp instanceof IntExpr && otherSimp instanceof IntExpr) {
                return thisSimp.structurallyEquals(otherSimp);
            }
            if (thisSimp instanceof FracExpr && otherSimp instanceof FracExpr) {
                FracExpr a = (FracExpr) thisSimp;
                FracExpr b = (FracExpr) otherSimp;
                return a.numerator.getValue().equals(b.numerator.getValue())
                        && a.denominator.getValue().equals(b.denominator.getValue());
            }
            return false;
        }
        if (other instanceof IntExpr) {
            return thisSimp instanceof IntExpr && thisSimp.structurallyEquals(other);
        }
        return false;
    }

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
        return IntExpr.ONE;
    }

    @Override
    public boolean isZero() {
        return numerator.isZero();
    }

    @Override
    public boolean isOne() {
        return simplify().structurallyEquals(IntExpr.ONE);
    }

    @Override
    public boolean isRational() {
        return true;
    }

    @Override
    public boolean isInteger() {
        return simplify() instanceof IntExpr;
    }

    @Override
    public Expr negate() {
        return new FracExpr(new IntExpr(numerator.getValue().negate()), denominator);
    }

    @Override
    public List<MathNode> toMathNode(FormatSettings settings) {
        Expr simplified = simplify();
        if (!(simplified instanceof FracExpr)) {
            return simplified.toMathNode(settings);
        }

        FracExpr frac = (FracExpr) simplified;
        BigInteger n = frac.numerator.getValue();
        List<MathNode> nodes = new ArrayList<>();
        if (n.signum() < 0) {
            // Sign sits outside the fraction bar
            nodes.add(new LiteralNode("−"));
        }
        nodes.add(new FractionNode(
                List.of(new LiteralNode(ExactNumberFormatter.formatBigInteger(n.abs(), false, settings))),
                List.of(new LiteralNode(ExactNumberFormatter.formatBigInteger(
                        frac.denominator.getValue(), false, settings)))));
        return nodes;
    }

    @Override
    public Expr substitute(String name, Expr replacement) {
        return this;
    }

    @Override
    public void collectVariables(Set<String> names) {
    }

    public Expr add(Expr other) {
        BigInteger n = numerator.getValue();
        BigInteger d = denominator.getValue();
        if (other instanceof IntExpr) {
            BigInteger v = ((IntExpr) other).getValue();
            return new FracExpr(new IntExpr(n.add(v.multiply(d))), denominator).simplify();
        }
        if (other instanceof FracExpr) {
            FracExpr f = (FracExpr) other;
            BigInteger on = f.numerator.getValue();
            BigInteger od = f.denominator.getValue();
            return new FracExpr(new IntExpr(n.multiply(od).add(on.multiply(d))),
                    new IntExpr(d.multiply(od))).simplify();
        }
        return new SumExpr(List.of(this, other)).simplify();
    }

    public Expr subtract(Expr other) {
        return add(other.negate());
    }

    public Expr multiply(Expr other) {
        BigInteger n = numerator.getValue();
        BigInteger d = denominator.getValue();
        if (other instanceof IntExpr) {
            return new FracExpr(new IntExpr(n.multiply(((IntExpr) other).getValue())), denominator).simplify();
        }
        if (other instanceof FracExpr) {
            FracExpr f = (FracExpr) other;
            return new FracExpr(new IntExpr(n.multiply(f.numerator.getValue())),
                    new IntExpr(d.multiply(f.denominator.getValue()))).simplify();
        }
        return new ProdExpr(List.of(this, other)).simplify();
    }

    public Expr divide(Expr other) {
        BigInteger n = numerator.getValue();
        BigInteger d = denominator.getValue();
        if (other instanceof IntExpr) {
            return new FracExpr(numerator, new IntExpr(d.multiply(((IntExpr) other).getValue()))).simplify();
        }
        if (other instanceof FracExpr) {
            FracExpr f = (FracExpr) other;
            return new FracExpr(new IntExpr(n.multiply(f.denominator.getValue())),
                    new IntExpr(d.multiply(f.numerator.getValue()))).simplify();
        }
        return new DivExpr(this, other).simplify();
    }

    @Override
    public String toString() {
        Expr s = simplify();
        if (s instanceof IntExpr) return s.toString();
        return numerator.getValue() + "/" + denominator.getValue();
    }
}
