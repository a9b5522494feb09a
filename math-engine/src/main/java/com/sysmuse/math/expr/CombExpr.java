package com.sysmuse.math.expr;

import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.node.CombinationNode;
import com.sysmuse.math.node.MathNode;

import java.math.BigInteger;
import java.util.List;
import java.util.Set;

/**
 * Combinations nCr = n!/(r!(n-r)!), exact for 0 ≤ r ≤ n.
 */
public final class CombExpr extends Expr {

    private final Expr n;
    private final Expr r;

    public CombExpr(Expr n, Expr r) {
        this.n = n;
        this.r = r;
    }

    public Expr getN() {
        return n;
    }

    public Expr getR() {
        return r;
    }

    @Override
    public Expr simplify() {
        Expr nSimp = n.simplify();
        Expr rSimp = r.simplify();
        if (nSimp instanceof IntExpr && rSimp instanceof IntExpr) {
            BigInteger nVal = ((IntExpr) nSimp).getValue();
            BigInteger rVal = ((IntExpr) rSimp).getValue();
            if (nVal.signum() >= 0 && rVal.signum() >= 0 && rVal.compareTo(nVal) <= 0
                    && rVal.min(nVal.subtract(rVal)).compareTo(BigInteger.valueOf(PermExpr.MAX_EXACT_TERMS)) <= 0) {
                return new IntExpr(compute(nVal, rVal));
            }
        }
        return new CombExpr(nSimp, rSimp);
    }

    static BigInteger compute(BigInteger nVal, BigInteger rVal) {
        if (rVal.compareTo(nVal.subtract(rVal)) > 0) {
            rVal = nVal.subtract(rVal);
        }
        BigInteger result = BigInteger.ONE;
        for (BigInteger i = BigInteger.ZERO; i.compareTo(rVal) < 0; i = i.add(BigInteger.ONE)) {
            result = result.multiply(nVal.subtract(i)).divide(i.add(BigInteger.ONE));
        }
        return result;
    }

    @Override
    public double toDouble() {
        long nVal = (long) n.toDouble();
        long rVal = (long) r.toDouble();
        if (rVal > nVal || rVal < 0 || nVal < 0) return 0;
        if (rVal > nVal - rVal) {
            rVal = nVal - rVal;
        }
        double result = 1;
        for (long i = 0; i < rVal && !Double.isInfinite(result); i++) {
            result *= (nVal - i);
            result /= (i + 1);
        }
        return result;
    }

    @Override
    public boolean structurallyEquals(Expr other) {
        return other instanceof CombExpr
                && n.structurallyEquals(((CombExpr) other).n)
                && r.structurallyEquals(((CombExpr) other).r);
    }

    @Override
    public String termSignature() {
        return "comb:" + n.termSignature() + ":" + r.termSignature();
    }

    @Override
    public boolean isOne() {
        Expr simplified = simplify();
        return simplified instanceof IntExpr && simplified.isOne();
    }

    @Override
    public List<MathNode> toMathNode(FormatSettings settings) {
        Expr simplified = simplify();
        if (simplified instanceof IntExpr) {
            return simplified.toMathNode(settings);
        }
        return List.of(new CombinationNode(n.toMathNode(settings), r.toMathNode(settings)));
    }

    @Override
    public Expr substitute(String name, Expr value) {
        return new CombExpr(n.substitute(name, value), r.substitute(name, value));
    }

    @Override
    public void collectVariables(Set<String> names) {
        n.collectVariables(names);
        r.collectVariables(names);
    }

    @Override
    public String toString() {
        return "C(" + n + "," + r + ")";
    }
}
