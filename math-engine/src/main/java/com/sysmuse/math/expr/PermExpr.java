package com.sysmuse.math.expr;

import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.node.PermutationNode;
import com.sysmuse.math.node.MathNode;

import java.math.BigInteger;
import java.util.List;
import java.util.Set;

/**
 * Permutations nPr = n!/(n-r)!, exact for 0 ≤ r ≤ n.
 */
public final class PermExpr extends Expr {

    /** Largest r multiplied out exactly; beyond it the expression stays symbolic. */
    static final int MAX_EXACT_TERMS = 1000;

    private final Expr n;
    private final Expr r;

    public PermExpr(Expr n, Expr r) {
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
                    && rVal.compareTo(BigInteger.valueOf(MAX_EXACT_TERMS)) <= 0) {
                return new IntExpr(compute(nVal, rVal));
            }
        }
        return new PermExpr(nSimp, rSimp);
    }

    static BigInteger compute(BigInteger nVal, BigInteger rVal) {
        BigInteger result = BigInteger.ONE;
        for (BigInteger i = nVal.subtract(rVal).add(BigInteger.ONE); i.compareTo(nVal) <= 0; i = i.add(BigInteger.ONE)) {
            result = result.multiply(i);
        }
        return result;
    }

    @Override
    public double toDouble() {
        long nVal = (long) n.toDouble();
        long rVal = (long) r.toDouble();
        if (rVal > nVal || rVal < 0 || nVal < 0) return 0;
        double result = 1;
        for (long i = 0; i < rVal && !Double.isInfinite(result); i++) {
            result *= (nVal - i);
        }
        return result;
    }

    @Override
    public boolean structurallyEquals(Expr other) {
        return other instanceof PermExpr
                && n.structurallyEquals(((PermExpr) other).n)
                && r.structurallyEquals(((PermExpr) other).r);
    }

    @Override
    public String termSignature() {
        return "perm:" + n.termSignature() + ":" + r.termSignature();
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
        return List.of(new PermutationNode(n.toMathNode(settings), r.toMathNode(settings)));
    }

    @Override
    public Expr substitute(String name, Expr value) {
        return new PermExpr(n.substitute(name, value), r.substitute(name, value));
    }

    @Override
    public void collectVariables(Set<String> names) {
        n.collectVariables(names);
        r.collectVariables(names);
    }

    @Override
    public String toString() {
        return "P(" + n + "," + r + ")";
    }
}
