package com.sysmuse.math.expr;

import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.node.MathNode;
import com.sysmuse.math.node.RootNode;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * n-th root (surd). Perfect powers are pulled out of integer radicands.
 */
public final class RootExpr extends Expr {

    // Trial division stops here; what is left stays under the root
    private static final BigInteger MAX_TRIAL_DIVISOR = BigInteger.valueOf(1_000_000);

    private final Expr radicand;
    private final Expr index;

    public RootExpr(Expr radicand, Expr index) {
        this.radicand = radicand;
        this.index = index;
    }

    public static RootExpr sqrt(Expr radicand) {
        return new RootExpr(radicand, IntExpr.TWO);
    }

    public Expr getRadicand() {
        return radicand;
    }

    public Expr getIndex() {
        return index;
    }

    @Override
    public Expr simplify() {
        Expr rad = radicand.simplify();
        Expr idx = index.simplify();

        if (rad.isOne()) return IntExpr.ONE;
        if (rad.isZero()) return IntExpr.ZERO;

        if (!(idx instanceof IntExpr) || ((IntExpr) idx).getValue().signum() <= 0
                || ((IntExpr) idx).getValue().bitLength() > 31) {
            return new RootExpr(rad, idx);
        }
        int n = ((IntExpr) idx).getValue().intValue();

        if (rad instanceof IntExpr) {
            return simplifyIntegerRoot(((IntExpr) rad).getValue(), n);
        }

        if (rad instanceof FracExpr) {
            FracExpr frac = (FracExpr) rad;
            if (n == 2) {
                // √(a/b) = √(ab)/b
                Expr product = new ProdExpr(List.of(frac.getNumerator(), frac.getDenominator())).simplify();
                Expr root = RootExpr.sqrt(product).simplify();
                return new DivExpr(root, frac.getDenominator()).simplify();
            }
            Expr numRoot = new RootExpr(frac.getNumerator(), idx).simplify();
            Expr denRoot = new RootExpr(frac.getDenominator(), idx).simplify();
            return new DivExpr(numRoot, denRoot).simplify();
        }

        return new RootExpr(rad, idx);
    }

    private static Expr simplifyIntegerRoot(BigInteger value, int rootIndex) {
        if (value.signum() < 0 && rootIndex % 2 == 0) {
            // Even root of a negative number is not real
            return new RootExpr(new IntExpr(value), IntExpr.of(rootIndex));
        }

        boolean negative = value.signum() < 0;
        BigInteger outside = BigInteger.ONE;
        BigInteger inside = BigInteger.ONE;

        for (Map.Entry<BigInteger, Integer> entry : primeFactorize(value.abs()).entrySet()) {
            BigInteger prime = entry.getKey();
            int power = entry.getValue();
            int extracted = power / rootIndex;
            int remaining = power % rootIndex;
            if (extracted > 0) {
                outside = outside.multiply(prime.pow(extracted));
            }
            if (remaining > 0) {
                inside = inside.multiply(prime.pow(remaining));
            }
        }

        if (negative) {
            outside = outside.negate();
        }

        if (inside.equals(BigInteger.ONE)) {
            return new IntExpr(outside);
        }
        if (outside.equals(BigInteger.ONE)) {
            return new RootExpr(new IntExpr(inside), IntExpr.of(rootIndex));
        }
        return new ProdExpr(List.of(new IntExpr(outside), new RootExpr(new IntExpr(inside), IntExpr.of(rootIndex))));
    }

    static Map<BigInteger, Integer> primeFactorize(BigInteger n) {
        Map<BigInteger, Integer> factors = new LinkedHashMap<>();
        BigInteger divisor = BigInteger.TWO;
        while (divisor.multiply(divisor).compareTo(n) <= 0 && divisor.compareTo(MAX_TRIAL_DIVISOR) <= 0) {
            while (n.mod(divisor).signum() == 0) {
                factors.merge(divisor, 1, Integer::sum);
                n = n.divide(divisor);
            }
            divisor = divisor.add(BigInteger.ONE);
        }
        if (n.compareTo(BigInteger.ONE) > 0) {
            factors.merge(n, 1, Integer::sum);
        }
        return factors;
    }

    @Override
    public double toDouble() {
        double r = radicand.toDouble();
        double n = index.toDouble();
        if (n == 2) return Math.sqrt(r);
        if (r < 0 && n % 2 == 1) {
            return -Math.pow(-r, 1 / n);
        }
        return Math.pow(r, 1 / n);
    }

    @Override
    public boolean structurallyEquals(Expr other) {
        return other instanceof RootExpr
                && radicand.structurallyEquals(((RootExpr) other).radicand)
                && index.structurallyEquals(((RootExpr) other).index);
    }

    @Override
    public String termSignature() {
        return "root:" + index.simplify() + ":" + radicand.simplify();
    }

    @Override
    public boolean isZero() {
        return radicand.isZero();
    }

    @Override
    public boolean isOne() {
        return radicand.isOne();
    }

    @Override
    public List<MathNode> toMathNode(FormatSettings settings) {
        Expr simplified = simplify();
        if (!(simplified instanceof RootExpr)) {
            return simplified.toMathNode(settings);
        }
        RootExpr root = (RootExpr) simplified;
        boolean square = root.isSquareRoot();
        return List.of(new RootNode(square,
                square ? null : root.index.toMathNode(settings),
                root.radicand.toMathNode(settings)));
    }

    boolean isSquareRoot() {
        return index instanceof IntExpr && ((IntExpr) index).getValue().equals(BigInteger.TWO);
    }

    @Override
    public Expr substitute(String name, Expr value) {
        return new RootExpr(radicand.substitute(name, value), index.substitute(name, value));
    }

    @Override
    public void collectVariables(Set<String> names) {
        radicand.collectVariables(names);
        index.collectVariables(names);
    }

    @Override
    public String toString() {
        if (isSquareRoot()) {
            return "√" + radicand;
        }
        return index + "√" + radicand;
    }
}
