package com.sysmuse.math.expr;

import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.node.LiteralNode;
import com.sysmuse.math.node.MathNode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Product of factors. Simplified form: at most one leading rational,
 * then roots, then the remaining factors in string order.
 */
public final class ProdExpr extends Expr {

    private final List<Expr> factors;

    public ProdExpr(List<Expr> factors) {
        this.factors = Collections.unmodifiableList(new ArrayList<>(factors));
    }

    public List<Expr> getFactors() {
        return factors;
    }

    @Override
    public Expr simplify() {
        if (factors.isEmpty()) return IntExpr.ONE;
        if (factors.size() == 1) return factors.get(0).simplify();

        List<Expr> flat = new ArrayList<>();
        Expr numeric = IntExpr.ONE;
        for (Expr factor : factors) {
            Expr simplified = factor.simplify();
            if (simplified.isZero()) return IntExpr.ZERO;
            if (simplified.isOne()) continue;

            if (simplified instanceof ProdExpr) {
                for (Expr f : ((ProdExpr) simplified).factors) {
                    if (isNumber(f)) {
                        numeric = Rationals.multiply(numeric, f);
                    } else {
                        flat.add(f);
                    }
                }
            } else if (isNumber(simplified)) {
                numeric = Rationals.multiply(numeric, simplified);
            } else {
                flat.add(simplified);
            }
        }

        if (numeric.isZero()) return IntExpr.ZERO;
        if (!numeric.isOne()) {
            flat.add(0, numeric);
        }
        if (flat.isEmpty()) return IntExpr.ONE;
        if (flat.size() == 1) return flat.get(0);

        flat = combineLikeBases(flat);

        // Merging roots can produce new rationals and nested products
        List<Expr> finalFactors = new ArrayList<>();
        Expr finalNumeric = IntExpr.ONE;
        for (Expr f : flat) {
            if (f instanceof ProdExpr) {
                for (Expr inner : ((ProdExpr) f).factors) {
                    if (isNumber(inner)) {
                        finalNumeric = Rationals.multiply(finalNumeric, inner);
                    } else {
                        finalFactors.add(inner);
                    }
                }
            } else if (isNumber(f)) {
                finalNumeric = Rationals.multiply(finalNumeric, f);
            } else {
                finalFactors.add(f);
            }
        }

        if (finalNumeric.isZero()) return IntExpr.ZERO;
        if (!finalNumeric.isOne() || finalFactors.isEmpty()) {
            finalFactors.add(0, finalNumeric);
        }
        if (finalFactors.size() == 1) return finalFactors.get(0);

        finalFactors.sort(ProdExpr::compareFactors);
        return new ProdExpr(finalFactors);
    }

    /**
     * Merge roots of the same integer index: √a·√b = √(ab), then re-extract.
     */
    private static List<Expr> combineLikeBases(List<Expr> input) {
        Map<BigInteger, List<RootExpr>> rootGroups = new LinkedHashMap<>();
        List<Expr> result = new ArrayList<>();

        for (Expr f : input) {
            if (f instanceof RootExpr && ((RootExpr) f).getIndex() instanceof IntExpr) {
                BigInteger idx = ((IntExpr) ((RootExpr) f).getIndex()).getValue();
                rootGroups.computeIfAbsent(idx, k -> new ArrayList<>()).add((RootExpr) f);
            } else {
                result.add(f);
            }
        }

        for (Map.Entry<BigInteger, List<RootExpr>> entry : rootGroups.entrySet()) {
            List<RootExpr> roots = entry.getValue();
            if (roots.size() == 1) {
                result.add(roots.get(0));
                continue;
            }
            Expr radicand = IntExpr.ONE;
            for (RootExpr r : roots) {
                radicand = new ProdExpr(List.of(radicand, r.getRadicand())).simplify();
            }
            result.add(new RootExpr(radicand, new IntExpr(entry.getKey())).simplify());
        }
        return result;
    }

    private static int compareFactors(Expr a, Expr b) {
        boolean aNum = isNumber(a);
        boolean bNum = isNumber(b);
        if (aNum && !bNum) return -1;
        if (!aNum && bNum) return 1;
        boolean aRoot = a instanceof RootExpr;
        boolean bRoot = b instanceof RootExpr;
        if (aRoot && !bRoot) return -1;
        if (!aRoot && bRoot) return 1;
        return a.toString().compareTo(b.toString());
    }

    @Override
    public double toDouble() {
        double prod = 1;
        for (Expr factor : factors) {
            prod *= factor.toDouble();
        }
        return prod;
    }

    @Override
    public boolean structurallyEquals(Expr other) {
        if (!(other instanceof ProdExpr)) return false;
        List<Expr> otherFactors = ((ProdExpr) other).factors;
        if (otherFactors.size() != factors.size()) return false;
        for (int i = 0; i < factors.size(); i++) {
            if (!factors.get(i).structurallyEquals(otherFactors.get(i))) return false;
        }
        return true;
    }

    @Override
    public String termSignature() {
        List<String> nonNumeric = new ArrayList<>();
        for (Expr f : factors) {
            if (!isNumber(f)) {
                nonNumeric.add(f.termSignature());
            }
        }
        if (nonNumeric.isEmpty()) return "int:1";
        // A single factor keeps its own signature so 3√2 groups with √2
        if (nonNumeric.size() == 1) return nonNumeric.get(0);
        return "prod:" + String.join("*", nonNumeric);
    }

    @Override
    public Expr coefficient() {
        Expr coeff = IntExpr.ONE;
        for (Expr f : factors) {
            if (isNumber(f)) {
                coeff = Rationals.multiply(coeff, f);
            }
        }
        return coeff;
    }

    @Override
    public Expr baseExpr() {
        List<Expr> nonNumeric = factors.stream().filter(f -> !isNumber(f)).collect(Collectors.toList());
        if (nonNumeric.isEmpty()) return IntExpr.ONE;
        if (nonNumeric.size() == 1) return nonNumeric.get(0);
        return new ProdExpr(nonNumeric);
    }

    @Override
    public boolean isZero() {
        return factors.stream().anyMatch(Expr::isZero);
    }

    @Override
    public boolean isOne() {
        return factors.stream().allMatch(Expr::isOne);
    }

    @Override
    public boolean isRational() {
        return factors.stream().allMatch(Expr::isRational);
    }

    @Override
    public boolean isInteger() {
        return false;
    }

    @Override
    public Expr negate() {
        List<Expr> newFactors = new ArrayList<>(factors);
        if (!newFactors.isEmpty() && isNumber(newFactors.get(0))) {
            newFactors.set(0, newFactors.get(0).negate());
        } else {
            newFactors.add(0, IntExpr.NEG_ONE);
        }
        return new ProdExpr(newFactors);
    }

    @Override
    public List<MathNode> toMathNode(FormatSettings settings) {
        if (factors.isEmpty()) return List.of(new LiteralNode("1"));

        List<MathNode> nodes = new ArrayList<>();
        int start = 0;
        if (factors.size() > 1 && factors.get(0).structurallyEquals(IntExpr.NEG_ONE)) {
            nodes.add(new LiteralNode("−"));
            start = 1;
        }
        for (int i = start; i < factors.size(); i++) {
            if (i > start) {
                // Coefficient next to a root or constant is written without a dot
                boolean implicit = isNumber(factors.get(i - 1))
                        && (factors.get(i) instanceof RootExpr || factors.get(i) instanceof ConstExpr);
                if (!implicit) {
                    nodes.add(new LiteralNode("·"));
                }
            }
            nodes.addAll(factors.get(i).toMathNode(settings));
        }
        return nodes;
    }

    @Override
    public Expr substitute(String name, Expr value) {
        List<Expr> replaced = new ArrayList<>();
        for (Expr factor : factors) {
            replaced.add(factor.substitute(name, value));
        }
        return new ProdExpr(replaced);
    }

    @Override
    public void collectVariables(Set<String> names) {
        for (Expr factor : factors) {
            factor.collectVariables(names);
        }
    }

    @Override
    public String toString() {
        return factors.stream().map(Expr::toString).collect(Collectors.joining("·"));
    }
}
