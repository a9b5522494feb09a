package com.sysmuse.math.expr;

import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.node.LiteralNode;
import com.sysmuse.math.node.MathNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Sum of terms. Simplification combines like terms by signature and keeps
 * the order in which each kind of term first appeared.
 */
public final class SumExpr extends Expr {

    private final List<Expr> terms;

    public SumExpr(List<Expr> terms) {
        this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
    }

    public List<Expr> getTerms() {
        return terms;
    }

    @Override
    public Expr simplify() {
        if (terms.isEmpty()) return IntExpr.ZERO;
        if (terms.size() == 1) return terms.get(0).simplify();

        // Flatten nested sums, dropping zeros
        List<Expr> flat = new ArrayList<>();
        for (Expr term : terms) {
            Expr simplified = term.simplify();
            if (simplified instanceof SumExpr) {
                flat.addAll(((SumExpr) simplified).terms);
            } else if (!simplified.isZero()) {
                flat.add(simplified);
            }
        }

        if (flat.isEmpty()) return IntExpr.ZERO;
        if (flat.size() == 1) return flat.get(0);

        // Insertion order of the map is first-occurrence order
        Map<String, List<Expr>> groups = new LinkedHashMap<>();
        for (Expr term : flat) {
            groups.computeIfAbsent(term.termSignature(), k -> new ArrayList<>()).add(term);
        }

        List<Expr> result = new ArrayList<>();
        for (List<Expr> group : groups.values()) {
            Expr combined;
            if (group.size() == 1) {
                combined = group.get(0);
            } else {
                Expr coeffSum = sumCoefficients(group);
                if (coeffSum.isZero()) {
                    continue;
                }
                Expr base = group.get(0).baseExpr();
                if (base.isOne()) {
                    combined = coeffSum;
                } else if (coeffSum.isOne()) {
                    combined = base;
                } else if (coeffSum.structurallyEquals(IntExpr.NEG_ONE)) {
                    combined = base.negate();
                } else {
                    combined = new ProdExpr(List.of(coeffSum, base)).simplify();
                }
            }
            if (!combined.isZero()) {
                result.add(combined);
            }
        }

        if (result.isEmpty()) return IntExpr.ZERO;
        if (result.size() == 1) return result.get(0);
        return new SumExpr(result);
    }

    private static Expr sumCoefficients(List<Expr> group) {
        Expr sum = IntExpr.ZERO;
        for (Expr term : group) {
            Expr coeff = term.coefficient();
            if (isNumber(sum) && isNumber(coeff)) {
                sum = Rationals.add(sum, coeff);
            } else {
                sum = new SumExpr(List.of(sum, coeff)).simplify();
            }
        }
        return sum;
    }

    @Override
    public double toDouble() {
        double sum = 0;
        for (Expr term : terms) {
            sum += term.toDouble();
        }
        return sum;
    }

    @Override
    public boolean structurallyEquals(Expr other) {
        if (!(other instanceof SumExpr)) return false;
        List<Expr> otherTerms = ((SumExpr) other).terms;
        if (otherTerms.size() != terms.size()) return false;
        for (int i = 0; i < terms.size(); i++) {
            if (!terms.get(i).structurallyEquals(otherTerms.get(i))) return false;
        }
        return true;
    }

    @Override
    public String termSignature() {
        return "sum:" + terms.stream().map(Expr::termSignature).collect(Collectors.joining("+"));
    }

    @Override
    public boolean isZero() {
        return terms.stream().allMatch(Expr::isZero);
    }

    @Override
    public boolean isRational() {
        return terms.stream().allMatch(Expr::isRational);
    }

    @Override
    public boolean isInteger() {
        return false;
    }

    @Override
    public Expr negate() {
        List<Expr> negated = new ArrayList<>();
        for (Expr term : terms) {
            negated.add(term.negate());
        }
        return new SumExpr(negated);
    }

    @Override
    public List<MathNode> toMathNode(FormatSettings settings) {
        if (terms.isEmpty()) return List.of(new LiteralNode("0"));

        List<MathNode> nodes = new ArrayList<>();
        for (int i = 0; i < terms.size(); i++) {
            Expr term = terms.get(i);
            boolean negative = isNegativeTerm(term);
            Expr absTerm = negative ? absoluteTerm(term) : term;

            if (negative) {
                nodes.add(new LiteralNode("−"));
            } else if (i > 0) {
                nodes.add(new LiteralNode("+"));
            }
            nodes.addAll(absTerm.toMathNode(settings));
        }
        return nodes;
    }

    static boolean isNegativeTerm(Expr term) {
        if (isNumber(term)) {
            return Rationals.isNegative(term);
        }
        if (term instanceof ProdExpr && !((ProdExpr) term).getFactors().isEmpty()) {
            return Rationals.isNegative(term.coefficient());
        }
        if (term instanceof DivExpr) {
            return Rationals.isNegative(((DivExpr) term).getNumerator());
        }
        return false;
    }

    static Expr absoluteTerm(Expr term) {
        if (isNumber(term)) {
            return Rationals.abs(term);
        }
        if (term instanceof ProdExpr && !((ProdExpr) term).getFactors().isEmpty()) {
            Expr absCoeff = Rationals.abs(term.coefficient());
            Expr base = term.baseExpr();
            if (absCoeff.isOne()) return base;
            return new ProdExpr(List.of(absCoeff, base));
        }
        if (term instanceof DivExpr) {
            DivExpr div = (DivExpr) term;
            if (Rationals.isNegative(div.getNumerator())) {
                return new DivExpr(Rationals.abs(div.getNumerator()), div.getDenominator());
            }
        }
        return term;
    }

    @Override
    public Expr substitute(String name, Expr value) {
        List<Expr> replaced = new ArrayList<>();
        for (Expr term : terms) {
            replaced.add(term.substitute(name, value));
        }
        return new SumExpr(replaced);
    }

    @Override
    public void collectVariables(Set<String> names) {
        for (Expr term : terms) {
            term.collectVariables(names);
        }
    }

    @Override
    public String toString() {
        return terms.stream().map(Expr::toString).collect(Collectors.joining(" + "));
    }
}
