package com.sysmuse.math.expr;

import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.node.FractionNode;
import com.sysmuse.math.node.LiteralNode;
import com.sysmuse.math.node.MathNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Quotient of two arbitrary expressions. Integer-only quotients are held by {@link FracExpr}.
 */
public final class DivExpr extends Expr {

    private final Expr numerator;
    private final Expr denominator;

    public DivExpr(Expr numerator, Expr denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public Expr getNumerator() {
        return numerator;
    }

    public Expr getDenominator() {
        return denominator;
    }

    @Override
    public Expr simplify() {
        Expr num = numerator.simplify();
        Expr den = denominator.simplify();

        if (num.isZero()) return IntExpr.ZERO;
        if (den.isOne()) return num;
        if (num.structurallyEquals(den) && !den.isZero()) return IntExpr.ONE;

        if (num instanceof IntExpr && den instanceof IntExpr) {
            return new FracExpr((IntExpr) num, (IntExpr) den).simplify();
        }
        if (num instanceof FracExpr && isNumber(den)) {
            return ((FracExpr) num).divide(den);
        }
        if (num instanceof IntExpr && den instanceof FracExpr) {
            return ((IntExpr) num).divide(den);
        }

        // √a / √b = √(a/b)
        if (num instanceof RootExpr && den instanceof RootExpr) {
            RootExpr top = (RootExpr) num;
            RootExpr bottom = (RootExpr) den;
            if (top.getIndex().structurallyEquals(bottom.getIndex())) {
                return new RootExpr(new DivExpr(top.getRadicand(), bottom.getRadicand()).simplify(),
                        top.getIndex()).simplify();
            }
        }

        // a√b / c = (a/c)√b
        if (num instanceof ProdExpr && den.isRational()) {
            Expr split = splitCoefficient((ProdExpr) num, den);
            if (split != null) {
                return split;
            }
        }

        // (a/b) / c = a / (b·c)
        if (num instanceof FracExpr) {
            FracExpr frac = (FracExpr) num;
            return new DivExpr(frac.getNumerator(), new ProdExpr(List.of(frac.getDenominator(), den))).simplify();
        }
        if (num instanceof DivExpr) {
            DivExpr inner = (DivExpr) num;
            return new DivExpr(inner.numerator, new ProdExpr(List.of(inner.denominator, den))).simplify();
        }

        // a / (b/c) = (a·c) / b
        if (den instanceof FracExpr) {
            FracExpr frac = (FracExpr) den;
            return new DivExpr(new ProdExpr(List.of(num, frac.getDenominator())), frac.getNumerator()).simplify();
        }
        if (den instanceof DivExpr) {
            DivExpr inner = (DivExpr) den;
            return new DivExpr(new ProdExpr(List.of(num, inner.denominator)), inner.numerator).simplify();
        }

        // (a + b) / c = a/c + b/c
        if (num instanceof SumExpr && !(den instanceof SumExpr)) {
            List<Expr> newTerms = new ArrayList<>();
            for (Expr term : ((SumExpr) num).getTerms()) {
                newTerms.add(new DivExpr(term, den).simplify());
            }
            return new SumExpr(newTerms).simplify();
        }

        return new DivExpr(num, den);
    }

    /**
     * Divide the rational factor of a product by a rational denominator.
     * A fractional result is pulled in front only when the rest holds a
     * root, log or trig function; otherwise the quotient stays a single fraction.
     * Returns null when nothing changes.
     */
    private static Expr splitCoefficient(ProdExpr num, Expr den) {
        List<Expr> factors = num.getFactors();
        int ratIdx = -1;
        for (int i = 0; i < factors.size(); i++) {
            if (factors.get(i).isRational()) {
                ratIdx = i;
                break;
            }
        }
        if (ratIdx == -1) {
            return null;
        }

        Expr ratFactor = factors.get(ratIdx);
        Expr simplifiedCoeff = new DivExpr(ratFactor, den).simplify();

        boolean changed = simplifiedCoeff instanceof IntExpr;
        if (!changed && simplifiedCoeff instanceof FracExpr) {
            FracExpr frac = (FracExpr) simplifiedCoeff;
            if (ratFactor instanceof IntExpr && den instanceof IntExpr) {
                changed = !frac.getNumerator().getValue().equals(((IntExpr) ratFactor).getValue())
                        || !frac.getDenominator().getValue().equals(((IntExpr) den).getValue());
            } else {
                changed = !ratFactor.structurallyEquals(simplifiedCoeff);
            }
        }

        List<Expr> otherFactors = new ArrayList<>(factors);
        otherFactors.remove(ratIdx);
        Expr remainder = otherFactors.size() == 1
                ? otherFactors.get(0)
                : new ProdExpr(otherFactors).simplify();

        boolean shouldSeparate = simplifiedCoeff instanceof FracExpr && hasTranscendentalPart(remainder);
        if (!changed && !shouldSeparate) {
            return null;
        }

        if (simplifiedCoeff instanceof IntExpr) {
            if (simplifiedCoeff.isOne()) return remainder;
            return new ProdExpr(List.of(simplifiedCoeff, remainder)).simplify();
        }
        if (simplifiedCoeff instanceof FracExpr) {
            FracExpr frac = (FracExpr) simplifiedCoeff;
            if (hasTranscendentalPart(remainder)) {
                return new ProdExpr(List.of(frac, remainder)).simplify();
            }
            return new DivExpr(new ProdExpr(List.of(frac.getNumerator(), remainder)).simplify(),
                    frac.getDenominator());
        }
        return null;
    }

    private static boolean hasTranscendentalPart(Expr expr) {
        if (expr instanceof TrigExpr || expr instanceof LogExpr || expr instanceof RootExpr) return true;
        if (expr instanceof ProdExpr) {
            return ((ProdExpr) expr).getFactors().stream().anyMatch(DivExpr::hasTranscendentalPart);
        }
        if (expr instanceof PowExpr) {
            return hasTranscendentalPart(((PowExpr) expr).getBase());
        }
        return false;
    }

    @Override
    public double toDouble() {
        return numerator.toDouble() / denominator.toDouble();
    }

    @Override
    public boolean structurallyEquals(Expr other) {
        return other instanceof DivExpr
                && numerator.structurallyEquals(((DivExpr) other).numerator)
                && denominator.structurallyEquals(((DivExpr) other).denominator);
    }

    @Override
    public String termSignature() {
        return "div:" + numerator.simplify() + "/" + denominator.simplify();
    }

    @Override
    public boolean isZero() {
        return numerator.isZero();
    }

    @Override
    public boolean isOne() {
        return numerator.structurallyEquals(denominator);
    }

    @Override
    public Expr negate() {
        return new DivExpr(numerator.negate(), denominator);
    }

    @Override
    public List<MathNode> toMathNode(FormatSettings settings) {
        Expr simplified = simplify();
        if (!(simplified instanceof DivExpr)) {
            return simplified.toMathNode(settings);
        }

        DivExpr div = (DivExpr) simplified;
        List<MathNode> result = new ArrayList<>();
        Expr numToRender = div.numerator;
        if (isNumber(numToRender) && Rationals.isNegative(numToRender)) {
            result.add(new LiteralNode("−"));
            numToRender = Rationals.abs(numToRender);
        }
        result.add(new FractionNode(numToRender.toMathNode(settings), div.denominator.toMathNode(settings)));
        return result;
    }

    @Override
    public Expr substitute(String name, Expr value) {
        return new DivExpr(numerator.substitute(name, value), denominator.substitute(name, value));
    }

    @Override
    public void collectVariables(Set<String> names) {
        numerator.collectVariables(names);
        denominator.collectVariables(names);
    }

    @Override
    public String toString() {
        return "(" + numerator + ")/(" + denominator + ")";
    }
}
