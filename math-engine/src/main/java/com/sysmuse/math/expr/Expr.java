package com.sysmuse.math.expr;

import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.node.MathNode;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Symbolic expression used for exact computation.
 *
 * Trees are immutable; {@link #simplify()} rebuilds rather than mutates and
 * never throws on input it cannot reduce, it returns that part unchanged.
 */
public abstract class Expr {

    /**
     * Simplify as far as the rules allow. Applying it twice gives the same result.
     */
    public abstract Expr simplify();

    /**
     * Numerical approximation.
     *
     * @throws UnsupportedOperationException if the tree still holds a free variable
     */
    public abstract double toDouble();

    public abstract boolean structurallyEquals(Expr other);

    /**
     * Key used to group like terms in a sum: 3√2 and 5√2 share "root:2:2".
     */
    public abstract String termSignature();

    /**
     * Rational coefficient, e.g. 3 in 3√2.
     */
    public Expr coefficient() {
        return IntExpr.ONE;
    }

    /**
     * Part left once the coefficient is removed, e.g. √2 in 3√2.
     */
    public Expr baseExpr() {
        return this;
    }

    public boolean isZero() {
        return false;
    }

    public boolean isOne() {
        return false;
    }

    public boolean isRational() {
        Expr simplified = simplify();
        return simplified instanceof IntExpr || simplified instanceof FracExpr;
    }

    public boolean isInteger() {
        return simplify() instanceof IntExpr;
    }

    public Expr negate() {
        return new ProdExpr(List.of(IntExpr.NEG_ONE, this));
    }

    /**
     * Render as editor nodes for display.
     */
    public abstract List<MathNode> toMathNode(FormatSettings settings);

    /**
     * Replace every occurrence of the named variable.
     */
    public abstract Expr substitute(String name, Expr value);

    /**
     * Add the names of all free variables to the given set.
     */
    public abstract void collectVariables(Set<String> names);

    public Set<String> variables() {
        Set<String> names = new LinkedHashSet<>();
        collectVariables(names);
        return names;
    }

    /**
     * True for the literal number types, IntExpr and FracExpr.
     */
    public static boolean isNumber(Expr expr) {
        return expr instanceof IntExpr || expr instanceof FracExpr;
    }
}
