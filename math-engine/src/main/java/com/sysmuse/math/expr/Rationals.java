package com.sysmuse.math.expr;

import java.util.List;

/**
 * Arithmetic on IntExpr and FracExpr values.
 */
final class Rationals {

    private Rationals() {
    }

    static Expr add(Expr a, Expr b) {
        if (a instanceof IntExpr) {
            return ((IntExpr) a).add(b);
        }
        if (a instanceof FracExpr) {
            return ((FracExpr) a).add(b);
        }
        return new SumExpr(List.of(a, b)).simplify();
    }

    static Expr multiply(Expr a, Expr b) {
        if (a instanceof IntExpr) {
            return ((IntExpr) a).multiply(b);
        }
        if (a instanceof FracExpr) {
            return ((FracExpr) a).multiply(b);
        }
        return new ProdExpr(List.of(a, b));
    }

    static boolean isNegative(Expr expr) {
        if (expr instanceof IntExpr) {
            return ((IntExpr) expr).getValue().signum() < 0;
        }
        if (expr instanceof FracExpr) {
            return ((FracExpr) expr).getNumerator().getValue().signum() < 0;
        }
        return false;
    }

    static Expr abs(Expr expr) {
        if (expr instanceof IntExpr) {
            return new IntExpr(((IntExpr) expr).getValue().abs());
        }
        if (expr instanceof FracExpr) {
            FracExpr frac = (FracExpr) expr;
            return new FracExpr(new IntExpr(frac.getNumerator().getValue().abs()), frac.getDenominator());
        }
        return expr;
    }
}
