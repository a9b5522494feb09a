package com.sysmuse.math.expr;

import java.math.BigInteger;
import java.util.List;

/**
 * Angle written as (numerator/denominator)·π.
 */
final class PiFraction {

    final long numerator;
    final long denominator;

    PiFraction(long numerator, long denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    /**
     * Recognize π, k·π, (k·π)/n and similar; null when the expression is not a rational multiple of π.
     */
    static PiFraction of(Expr expr) {
        if (expr instanceof ConstExpr && ((ConstExpr) expr).getType() == ConstType.PI) {
            return new PiFraction(1, 1);
        }

        if (expr instanceof ProdExpr) {
            boolean hasPi = false;
            Expr coeff = null;
            for (Expr f : ((ProdExpr) expr).getFactors()) {
                if (f instanceof ConstExpr && ((ConstExpr) f).getType() == ConstType.PI) {
                    hasPi = true;
                } else if (Expr.isNumber(f)) {
                    coeff = coeff == null ? f : new ProdExpr(List.of(coeff, f)).simplify();
                } else {
                    return null;
                }
            }
            if (hasPi && coeff != null) {
                if (coeff instanceof IntExpr) {
                    return fits(((IntExpr) coeff).getValue(), BigInteger.ONE);
                }
                if (coeff instanceof FracExpr) {
                    FracExpr frac = (FracExpr) coeff;
                    return fits(frac.getNumerator().getValue(), frac.getDenominator().getValue());
                }
            }
            return null;
        }

        if (expr instanceof DivExpr) {
            DivExpr div = (DivExpr) expr;
            PiFraction numFrac = of(div.getNumerator());
            if (numFrac != null && div.getDenominator() instanceof IntExpr) {
                BigInteger den = ((IntExpr) div.getDenominator()).getValue();
                if (den.signum() == 0) {
                    return null;
                }
                return fits(BigInteger.valueOf(numFrac.numerator),
                        BigInteger.valueOf(numFrac.denominator).multiply(den));
            }
        }
        return null;
    }

    private static PiFraction fits(BigInteger numerator, BigInteger denominator) {
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        if (numerator.bitLength() > 31 || denominator.bitLength() > 31) {
            return null;
        }
        return new PiFraction(numerator.longValue(), denominator.longValue());
    }
}
