package com.sysmuse.math.expr;

import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.node.MathNode;
import com.sysmuse.math.node.TrigNode;

import java.util.List;
import java.util.Set;

/**
 * Trigonometric or hyperbolic function. Rational multiples of π at the
 * standard angles evaluate to exact values.
 */
public final class TrigExpr extends Expr {

    private final TrigFunc func;
    private final Expr argument;

    public TrigExpr(TrigFunc func, Expr argument) {
        this.func = func;
        this.argument = argument;
    }

    public TrigFunc getFunc() {
        return func;
    }

    public Expr getArgument() {
        return argument;
    }

    @Override
    public Expr simplify() {
        Expr arg = argument.simplify();
        Expr exact = exactValue(arg);
        if (exact != null) {
            return exact.simplify();
        }
        return new TrigExpr(func, arg);
    }

    private Expr exactValue(Expr arg) {
        if (arg.isZero()) {
            switch (func) {
                case COS:
                case COSH:
                    return IntExpr.ONE;
                case ACOS:
                    return new DivExpr(ConstExpr.PI, IntExpr.TWO).simplify();
                case ACOSH:
                    // not real
                    return null;
                default:
                    return IntExpr.ZERO;
            }
        }

        if (arg.isOne()) {
            switch (func) {
                case ASIN:
                    return new DivExpr(ConstExpr.PI, IntExpr.TWO).simplify();
                case ACOS:
                    return IntExpr.ZERO;
                case ATAN:
                    return new DivExpr(ConstExpr.PI, IntExpr.of(4)).simplify();
                default:
                    break;
            }
        }

        if (arg.structurallyEquals(IntExpr.NEG_ONE)) {
            switch (func) {
                case ASIN:
                    return new DivExpr(ConstExpr.PI, IntExpr.of(-2)).simplify();
                case ACOS:
                    return ConstExpr.PI;
                default:
                    break;
            }
        }

        PiFraction piFrac = PiFraction.of(arg);
        if (piFrac == null) return null;

        // Normalize to [0, 2π)
        long den = piFrac.denominator;
        long num = Math.floorMod(piFrac.numerator, 2 * den);

        switch (func) {
            case SIN:
                return sinExact(num, den);
            case COS:
                return cosExact(num, den);
            case TAN:
                Expr sin = sinExact(num, den);
                Expr cos = cosExact(num, den);
                if (sin != null && cos != null && !cos.isZero()) {
                    return new DivExpr(sin, cos).simplify();
                }
                return null;
            default:
                return null;
        }
    }

    /**
     * sin(num·π/den) for num in [0, 2·den).
     */
    private static Expr sinExact(long num, long den) {
        int sign = 1;
        if (num > den) {
            sign = -1;
            num = 2 * den - num;
        }
        // sin(π - x) = sin(x)
        if (num * 2 > den) {
            num = den - num;
        }

        if (num == 0) return IntExpr.ZERO;
        if (num * 6 == den) {
            return sign == 1 ? FracExpr.of(1, 2) : FracExpr.of(-1, 2);
        }
        if (num * 4 == den) {
            Expr val = new DivExpr(RootExpr.sqrt(IntExpr.TWO), IntExpr.TWO);
            return sign == 1 ? val : val.negate();
        }
        if (num * 3 == den) {
            Expr val = new DivExpr(RootExpr.sqrt(IntExpr.of(3)), IntExpr.TWO);
            return sign == 1 ? val : val.negate();
        }
        if (num * 2 == den) {
            return sign == 1 ? IntExpr.ONE : IntExpr.NEG_ONE;
        }
        return null;
    }

    /**
     * cos(num·π/den) for num in [0, 2·den).
     */
    private static Expr cosExact(long num, long den) {
        int sign = 1;
        // cos(-x) = cos(x)
        if (num > den) {
            num = 2 * den - num;
        }
        if (num * 2 > den) {
            sign = -1;
            num = den - num;
        }

        if (num == 0) return sign == 1 ? IntExpr.ONE : IntExpr.NEG_ONE;
        if (num * 6 == den) {
            Expr val = new DivExpr(RootExpr.sqrt(IntExpr.of(3)), IntExpr.TWO);
            return sign == 1 ? val : val.negate();
        }
        if (num * 4 == den) {
            Expr val = new DivExpr(RootExpr.sqrt(IntExpr.TWO), IntExpr.TWO);
            return sign == 1 ? val : val.negate();
        }
        if (num * 3 == den) {
            return sign == 1 ? FracExpr.of(1, 2) : FracExpr.of(-1, 2);
        }
        if (num * 2 == den) return IntExpr.ZERO;
        return null;
    }

    @Override
    public double toDouble() {
        double a = argument.toDouble();
        switch (func) {
            case SIN:
                return Math.sin(a);
            case COS:
                return Math.cos(a);
            case TAN:
                return Math.tan(a);
            case ASIN:
                return Math.asin(a);
            case ACOS:
                return Math.acos(a);
            case ATAN:
                return Math.atan(a);
            case SINH:
                return (Math.exp(a) - Math.exp(-a)) / 2;
            case COSH:
                return (Math.exp(a) + Math.exp(-a)) / 2;
            case TANH:
                return (Math.exp(a) - Math.exp(-a)) / (Math.exp(a) + Math.exp(-a));
            case ASINH:
                return Math.log(a + Math.sqrt(a * a + 1));
            case ACOSH:
                return Math.log(a + Math.sqrt(a * a - 1));
            case ATANH:
                return 0.5 * Math.log((1 + a) / (1 - a));
            default:
                throw new IllegalStateException("Unknown function " + func);
        }
    }

    @Override
    public boolean structurallyEquals(Expr other) {
        return other instanceof TrigExpr
                && func == ((TrigExpr) other).func
                && argument.structurallyEquals(((TrigExpr) other).argument);
    }

    @Override
    public String termSignature() {
        return "trig:" + func.getName() + ":" + argument.simplify();
    }

    @Override
    public boolean isZero() {
        Expr simplified = simplify();
        return simplified instanceof IntExpr && simplified.isZero();
    }

    @Override
    public boolean isOne() {
        Expr simplified = simplify();
        return simplified instanceof IntExpr && simplified.isOne();
    }

    @Override
    public List<MathNode> toMathNode(FormatSettings settings) {
        Expr simplified = simplify();
        if (!(simplified instanceof TrigExpr)) {
            return simplified.toMathNode(settings);
        }
        return List.of(new TrigNode(func.getName(), argument.toMathNode(settings)));
    }

    @Override
    public Expr substitute(String name, Expr value) {
        return new TrigExpr(func, argument.substitute(name, value));
    }

    @Override
    public void collectVariables(Set<String> names) {
        argument.collectVariables(names);
    }

    @Override
    public String toString() {
        return func.getName() + "(" + argument + ")";
    }
}
