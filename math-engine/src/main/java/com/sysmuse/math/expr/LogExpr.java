package com.sysmuse.math.expr;

import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.node.LiteralNode;
import com.sysmuse.math.node.LogNode;
import com.sysmuse.math.node.MathNode;

import java.math.BigInteger;
import java.util.List;
import java.util.Set;

public final class LogExpr extends Expr {

    private static final int MAX_LOG_SEARCH = 100;

    private final Expr base;
    private final Expr argument;
    private final boolean natural;

    public LogExpr(Expr base, Expr argument, boolean natural) {
        this.base = base;
        this.argument = argument;
        this.natural = natural;
    }

    public static LogExpr ln(Expr argument) {
        return new LogExpr(ConstExpr.E, argument, true);
    }

    public static LogExpr log10(Expr argument) {
        return new LogExpr(IntExpr.of(10), argument, false);
    }

    public Expr getBase() {
        return base;
    }

    public Expr getArgument() {
        return argument;
    }

    public boolean isNatural() {
        return natural;
    }

    @Override
    public Expr simplify() {
        Expr b = base.simplify();
        Expr arg = argument.simplify();

        if (arg.isOne()) return IntExpr.ZERO;
        if (arg.structurallyEquals(b)) return IntExpr.ONE;
        if (arg instanceof PowExpr && ((PowExpr) arg).getBase().structurallyEquals(b)) {
            return ((PowExpr) arg).getExponent().simplify();
        }

        if (b instanceof IntExpr && arg instanceof IntExpr) {
            BigInteger bv = ((IntExpr) b).getValue();
            BigInteger av = ((IntExpr) arg).getValue();
            if (bv.compareTo(BigInteger.ONE) > 0 && av.signum() > 0) {
                Integer exact = integerLog(bv, av);
                if (exact != null) {
                    return IntExpr.of(exact);
                }
            }
        }
        return new LogExpr(b, arg, natural);
    }

    private static Integer integerLog(BigInteger base, BigInteger arg) {
        if (arg.equals(BigInteger.ONE)) return 0;
        BigInteger current = base;
        int power = 1;
        while (current.compareTo(arg) < 0) {
            current = current.multiply(base);
            power++;
            if (power > MAX_LOG_SEARCH) return null;
        }
        return current.equals(arg) ? power : null;
    }

    @Override
    public double toDouble() {
        if (natural) {
            return Math.log(argument.toDouble());
        }
        return Math.log(argument.toDouble()) / Math.log(base.toDouble());
    }

    @Override
    public boolean structurallyEquals(Expr other) {
        return other instanceof LogExpr
                && base.structurallyEquals(((LogExpr) other).base)
                && argument.structurallyEquals(((LogExpr) other).argument);
    }

    @Override
    public String termSignature() {
        return "log:" + base.simplify() + ":" + argument.simplify();
    }

    @Override
    public boolean isZero() {
        return argument.isOne();
    }

    @Override
    public boolean isOne() {
        return argument.structurallyEquals(base);
    }

    @Override
    public List<MathNode> toMathNode(FormatSettings settings) {
        Expr simplified = simplify();
        if (simplified instanceof IntExpr) {
            return simplified.toMathNode(settings);
        }
        LogExpr log = simplified instanceof LogExpr ? (LogExpr) simplified : this;
        return List.of(new LogNode(log.natural,
                log.natural ? List.of(new LiteralNode("e")) : log.base.toMathNode(settings),
                log.argument.toMathNode(settings)));
    }

    @Override
    public Expr substitute(String name, Expr value) {
        return new LogExpr(base.substitute(name, value), argument.substitute(name, value), natural);
    }

    @Override
    public void collectVariables(Set<String> names) {
        base.collectVariables(names);
        argument.collectVariables(names);
    }

    @Override
    public String toString() {
        if (natural) return "ln(" + argument + ")";
        return "log_" + base + "(" + argument + ")";
    }
}
