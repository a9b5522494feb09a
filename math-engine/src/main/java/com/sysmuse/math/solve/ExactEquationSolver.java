package com.sysmuse.math.solve;

import com.sysmuse.math.convert.MathNodeToExpr;
import com.sysmuse.math.expr.DivExpr;
import com.sysmuse.math.expr.Expr;
import com.sysmuse.math.expr.IntExpr;
import com.sysmuse.math.expr.PowExpr;
import com.sysmuse.math.expr.ProdExpr;
import com.sysmuse.math.expr.RootExpr;
import com.sysmuse.math.expr.SumExpr;
import com.sysmuse.math.expr.VarExpr;
import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.node.LiteralNode;
import com.sysmuse.math.node.MathNode;
import com.sysmuse.math.node.NewlineNode;
import com.sysmuse.util.LoggingUtil;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Symbolic solving of single linear or quadratic equations and square linear
 * systems, working on simplified {@link Expr} trees.
 */
class ExactEquationSolver {

    private static final IntExpr NEG_FOUR = IntExpr.of(-4);

    private final FormatSettings settings;

    ExactEquationSolver(FormatSettings settings) {
        this.settings = settings;
    }

    ExactResult solveSingleEquation(List<MathNode> nodes, Map<Integer, Expr> ansExpressions) {
        int eqIndex = indexOfEquals(nodes);
        if (eqIndex < 0) return ExactResult.empty();

        Expr left = MathNodeToExpr.convert(nodes.subList(0, eqIndex), ansExpressions);
        Expr right = MathNodeToExpr.convert(nodes.subList(eqIndex + 1, nodes.size()), ansExpressions);

        // f(x) = 0
        Expr combined = new SumExpr(List.of(left, right.negate())).simplify();

        Set<String> variables = combined.variables();
        if (variables.size() != 1) {
            LoggingUtil.debug("Exact equation needs exactly one unknown, found " + variables);
            return ExactResult.empty();
        }
        String variable = variables.iterator().next();

        List<Expr> solutions = solveQuadratic(combined, variable);
        if (solutions != null) {
            List<MathNode> display = new ArrayList<>();
            for (int i = 0; i < solutions.size(); i++) {
                if (i > 0) display.add(new NewlineNode());
                display.add(new LiteralNode(variable + " = "));
                display.addAll(solutions.get(i).toMathNode(settings));
            }
            return new ExactResult(solutions.get(0), display, approximate(solutions.get(0)), true);
        }

        Expr linear = solveLinear(combined, variable);
        if (linear != null) {
            List<MathNode> display = new ArrayList<>();
            display.add(new LiteralNode(variable + " = "));
            display.addAll(linear.toMathNode(settings));
            return new ExactResult(linear, display, approximate(linear), true);
        }

        LoggingUtil.debug("Equation in " + variable + " is neither linear nor quadratic");
        return ExactResult.empty();
    }

    /**
     * Quadratic formula over exact expressions.
     *
     * @return one or two roots, or null when the equation is not a true quadratic
     */
    List<Expr> solveQuadratic(Expr combined, String variable) {
        Expr[] coeffs = getPolynomialCoeffs(combined, variable);
        if (coeffs == null) return null;
        Expr a = coeffs[2];
        Expr b = coeffs[1];
        Expr c = coeffs[0];
        if (a.isZero()) return null;

        Expr discriminant = new SumExpr(List.of(
                new PowExpr(b, IntExpr.TWO),
                new ProdExpr(List.of(NEG_FOUR, a, c)))).simplify();
        Expr rootD = new RootExpr(discriminant, IntExpr.TWO).simplify();
        Expr twoA = new ProdExpr(List.of(IntExpr.TWO, a));

        Expr sol1 = new DivExpr(new SumExpr(List.of(b.negate(), rootD)), twoA).simplify();
        Expr sol2 = new DivExpr(new SumExpr(List.of(b.negate(), rootD.negate())), twoA).simplify();

        if (sol1.structurallyEquals(sol2)) return List.of(sol1);
        return List.of(sol1, sol2);
    }

    /**
     * Coefficients [c0, c1, c2] of c2·x² + c1·x + c0, or null when some term uses
     * the variable in any other way (x³, x·x, sin x).
     */
    Expr[] getPolynomialCoeffs(Expr expr, String variable) {
        Expr c0 = IntExpr.ZERO;
        Expr c1 = IntExpr.ZERO;
        Expr c2 = IntExpr.ZERO;

        for (Expr term : termsOf(expr.simplify())) {
            if (isPowerOf(term, variable, 2)) {
                c2 = add(c2, IntExpr.ONE);
            } else if (isVariable(term, variable)) {
                c1 = add(c1, IntExpr.ONE);
            } else if (term instanceof ProdExpr) {
                List<Expr> factors = ((ProdExpr) term).getFactors();
                int squares = 0;
                int linears = 0;
                List<Expr> others = new ArrayList<>();
                for (Expr f : factors) {
                    if (isPowerOf(f, variable, 2)) {
                        squares++;
                    } else if (isVariable(f, variable)) {
                        linears++;
                    } else {
                        others.add(f);
                    }
                }
                if (squares + linears > 1 || dependsOn(others, variable)) return null;
                Expr coeff = others.isEmpty() ? IntExpr.ONE
                        : (others.size() == 1 ? others.get(0) : new ProdExpr(others));
                if (squares == 1) {
                    c2 = add(c2, coeff);
                } else if (linears == 1) {
                    c1 = add(c1, coeff);
                } else {
                    c0 = add(c0, term);
                }
            } else if (!term.variables().contains(variable)) {
                c0 = add(c0, term);
            } else {
                return null;
            }
        }
        return new Expr[]{c0, c1, c2};
    }

    Expr solveLinear(Expr combined, String variable) {
        Expr[] coeffs = getLinearCoeffs(combined, variable);
        if (coeffs == null || coeffs[0].isZero()) return null;
        // ax + b = 0
        return new DivExpr(coeffs[1].negate(), coeffs[0]).simplify();
    }

    private Expr[] getLinearCoeffs(Expr expr, String variable) {
        Expr a = IntExpr.ZERO;
        Expr b = IntExpr.ZERO;

        for (Expr term : termsOf(expr)) {
            if (isVariable(term, variable)) {
                a = add(a, IntExpr.ONE);
                continue;
            }
            Expr coeff = coefficientOf(term, variable);
            if (coeff != null) {
                a = add(a, coeff);
            } else if (!term.variables().contains(variable)) {
                b = add(b, term);
            } else {
                return null;
            }
        }
        return new Expr[]{a, b};
    }

    /**
     * Solve a square system of lines, each an equation or an expression equal to zero.
     */
    ExactResult solveLinearSystem(List<List<MathNode>> lines, Map<Integer, Expr> ansExpressions) {
        List<Map<String, Expr>> rowCoefficients = new ArrayList<>();
        List<Expr> constants = new ArrayList<>();
        Set<String> allVariables = new TreeSet<>();

        for (List<MathNode> line : lines) {
            int eqIndex = indexOfEquals(line);
            Expr left;
            Expr right;
            if (eqIndex >= 0) {
                left = MathNodeToExpr.convert(line.subList(0, eqIndex), ansExpressions);
                right = MathNodeToExpr.convert(line.subList(eqIndex + 1, line.size()), ansExpressions);
            } else {
                left = MathNodeToExpr.convert(line, ansExpressions);
                right = IntExpr.ZERO;
            }

            Expr combined = new SumExpr(List.of(left, right.negate())).simplify();
            Set<String> lineVariables = combined.variables();
            allVariables.addAll(lineVariables);

            Map<String, Expr> coeffs = new HashMap<>();
            Expr constant = IntExpr.ZERO;
            for (Expr term : termsOf(combined)) {
                boolean matched = false;
                for (String v : lineVariables) {
                    Expr coeff = isVariable(term, v) ? IntExpr.ONE : coefficientOf(term, v);
                    if (coeff != null) {
                        coeffs.merge(v, coeff, ExactEquationSolver::add);
                        matched = true;
                        break;
                    }
                }
                if (!matched) {
                    constant = add(constant, term);
                }
            }
            rowCoefficients.add(coeffs);
            constants.add(constant.negate().simplify());
        }

        List<String> variables = new ArrayList<>(allVariables);
        if (variables.isEmpty() || variables.size() != lines.size()) {
            LoggingUtil.debug("Exact system is not square: " + variables.size() + " unknowns, "
                    + lines.size() + " equations");
            return ExactResult.empty();
        }

        int n = variables.size();
        List<List<Expr>> matrix = new ArrayList<>();
        for (Map<String, Expr> row : rowCoefficients) {
            List<Expr> cells = new ArrayList<>();
            for (String v : variables) {
                cells.add(row.getOrDefault(v, IntExpr.ZERO));
            }
            matrix.add(cells);
        }

        Expr det = Determinants.of(matrix).simplify();
        if (det.isZero()) {
            LoggingUtil.debug("Exact system has no unique solution");
            return ExactResult.empty();
        }

        List<MathNode> display = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            List<List<Expr>> replaced = new ArrayList<>();
            for (int r = 0; r < n; r++) {
                List<Expr> row = new ArrayList<>(matrix.get(r));
                row.set(i, constants.get(r));
                replaced.add(row);
            }
            Expr solution = new DivExpr(Determinants.of(replaced).simplify(), det).simplify();

            if (i > 0) display.add(new NewlineNode());
            display.add(new LiteralNode(variables.get(i) + " = "));
            display.addAll(solution.toMathNode(settings));
        }
        return new ExactResult(IntExpr.ZERO, display, null, true);
    }

    /**
     * Coefficient of a product term that holds the variable exactly once, else null.
     */
    private static Expr coefficientOf(Expr term, String variable) {
        if (!(term instanceof ProdExpr)) return null;
        List<Expr> others = new ArrayList<>();
        int hits = 0;
        for (Expr f : ((ProdExpr) term).getFactors()) {
            if (isVariable(f, variable)) {
                hits++;
            } else {
                others.add(f);
            }
        }
        if (hits != 1 || dependsOn(others, variable)) return null;
        if (others.isEmpty()) return IntExpr.ONE;
        return others.size() == 1 ? others.get(0) : new ProdExpr(others);
    }

    private static boolean dependsOn(List<Expr> factors, String variable) {
        for (Expr f : factors) {
            if (f.variables().contains(variable)) return true;
        }
        return false;
    }

    private static boolean isVariable(Expr e, String variable) {
        return e instanceof VarExpr && ((VarExpr) e).getName().equals(variable);
    }

    private static boolean isPowerOf(Expr e, String variable, int exponent) {
        if (!(e instanceof PowExpr)) return false;
        PowExpr pow = (PowExpr) e;
        return isVariable(pow.getBase(), variable)
                && pow.getExponent() instanceof IntExpr
                && ((IntExpr) pow.getExponent()).getValue().equals(BigInteger.valueOf(exponent));
    }

    private static List<Expr> termsOf(Expr expr) {
        return expr instanceof SumExpr ? ((SumExpr) expr).getTerms() : List.of(expr);
    }

    private static Expr add(Expr a, Expr b) {
        return new SumExpr(List.of(a, b)).simplify();
    }

    private static Double approximate(Expr expr) {
        try {
            double value = expr.toDouble();
            return Double.isNaN(value) ? null : value;
        } catch (UnsupportedOperationException e) {
            LoggingUtil.debug("No numerical value for " + expr + ": " + e.getMessage());
            return null;
        }
    }

    static int indexOfEquals(List<MathNode> nodes) {
        for (int i = 0; i < nodes.size(); i++) {
            MathNode node = nodes.get(i);
            if (node instanceof LiteralNode && ((LiteralNode) node).getText().contains("=")) {
                return i;
            }
        }
        return -1;
    }
}
