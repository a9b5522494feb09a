package com.sysmuse.math.solve;

import com.sysmuse.math.convert.MathNodeToExpr;
import com.sysmuse.math.expr.ConstExpr;
import com.sysmuse.math.expr.DivExpr;
import com.sysmuse.math.expr.Expr;
import com.sysmuse.math.expr.LogExpr;
import com.sysmuse.math.expr.PowExpr;
import com.sysmuse.math.expr.ProdExpr;
import com.sysmuse.math.expr.RootExpr;
import com.sysmuse.math.expr.SumExpr;
import com.sysmuse.math.expr.TrigExpr;
import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.node.LiteralNode;
import com.sysmuse.math.node.MathNode;
import com.sysmuse.math.node.NewlineNode;
import com.sysmuse.util.LoggingUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Exact evaluation of editor node trees.
 *
 * <p>Plain expressions are converted to {@link Expr}, simplified and rendered
 * back to nodes together with a decimal approximation. Expressions holding '='
 * are solved as a single equation, multi-line input with '=' as a linear system.
 *
 * <p>Blank, unfinished and unevaluable input gives {@link ExactResult#empty()};
 * this class does not throw on user input.
 */
public class ExactMathEngine {

    private final FormatSettings settings;
    private final ExactEquationSolver equationSolver;

    public ExactMathEngine(FormatSettings settings) {
        this.settings = settings;
        this.equationSolver = new ExactEquationSolver(settings);
    }

    public FormatSettings getSettings() {
        return settings;
    }

    public ExactResult evaluate(List<MathNode> nodes) {
        return evaluate(nodes, null);
    }

    /**
     * @param ansExpressions exact values of earlier results by cell index; may be null
     */
    public ExactResult evaluate(List<MathNode> nodes, Map<Integer, Expr> ansExpressions) {
        try {
            if (ExpressionValidator.isEmptyExpression(nodes)) {
                return ExactResult.empty();
            }

            List<MathNode> normalized = ExpressionValidator.normalizeNodes(nodes);
            if (ExpressionValidator.isIncompleteExpression(normalized)) {
                LoggingUtil.debug("Expression is incomplete, nothing to evaluate");
                return ExactResult.empty();
            }

            if (normalized.stream().anyMatch(n -> n instanceof NewlineNode)) {
                return solveMultiLine(normalized, ansExpressions);
            }
            if (ExactEquationSolver.indexOfEquals(normalized) >= 0) {
                return equationSolver.solveSingleEquation(normalized, ansExpressions);
            }

            Expr simplified = MathNodeToExpr.convert(normalized, ansExpressions).simplify();
            Double numerical = approximate(simplified);

            if (numerical != null && numerical.isNaN()) {
                return ExactResult.empty();
            }
            if (numerical != null && numerical.isInfinite()) {
                List<MathNode> infinity = List.of(new LiteralNode(numerical < 0 ? "-∞" : "∞"));
                return new ExactResult(simplified, infinity, numerical, false);
            }

            return new ExactResult(simplified, simplified.toMathNode(settings), numerical,
                    hasIrrationalParts(simplified));
        } catch (RuntimeException e) {
            LoggingUtil.debug("Exact evaluation failed: " + e.getMessage(), e);
            return ExactResult.empty();
        }
    }

    /**
     * Display nodes of the result, or null when there is nothing to show.
     */
    public List<MathNode> evaluateToMathNode(List<MathNode> nodes) {
        ExactResult result = evaluate(nodes);
        if (result.hasError() || result.isEmpty()) return null;
        return result.getMathNodes();
    }

    public Double evaluateToDouble(List<MathNode> nodes) {
        ExactResult result = evaluate(nodes);
        if (result.isEmpty()) return null;
        return result.getNumerical();
    }

    private ExactResult solveMultiLine(List<MathNode> nodes, Map<Integer, Expr> ansExpressions) {
        List<List<MathNode>> lines = new ArrayList<>();
        List<MathNode> current = new ArrayList<>();
        for (MathNode node : nodes) {
            if (node instanceof NewlineNode) {
                if (!current.isEmpty()) lines.add(current);
                current = new ArrayList<>();
            } else {
                current.add(node);
            }
        }
        if (!current.isEmpty()) lines.add(current);
        if (lines.isEmpty()) return ExactResult.empty();

        boolean isSystem = lines.stream().anyMatch(line -> ExactEquationSolver.indexOfEquals(line) >= 0);
        if (isSystem) {
            return equationSolver.solveLinearSystem(lines, ansExpressions);
        }
        return evaluate(lines.get(0), ansExpressions);
    }

    private static Double approximate(Expr expr) {
        try {
            return expr.toDouble();
        } catch (UnsupportedOperationException e) {
            LoggingUtil.debug("Result has no numerical value: " + e.getMessage());
            return null;
        }
    }

    /**
     * True when simplification leaves a surd, logarithm, trig value or named
     * constant, so the symbolic form is worth showing beside the decimal.
     */
    static boolean hasIrrationalParts(Expr expr) {
        if (expr instanceof RootExpr) {
            Expr simplified = expr.simplify();
            return simplified instanceof RootExpr
                    || (simplified instanceof ProdExpr
                    && ((ProdExpr) simplified).getFactors().stream().anyMatch(f -> f instanceof RootExpr));
        }
        if (expr instanceof LogExpr) return expr.simplify() instanceof LogExpr;
        if (expr instanceof TrigExpr) return expr.simplify() instanceof TrigExpr;
        if (expr instanceof ConstExpr) return true;
        if (expr instanceof SumExpr) {
            return ((SumExpr) expr).getTerms().stream().anyMatch(ExactMathEngine::hasIrrationalParts);
        }
        if (expr instanceof ProdExpr) {
            return ((ProdExpr) expr).getFactors().stream().anyMatch(ExactMathEngine::hasIrrationalParts);
        }
        if (expr instanceof DivExpr) {
            DivExpr div = (DivExpr) expr;
            return hasIrrationalParts(div.getNumerator()) || hasIrrationalParts(div.getDenominator());
        }
        if (expr instanceof PowExpr) {
            PowExpr pow = (PowExpr) expr;
            return hasIrrationalParts(pow.getBase()) || hasIrrationalParts(pow.getExponent());
        }
        return false;
    }
}
