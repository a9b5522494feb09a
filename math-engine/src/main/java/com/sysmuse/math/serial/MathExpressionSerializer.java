package com.sysmuse.math.serial;

import com.sysmuse.math.node.AnsNode;
import com.sysmuse.math.node.CombinationNode;
import com.sysmuse.math.node.ConstantNode;
import com.sysmuse.math.node.DerivativeNode;
import com.sysmuse.math.node.ExponentNode;
import com.sysmuse.math.node.FractionNode;
import com.sysmuse.math.node.IntegralNode;
import com.sysmuse.math.node.LiteralNode;
import com.sysmuse.math.node.LogNode;
import com.sysmuse.math.node.MathNode;
import com.sysmuse.math.node.NewlineNode;
import com.sysmuse.math.node.ParenthesisNode;
import com.sysmuse.math.node.PermutationNode;
import com.sysmuse.math.node.ProductNode;
import com.sysmuse.math.node.RootNode;
import com.sysmuse.math.node.SummationNode;
import com.sysmuse.math.node.TrigNode;
import com.sysmuse.math.node.UnitVectorNode;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flattens a node tree into a PEMDAS string for the numeric solver.
 *
 * Every structured node is written with explicit parentheses, so precedence
 * never depends on where the node sits, and implicit multiplication is made explicit.
 */
public final class MathExpressionSerializer {

    private static final List<String> FUNCTION_NAMES = Arrays.asList(
            "sin", "cos", "tan", "asin", "acos", "atan",
            "sinh", "cosh", "tanh", "asinh", "acosh", "atanh",
            "log", "ln", "sqrt", "abs", "diff", "int", "perm", "comb", "sum", "prod");

    private static final Set<String> NON_VARIABLES = new LinkedHashSet<>(Arrays.asList(
            "sin", "cos", "tan", "asin", "acos", "atan",
            "sinh", "cosh", "tanh", "asinh", "acosh", "atanh",
            "log", "ln", "sqrt", "abs", "sum", "prod", "perm", "comb", "P", "C", "i"));

    private static final Pattern WORD = Pattern.compile("[a-zA-Z]+");

    private MathExpressionSerializer() {
    }

    public static String serialize(List<MathNode> nodes) {
        String result = addImplicitMultiplication(serializeList(nodes));
        if (result.startsWith("+")) {
            result = result.substring(1);
        }
        return result;
    }

    private static String serializeList(List<MathNode> nodes) {
        StringBuilder sb = new StringBuilder();
        for (MathNode node : nodes) {
            sb.append(serializeNode(node));
        }
        return sb.toString();
    }

    private static String serializeNode(MathNode node) {
        if (node instanceof LiteralNode) {
            return normalizeLiteral(((LiteralNode) node).getText());
        } else if (node instanceof NewlineNode) {
            return "\n";
        } else if (node instanceof FractionNode) {
            FractionNode frac = (FractionNode) node;
            return "((" + serializeList(frac.getNumerator()) + ")/(" + serializeList(frac.getDenominator()) + "))";
        } else if (node instanceof ExponentNode) {
            ExponentNode exp = (ExponentNode) node;
            String base = serializeList(exp.getBase());
            if (containsOperators(base)) {
                base = "(" + base + ")";
            }
            return base + "^(" + serializeList(exp.getPower()) + ")";
        } else if (node instanceof ParenthesisNode) {
            return "(" + serializeList(((ParenthesisNode) node).getContent()) + ")";
        } else if (node instanceof TrigNode) {
            TrigNode trig = (TrigNode) node;
            return trig.getFunction() + "(" + serializeList(trig.getArgument()) + ")";
        } else if (node instanceof LogNode) {
            LogNode log = (LogNode) node;
            String arg = serializeList(log.getArgument());
            if (log.isNaturalLog()) {
                return "ln(" + arg + ")";
            }
            // log_b(x) = ln(x)/ln(b)
            return "(ln(" + arg + ")/ln(" + serializeList(log.getBase()) + "))";
        } else if (node instanceof RootNode) {
            RootNode root = (RootNode) node;
            String radicand = serializeList(root.getRadicand());
            if (root.isSquareRoot()) {
                return "sqrt(" + radicand + ")";
            }
            return "((" + radicand + ")^(1/(" + serializeList(root.getIndex()) + ")))";
        } else if (node instanceof PermutationNode) {
            PermutationNode perm = (PermutationNode) node;
            return "perm(" + serializeList(perm.getN()) + "," + serializeList(perm.getR()) + ")";
        } else if (node instanceof CombinationNode) {
            CombinationNode comb = (CombinationNode) node;
            return "comb(" + serializeList(comb.getN()) + "," + serializeList(comb.getR()) + ")";
        } else if (node instanceof SummationNode) {
            SummationNode sum = (SummationNode) node;
            return "sum(" + series(sum.getVariable(), sum.getLower(), sum.getUpper(), sum.getBody()) + ")";
        } else if (node instanceof ProductNode) {
            ProductNode prod = (ProductNode) node;
            return "prod(" + series(prod.getVariable(), prod.getLower(), prod.getUpper(), prod.getBody()) + ")";
        } else if (node instanceof DerivativeNode) {
            DerivativeNode diff = (DerivativeNode) node;
            return "diff(" + serializeList(diff.getVariable()) + "," + serializeList(diff.getAt()) + ","
                    + serializeList(diff.getBody()) + ")";
        } else if (node instanceof IntegralNode) {
            IntegralNode integral = (IntegralNode) node;
            return "int(" + series(integral.getVariable(), integral.getLower(), integral.getUpper(),
                    integral.getBody()) + ")";
        } else if (node instanceof AnsNode) {
            return "ans" + serializeList(((AnsNode) node).getIndex());
        } else if (node instanceof ConstantNode) {
            return ((ConstantNode) node).getConstant();
        } else if (node instanceof UnitVectorNode) {
            return "e_" + ((UnitVectorNode) node).getAxis();
        }
        return "";
    }

    private static String series(List<MathNode> variable, List<MathNode> lower, List<MathNode> upper,
                                 List<MathNode> body) {
        return serializeList(variable) + "," + serializeList(lower) + "," + serializeList(upper) + ","
                + serializeList(body);
    }

    private static String normalizeLiteral(String text) {
        return text.replace('·', '*').replace('−', '-');
    }

    private static boolean containsOperators(String expr) {
        return expr.contains("+") || expr.contains("-") || expr.contains("*") || expr.contains("/");
    }

    /**
     * Insert '*' for 2x, 2(x), (x)2, (x)y, (x)(y) and x(y) where x is not a function name.
     * Scientific notation such as 2E5 is left alone.
     */
    static String addImplicitMultiplication(String expr) {
        StringBuilder result = new StringBuilder();

        for (int i = 0; i < expr.length(); i++) {
            char current = expr.charAt(i);
            result.append(current);
            if (i == expr.length() - 1) {
                continue;
            }
            char next = expr.charAt(i + 1);

            boolean scientific = isDigit(current) && (next == 'E' || next == 'e')
                    && i + 2 < expr.length()
                    && (isDigit(expr.charAt(i + 2)) || expr.charAt(i + 2) == '+' || expr.charAt(i + 2) == '-');

            boolean permCombOperator = (next == 'P' || next == 'C') && isDigit(current)
                    && i + 2 < expr.length()
                    && (isDigit(expr.charAt(i + 2)) || expr.charAt(i + 2) == '(');

            boolean needsMultiply;
            if (isDigit(current) && isLetter(next)) {
                needsMultiply = !permCombOperator && !scientific;
            } else if (isDigit(current) && next == '(') {
                needsMultiply = true;
            } else if (current == ')' && (isDigit(next) || isLetter(next) || next == '(')) {
                needsMultiply = true;
            } else if (isLetter(current) && next == '(') {
                needsMultiply = !endsWithFunctionName(expr, i);
            } else {
                needsMultiply = false;
            }

            if (needsMultiply) {
                result.append('*');
            }
        }

        return result.toString();
    }

    private static boolean endsWithFunctionName(String expr, int index) {
        String upToIndex = expr.substring(0, index + 1);
        for (String func : FUNCTION_NAMES) {
            if (upToIndex.endsWith(func)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isDigit(char c) {
        return (c >= '0' && c <= '9') || c == '.';
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    /**
     * Names of free variables in the tree. Bound variables of sums, products,
     * derivatives and integrals are excluded, as are function names and {@code i}.
     */
    public static Set<String> extractVariables(List<MathNode> nodes) {
        Set<String> variables = new LinkedHashSet<>();
        extractFromList(nodes, variables);
        return variables;
    }

    private static void extractFromList(List<MathNode> nodes, Set<String> variables) {
        for (MathNode node : nodes) {
            extractFromNode(node, variables);
        }
    }

    private static void extractFromNode(MathNode node, Set<String> variables) {
        if (node instanceof LiteralNode) {
            Matcher matcher = WORD.matcher(((LiteralNode) node).getText());
            while (matcher.find()) {
                if (!NON_VARIABLES.contains(matcher.group())) {
                    variables.add(matcher.group());
                }
            }
        } else if (node instanceof FractionNode) {
            extractFromList(((FractionNode) node).getNumerator(), variables);
            extractFromList(((FractionNode) node).getDenominator(), variables);
        } else if (node instanceof ExponentNode) {
            extractFromList(((ExponentNode) node).getBase(), variables);
            extractFromList(((ExponentNode) node).getPower(), variables);
        } else if (node instanceof ParenthesisNode) {
            extractFromList(((ParenthesisNode) node).getContent(), variables);
        } else if (node instanceof LogNode) {
            extractFromList(((LogNode) node).getBase(), variables);
            extractFromList(((LogNode) node).getArgument(), variables);
        } else if (node instanceof TrigNode) {
            extractFromList(((TrigNode) node).getArgument(), variables);
        } else if (node instanceof RootNode) {
            extractFromList(((RootNode) node).getIndex(), variables);
            extractFromList(((RootNode) node).getRadicand(), variables);
        } else if (node instanceof PermutationNode) {
            extractFromList(((PermutationNode) node).getN(), variables);
            extractFromList(((PermutationNode) node).getR(), variables);
        } else if (node instanceof CombinationNode) {
            extractFromList(((CombinationNode) node).getN(), variables);
            extractFromList(((CombinationNode) node).getR(), variables);
        } else if (node instanceof SummationNode) {
            SummationNode sum = (SummationNode) node;
            extractBound(sum.getVariable(), variables, sum.getLower(), sum.getUpper(), sum.getBody());
        } else if (node instanceof ProductNode) {
            ProductNode prod = (ProductNode) node;
            extractBound(prod.getVariable(), variables, prod.getLower(), prod.getUpper(), prod.getBody());
        } else if (node instanceof IntegralNode) {
            IntegralNode integral = (IntegralNode) node;
            extractBound(integral.getVariable(), variables, integral.getLower(), integral.getUpper(),
                    integral.getBody());
        } else if (node instanceof DerivativeNode) {
            DerivativeNode diff = (DerivativeNode) node;
            extractBound(diff.getVariable(), variables, diff.getAt(), diff.getBody());
        }
        // ans, constants and unit vectors hold no variables
    }

    @SafeVarargs
    private static void extractBound(List<MathNode> boundVariable, Set<String> variables, List<MathNode>... slots) {
        Set<String> inner = new LinkedHashSet<>();
        for (List<MathNode> slot : slots) {
            extractFromList(slot, inner);
        }
        String bound = serializeList(boundVariable).trim();
        if (!bound.isEmpty()) {
            inner.remove(bound);
        }
        variables.addAll(inner);
    }

    public static boolean isEquation(List<MathNode> nodes) {
        return serialize(nodes).contains("=");
    }

    /**
     * Split "lhs=rhs" into its two sides, or null when there is not exactly one '='.
     */
    public static String[] splitEquation(List<MathNode> nodes) {
        String expr = serialize(nodes);
        if (!expr.contains("=")) {
            return null;
        }
        String[] parts = expr.split("=", -1);
        if (parts.length != 2) {
            return null;
        }
        return new String[]{parts[0].trim(), parts[1].trim()};
    }
}
