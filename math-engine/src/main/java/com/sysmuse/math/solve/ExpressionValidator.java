package com.sysmuse.math.solve;

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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides whether an expression being typed is ready to evaluate.
 *
 * Empty and incomplete expressions are normal states while editing; callers
 * show an empty result for them rather than an error.
 */
public final class ExpressionValidator {

    private static final String EMPTY_FIELD = "EMPTY_FIELD";

    private static final Pattern OPERATOR_GLYPHS = Pattern.compile("[+\\-*/^·×÷−]");
    // Sign pairs like "+-" and "*-" are allowed
    private static final Pattern CONSECUTIVE_OPERATORS = Pattern.compile("[+\\-*/^][*/^]");

    private ExpressionValidator() {
    }

    /**
     * True when the expression holds nothing but whitespace, operators and line breaks.
     */
    public static boolean isEmptyExpression(List<MathNode> nodes) {
        if (nodes == null || nodes.isEmpty()) return true;

        for (MathNode node : nodes) {
            if (node instanceof LiteralNode) {
                String text = OPERATOR_GLYPHS.matcher(((LiteralNode) node).getText()).replaceAll("").trim();
                if (!text.isEmpty()) return false;
            } else if (!(node instanceof NewlineNode)) {
                return false;
            }
        }
        return true;
    }

    /**
     * True when the expression ends in an operator or '(', starts with '*', '/' or '^',
     * has two operators in a row, or leaves a required field of a structured node
     * empty or malformed.
     */
    public static boolean isIncompleteExpression(List<MathNode> nodes) {
        String serialized = serializeForValidation(nodes).trim();
        if (serialized.isEmpty()) return true;
        if (hasOperatorProblems(serialized)) return true;
        return hasEmptyRequiredFields(nodes);
    }

    /**
     * Split literals at embedded line breaks and '=' so that both become separate nodes.
     */
    public static List<MathNode> normalizeNodes(List<MathNode> nodes) {
        List<MathNode> result = new ArrayList<>();
        for (MathNode node : nodes) {
            if (!(node instanceof LiteralNode)) {
                result.add(node);
                continue;
            }
            String text = ((LiteralNode) node).getText();
            if (!text.contains("\n") && !text.contains("=")) {
                result.add(node);
                continue;
            }

            String[] lines = text.split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                if (i > 0) {
                    result.add(new NewlineNode());
                }
                String[] sides = lines[i].split("=", -1);
                for (int j = 0; j < sides.length; j++) {
                    if (j > 0) {
                        result.add(new LiteralNode("="));
                    }
                    if (!sides[j].isEmpty()) {
                        result.add(new LiteralNode(sides[j]));
                    }
                }
            }
        }
        return result;
    }

    static boolean isNodeListEmpty(List<MathNode> nodes) {
        if (nodes == null || nodes.isEmpty()) return true;
        for (MathNode node : nodes) {
            if (node instanceof LiteralNode) {
                if (!((LiteralNode) node).getText().trim().isEmpty()) return false;
            } else if (!(node instanceof NewlineNode)) {
                return false;
            }
        }
        return true;
    }

    private static boolean hasOperatorProblems(String text) {
        String normalized = text.replace('·', '*').replace('×', '*').replace('−', '-').replace('÷', '/');
        return endsWithOperator(normalized)
                || startsWithInvalidOperator(normalized)
                || CONSECUTIVE_OPERATORS.matcher(normalized).find();
    }

    private static boolean endsWithOperator(String text) {
        char last = text.charAt(text.length() - 1);
        return last == '+' || last == '-' || last == '*' || last == '/' || last == '^' || last == '(';
    }

    private static boolean startsWithInvalidOperator(String text) {
        char first = text.charAt(0);
        return first == '*' || first == '/' || first == '^';
    }

    /**
     * A field is bad when it is empty, malformed, or itself holds a bad field.
     */
    private static boolean isBadField(List<MathNode> field) {
        if (isNodeListEmpty(field)) return true;
        String content = serializeForValidation(field).trim();
        if (!content.isEmpty() && hasOperatorProblems(content)) return true;
        return hasEmptyRequiredFields(field);
    }

    private static boolean hasEmptyRequiredFields(List<MathNode> nodes) {
        for (MathNode node : nodes) {
            if (node instanceof FractionNode) {
                FractionNode frac = (FractionNode) node;
                if (isBadField(frac.getNumerator()) || isBadField(frac.getDenominator())) return true;
            } else if (node instanceof ExponentNode) {
                ExponentNode exp = (ExponentNode) node;
                if (isBadField(exp.getBase()) || isBadField(exp.getPower())) return true;
            } else if (node instanceof RootNode) {
                RootNode root = (RootNode) node;
                if (isBadField(root.getRadicand())) return true;
                if (!root.isSquareRoot() && isBadField(root.getIndex())) return true;
            } else if (node instanceof LogNode) {
                LogNode log = (LogNode) node;
                if (isBadField(log.getArgument())) return true;
                if (!log.isNaturalLog() && isBadField(log.getBase())) return true;
            } else if (node instanceof TrigNode) {
                if (isBadField(((TrigNode) node).getArgument())) return true;
            } else if (node instanceof ParenthesisNode) {
                if (isBadField(((ParenthesisNode) node).getContent())) return true;
            } else if (node instanceof PermutationNode) {
                PermutationNode perm = (PermutationNode) node;
                if (isBadField(perm.getN()) || isBadField(perm.getR())) return true;
            } else if (node instanceof CombinationNode) {
                CombinationNode comb = (CombinationNode) node;
                if (isBadField(comb.getN()) || isBadField(comb.getR())) return true;
            } else if (node instanceof SummationNode) {
                SummationNode sum = (SummationNode) node;
                if (isBadField(sum.getVariable()) || isBadField(sum.getLower())
                        || isBadField(sum.getUpper()) || isBadField(sum.getBody())) return true;
            } else if (node instanceof ProductNode) {
                ProductNode prod = (ProductNode) node;
                if (isBadField(prod.getVariable()) || isBadField(prod.getLower())
                        || isBadField(prod.getUpper()) || isBadField(prod.getBody())) return true;
            } else if (node instanceof IntegralNode) {
                IntegralNode integral = (IntegralNode) node;
                if (isBadField(integral.getVariable()) || isBadField(integral.getLower())
                        || isBadField(integral.getUpper()) || isBadField(integral.getBody())) return true;
            } else if (node instanceof DerivativeNode) {
                DerivativeNode diff = (DerivativeNode) node;
                if (isBadField(diff.getVariable()) || isBadField(diff.getAt())
                        || isBadField(diff.getBody())) return true;
            }
        }
        return false;
    }

    /**
     * Rough text form used only for the operator checks. Structured nodes become
     * self-contained groups so their contents never join with the surrounding text.
     */
    static String serializeForValidation(List<MathNode> nodes) {
        StringBuilder sb = new StringBuilder();
        for (MathNode node : nodes) {
            if (node instanceof LiteralNode) {
                sb.append(((LiteralNode) node).getText());
            } else if (node instanceof ConstantNode) {
                sb.append(((ConstantNode) node).getConstant());
            } else if (node instanceof FractionNode) {
                FractionNode frac = (FractionNode) node;
                sb.append(group("(", ")", "/", frac.getNumerator(), frac.getDenominator()));
            } else if (node instanceof ExponentNode) {
                ExponentNode exp = (ExponentNode) node;
                sb.append(group("(", ")", "^", exp.getBase(), exp.getPower()));
            } else if (node instanceof RootNode) {
                sb.append(group("sqrt(", ")", ",", ((RootNode) node).getRadicand()));
            } else if (node instanceof LogNode) {
                sb.append(group("log(", ")", ",", ((LogNode) node).getArgument()));
            } else if (node instanceof TrigNode) {
                TrigNode trig = (TrigNode) node;
                sb.append(group(trig.getFunction() + "(", ")", ",", trig.getArgument()));
            } else if (node instanceof ParenthesisNode) {
                sb.append(group("(", ")", ",", ((ParenthesisNode) node).getContent()));
            } else if (node instanceof PermutationNode) {
                PermutationNode perm = (PermutationNode) node;
                sb.append(group("P(", ")", ",", perm.getN(), perm.getR()));
            } else if (node instanceof CombinationNode) {
                CombinationNode comb = (CombinationNode) node;
                sb.append(group("C(", ")", ",", comb.getN(), comb.getR()));
            } else if (node instanceof SummationNode) {
                SummationNode sum = (SummationNode) node;
                sb.append(group("sum(", ")", ",", sum.getLower(), sum.getUpper(), sum.getBody()));
            } else if (node instanceof ProductNode) {
                ProductNode prod = (ProductNode) node;
                sb.append(group("prod(", ")", ",", prod.getLower(), prod.getUpper(), prod.getBody()));
            } else if (node instanceof IntegralNode) {
                IntegralNode integral = (IntegralNode) node;
                sb.append(group("int(", ")", ",", integral.getLower(), integral.getUpper(), integral.getBody()));
            } else if (node instanceof DerivativeNode) {
                DerivativeNode diff = (DerivativeNode) node;
                sb.append(group("diff(", ")", ",", diff.getAt(), diff.getBody()));
            } else if (node instanceof AnsNode) {
                sb.append("ans");
            } else if (node instanceof UnitVectorNode) {
                sb.append("e_").append(((UnitVectorNode) node).getAxis());
            }
        }
        return sb.toString();
    }

    @SafeVarargs
    private static String group(String open, String close, String separator, List<MathNode>... fields) {
        List<String> parts = new ArrayList<>();
        for (List<MathNode> field : fields) {
            String part = serializeForValidation(field);
            if (part.trim().isEmpty()) {
                return EMPTY_FIELD;
            }
            parts.add(part);
        }
        return open + String.join(separator, parts) + close;
    }
}
