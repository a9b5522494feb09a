package com.sysmuse.math.solve;

import com.sysmuse.math.expr.Expr;
import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.format.NumberFormatter;
import com.sysmuse.math.node.LiteralNode;
import com.sysmuse.math.node.MathNode;
import com.sysmuse.math.node.NewlineNode;
import com.sysmuse.math.serial.MathExpressionSerializer;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of an exact evaluation: the simplified expression, its display nodes
 * and a numerical approximation.
 *
 * An empty result means there was nothing to show yet (blank or unfinished input);
 * an error result carries a message instead of a value.
 */
public final class ExactResult {

    private static final ExactResult EMPTY = new ExactResult(null, Collections.emptyList(), null, false, null, true);

    private final Expr expr;
    private final List<MathNode> mathNodes;
    private final Double numerical;
    private final boolean exact;
    private final String error;
    private final boolean empty;

    public ExactResult(Expr expr, List<MathNode> mathNodes, Double numerical, boolean exact) {
        this(expr, mathNodes, numerical, exact, null, false);
    }

    private ExactResult(Expr expr, List<MathNode> mathNodes, Double numerical, boolean exact,
                        String error, boolean empty) {
        this.expr = expr;
        this.mathNodes = mathNodes == null ? Collections.emptyList() : List.copyOf(mathNodes);
        this.numerical = numerical;
        this.exact = exact;
        this.error = error;
        this.empty = empty;
    }

    public static ExactResult empty() {
        return EMPTY;
    }

    public static ExactResult error(String message) {
        return new ExactResult(null, Collections.emptyList(), null, false, message, false);
    }

    public Expr getExpr() {
        return expr;
    }

    public List<MathNode> getMathNodes() {
        return mathNodes;
    }

    public Double getNumerical() {
        return numerical;
    }

    /**
     * True when the symbolic form keeps irrational parts (surds, logs, trig, constants),
     * i.e. it says more than the decimal approximation.
     */
    public boolean isExact() {
        return exact;
    }

    public String getError() {
        return error;
    }

    public boolean hasError() {
        return error != null;
    }

    public boolean isEmpty() {
        return empty;
    }

    /**
     * Plain-text rendering of the display nodes. Literals are kept as typed,
     * structured nodes use the calculator string form and line breaks become "\n".
     */
    public String toExactString() {
        if (empty || hasError()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        appendText(mathNodes, sb);
        return sb.toString();
    }

    private static void appendText(List<MathNode> nodes, StringBuilder sb) {
        for (MathNode node : nodes) {
            if (node instanceof LiteralNode) {
                sb.append(((LiteralNode) node).getText());
            } else if (node instanceof NewlineNode) {
                sb.append('\n');
            } else {
                sb.append(MathExpressionSerializer.serialize(List.of(node)));
            }
        }
    }

    public String toNumericalString(FormatSettings settings) {
        if (empty || numerical == null || numerical.isNaN()) {
            return "";
        }
        return new NumberFormatter(settings).format(numerical);
    }

    @Override
    public String toString() {
        if (empty) return "ExactResult{empty}";
        if (hasError()) return "ExactResult{error='" + error + "'}";
        return "ExactResult{expr=" + expr + ", numerical=" + numerical + ", exact=" + exact + "}";
    }
}
