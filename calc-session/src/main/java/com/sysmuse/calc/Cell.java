package com.sysmuse.calc;

import com.sysmuse.math.expr.Expr;
import com.sysmuse.math.node.MathNode;

import java.util.List;

/**
 * One calculator line: the edited expression, its formatted answer and, when the
 * exact engine produced one, the exact value used by later ANS references.
 */
public class Cell {

    private List<MathNode> expression;
    private String answer = "";
    private Expr exactValue;

    public Cell(List<MathNode> expression) {
        this.expression = List.copyOf(expression);
    }

    public List<MathNode> getExpression() {
        return expression;
    }

    void setExpression(List<MathNode> expression) {
        this.expression = List.copyOf(expression);
    }

    public String getAnswer() {
        return answer;
    }

    void setAnswer(String answer) {
        this.answer = answer == null ? "" : answer;
    }

    /**
     * Exact result of the last evaluation, or null when there was none.
     */
    public Expr getExactValue() {
        return exactValue;
    }

    void setExactValue(Expr exactValue) {
        this.exactValue = exactValue;
    }

    @Override
    public String toString() {
        return "Cell{expression=" + expression + ", answer='" + answer + "'}";
    }
}
