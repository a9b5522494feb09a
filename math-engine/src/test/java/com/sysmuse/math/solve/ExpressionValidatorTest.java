package com.sysmuse.math.solve;

import com.sysmuse.math.node.FractionNode;
import com.sysmuse.math.node.LiteralNode;
import com.sysmuse.math.node.MathNode;
import com.sysmuse.math.node.NewlineNode;
import com.sysmuse.math.node.ParenthesisNode;
import com.sysmuse.math.node.SummationNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.sysmuse.math.node.MathNode.text;
import static org.junit.jupiter.api.Assertions.*;

public class ExpressionValidatorTest {

    @Test
    public void testEmptyExpressions() {
        assertTrue(ExpressionValidator.isEmptyExpression(null));
        assertTrue(ExpressionValidator.isEmptyExpression(List.of()));
        assertTrue(ExpressionValidator.isEmptyExpression(text("  + ")));
        assertTrue(ExpressionValidator.isEmptyExpression(List.of(new NewlineNode(), new LiteralNode("−"))));
        assertFalse(ExpressionValidator.isEmptyExpression(text("2")));
        assertFalse(ExpressionValidator.isEmptyExpression(
                List.of(new FractionNode(MathNode.placeholder(), MathNode.placeholder()))));
    }

    @Test
    public void testOperatorProblemsMakeExpressionIncomplete() {
        assertTrue(ExpressionValidator.isIncompleteExpression(text("2+")));
        assertTrue(ExpressionValidator.isIncompleteExpression(text("*2")));
        assertTrue(ExpressionValidator.isIncompleteExpression(text("2*/3")));
        assertTrue(ExpressionValidator.isIncompleteExpression(text("sin(")));
        assertFalse(ExpressionValidator.isIncompleteExpression(text("2*-3")));
        assertFalse(ExpressionValidator.isIncompleteExpression(text("-2+3")));
    }

    @Test
    public void testEmptyFieldsMakeExpressionIncomplete() {
        assertTrue(ExpressionValidator.isIncompleteExpression(
                List.of(new FractionNode(text("1"), MathNode.placeholder()))));
        assertTrue(ExpressionValidator.isIncompleteExpression(
                List.of(new ParenthesisNode(List.of(new FractionNode(text("1"), text("")))))));
        assertTrue(ExpressionValidator.isIncompleteExpression(
                List.of(new SummationNode(text("n"), text("1"), text("10"), text("n+")))));
        assertFalse(ExpressionValidator.isIncompleteExpression(
                List.of(new FractionNode(text("1"), text("2")))));
    }

    @Test
    public void testNormalizeSplitsLinesAndEquals() {
        List<MathNode> normalized = ExpressionValidator.normalizeNodes(text("x+y=3\nx-y=1"));
        List<MathNode> expected = List.of(
                new LiteralNode("x+y"), new LiteralNode("="), new LiteralNode("3"),
                new NewlineNode(),
                new LiteralNode("x-y"), new LiteralNode("="), new LiteralNode("1"));
        assertEquals(expected, normalized);
    }

    @Test
    public void testNormalizeKeepsOtherNodes() {
        FractionNode half = new FractionNode(text("1"), text("2"));
        List<MathNode> nodes = List.of(half, new LiteralNode("+1"));
        assertEquals(nodes, ExpressionValidator.normalizeNodes(nodes));
    }

    @Test
    public void testValidationTextMarksEmptyFields() {
        String text = ExpressionValidator.serializeForValidation(
                List.of(new FractionNode(text("1"), MathNode.placeholder())));
        assertEquals("EMPTY_FIELD", text);
    }
}
