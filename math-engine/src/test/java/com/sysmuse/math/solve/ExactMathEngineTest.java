package com.sysmuse.math.solve;

import com.sysmuse.math.expr.FracExpr;
import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.node.AnsNode;
import com.sysmuse.math.node.ExponentNode;
import com.sysmuse.math.node.LiteralNode;
import com.sysmuse.math.node.MathNode;
import com.sysmuse.math.node.PermutationNode;
import com.sysmuse.math.node.RootNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.sysmuse.math.node.MathNode.text;
import static org.junit.jupiter.api.Assertions.*;

public class ExactMathEngineTest {

    private ExactMathEngine engine;

    @BeforeEach
    public void setup() {
        engine = new ExactMathEngine(FormatSettings.defaults());
    }

    @Test
    public void testRationalExpression() {
        ExactResult result = engine.evaluate(text("2+3"));
        assertFalse(result.isEmpty());
        assertFalse(result.isExact());
        assertEquals(5.0, result.getNumerical(), 1e-12);
        assertEquals("5", result.toExactString());
    }

    @Test
    public void testSurdKeepsExactForm() {
        ExactResult result = engine.evaluate(List.of(RootNode.squareRoot(text("8"))));
        assertTrue(result.isExact());
        assertEquals(2 * Math.sqrt(2), result.getNumerical(), 1e-9);
        assertEquals("2.828427", result.toNumericalString(FormatSettings.defaults()));
    }

    @Test
    public void testLargePermutationEvaluatesToInfinity() {
        ExactResult small = engine.evaluate(List.of(new PermutationNode(text("5"), text("2"))));
        assertEquals("20", small.toExactString());

        ExactResult large = engine.evaluate(List.of(new PermutationNode(text("300000"), text("300000"))));
        assertEquals("∞", large.toExactString());
        assertFalse(large.isExact());
    }

    @Test
    public void testQuadraticEquation() {
        List<MathNode> nodes = List.of(
                new ExponentNode(text("x"), text("2")),
                new LiteralNode("-5x+6=0"));
        ExactResult result = engine.evaluate(nodes);
        assertEquals("x = 3\nx = 2", result.toExactString());
        assertTrue(result.isExact());
    }

    @Test
    public void testLinearEquation() {
        ExactResult result = engine.evaluate(text("2x+3=7"));
        assertEquals("x = 2", result.toExactString());
        assertEquals(2.0, result.getNumerical(), 1e-12);
    }

    @Test
    public void testLinearSystem() {
        ExactResult result = engine.evaluate(text("x+y=3\nx-y=1"));
        assertEquals("x = 2\ny = 1", result.toExactString());
    }

    @Test
    public void testEquationInTwoUnknownsIsEmpty() {
        assertTrue(engine.evaluate(text("x+y=3")).isEmpty());
    }

    @Test
    public void testDivisionByZeroShowsInfinity() {
        ExactResult result = engine.evaluate(text("1/0"));
        assertEquals("∞", result.toExactString());
        assertFalse(result.isExact());
    }

    @Test
    public void testBlankAndUnfinishedInputAreEmpty() {
        assertTrue(engine.evaluate(text("")).isEmpty());
        assertTrue(engine.evaluate(text("2+")).isEmpty());
        assertTrue(engine.evaluate(List.of()).isEmpty());
        assertNull(engine.evaluateToMathNode(text("2*")));
        assertNull(engine.evaluateToDouble(text(" ")));
    }

    @Test
    public void testAnsReferenceUsesExactValue() {
        List<MathNode> nodes = List.of(new AnsNode(0), new LiteralNode("+1"));
        ExactResult result = engine.evaluate(nodes, Map.of(0, FracExpr.of(1, 2)));
        assertEquals(1.5, result.getNumerical(), 1e-12);

        ExactResult typed = engine.evaluate(text("ans0*4"), Map.of(0, FracExpr.of(1, 2)));
        assertEquals(2.0, typed.getNumerical(), 1e-12);
    }
}
