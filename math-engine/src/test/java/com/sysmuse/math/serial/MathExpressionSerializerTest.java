package com.sysmuse.math.serial;

import com.sysmuse.math.node.AnsNode;
import com.sysmuse.math.node.ExponentNode;
import com.sysmuse.math.node.FractionNode;
import com.sysmuse.math.node.LiteralNode;
import com.sysmuse.math.node.LogNode;
import com.sysmuse.math.node.MathNode;
import com.sysmuse.math.node.ParenthesisNode;
import com.sysmuse.math.node.RootNode;
import com.sysmuse.math.node.SummationNode;
import com.sysmuse.math.node.TrigNode;
import com.sysmuse.math.node.UnitVectorNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.sysmuse.math.node.MathNode.text;
import static org.junit.jupiter.api.Assertions.*;

public class MathExpressionSerializerTest {

    @Test
    public void testStructuredNodesAreFullyParenthesized() {
        assertEquals("((1)/(2))", MathExpressionSerializer.serialize(List.of(new FractionNode(text("1"), text("2")))));
        assertEquals("(x+1)^(2)", MathExpressionSerializer.serialize(List.of(new ExponentNode(text("x+1"), text("2")))));
        assertEquals("((8)^(1/(3)))",
                MathExpressionSerializer.serialize(List.of(new RootNode(false, text("3"), text("8")))));
        assertEquals("sqrt(9)", MathExpressionSerializer.serialize(List.of(RootNode.squareRoot(text("9")))));
        assertEquals("(ln(8)/ln(2))",
                MathExpressionSerializer.serialize(List.of(new LogNode(false, text("2"), text("8")))));
        assertEquals("sum(n,1,10,n)", MathExpressionSerializer.serialize(
                List.of(new SummationNode(text("n"), text("1"), text("10"), text("n")))));
    }

    @Test
    public void testImplicitMultiplicationIsInserted() {
        assertEquals("2*x", MathExpressionSerializer.serialize(text("2x")));
        assertEquals("2*(x+1)", MathExpressionSerializer.serialize(
                List.of(new LiteralNode("2"), new ParenthesisNode(text("x+1")))));
        assertEquals("(1)*(2)", MathExpressionSerializer.serialize(
                List.of(new ParenthesisNode(text("1")), new ParenthesisNode(text("2")))));
        assertEquals("3*sin(x)", MathExpressionSerializer.serialize(
                List.of(new LiteralNode("3"), new TrigNode("sin", text("x")))));
    }

    @Test
    public void testScientificNotationIsNotSplit() {
        assertEquals("2E5+1", MathExpressionSerializer.serialize(text("2E5+1")));
    }

    @Test
    public void testSymbolsAndLeadingPlus() {
        assertEquals("ans0*2", MathExpressionSerializer.serialize(List.of(new AnsNode(0), new LiteralNode("*2"))));
        assertEquals("e_x", MathExpressionSerializer.serialize(List.of(new UnitVectorNode("x"))));
        assertEquals("3", MathExpressionSerializer.serialize(text("+3")));
        assertEquals("2*3-1", MathExpressionSerializer.serialize(text("2·3−1")));
    }

    @Test
    public void testExtractVariablesSkipsFunctionsAndBoundVariables() {
        List<MathNode> nodes = List.of(
                new LiteralNode("2x+y+"),
                new TrigNode("sin", text("t")),
                new LiteralNode("+"),
                new SummationNode(text("n"), text("1"), text("10"), text("n*k")));
        assertEquals(Set.of("x", "y", "t", "k"), MathExpressionSerializer.extractVariables(nodes));
    }

    @Test
    public void testSplitEquation() {
        String[] sides = MathExpressionSerializer.splitEquation(text("2x+3 = 7"));
        assertNotNull(sides);
        assertEquals("2*x+3", sides[0]);
        assertEquals("7", sides[1]);

        assertNull(MathExpressionSerializer.splitEquation(text("2x+3")));
        assertNull(MathExpressionSerializer.splitEquation(text("x=1=2")));
        assertTrue(MathExpressionSerializer.isEquation(text("x=1")));
    }
}
