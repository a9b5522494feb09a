package com.sysmuse.math.convert;

import com.sysmuse.math.expr.Expr;
import com.sysmuse.math.expr.FracExpr;
import com.sysmuse.math.expr.IntExpr;
import com.sysmuse.math.node.AnsNode;
import com.sysmuse.math.node.DerivativeNode;
import com.sysmuse.math.node.ExponentNode;
import com.sysmuse.math.node.FractionNode;
import com.sysmuse.math.node.LiteralNode;
import com.sysmuse.math.node.MathNode;
import com.sysmuse.math.node.ParenthesisNode;
import com.sysmuse.math.node.SummationNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.sysmuse.math.node.MathNode.text;
import static org.junit.jupiter.api.Assertions.*;

public class MathNodeToExprTest {

    @Test
    public void testLiteralArithmetic() {
        Expr result = MathNodeToExpr.convert(text("2+3*4"), null);
        assertTrue(result.structurallyEquals(IntExpr.of(14)), "got " + result);
    }

    @Test
    public void testEmptyInputIsZero() {
        assertTrue(MathNodeToExpr.convert(List.of(), null).isZero());
    }

    @Test
    public void testFractionNodeReduces() {
        List<MathNode> nodes = List.of(new FractionNode(text("6"), text("8")));
        assertTrue(MathNodeToExpr.convert(nodes, null).structurallyEquals(FracExpr.of(3, 4)));
    }

    @Test
    public void testDecimalLiteralIsExact() {
        Expr half = MathNodeToExpr.convert(text("0.5"), null);
        assertTrue(half.structurallyEquals(FracExpr.of(1, 2)), "got " + half);
    }

    @Test
    public void testImplicitMultiplication() {
        List<MathNode> nodes = List.of(new LiteralNode("2"), new ParenthesisNode(text("3+4")));
        assertTrue(MathNodeToExpr.convert(nodes, null).structurallyEquals(IntExpr.of(14)));

        Expr twoX = MathNodeToExpr.convert(text("2x"), null);
        assertEquals(java.util.Set.of("x"), twoX.variables());
        assertTrue(twoX.substitute("x", IntExpr.of(3)).simplify().structurallyEquals(IntExpr.of(6)));
    }

    @Test
    public void testAnsReferenceUsesExactValue() {
        List<MathNode> nodes = List.of(new AnsNode(0), new LiteralNode("*2"));
        Expr result = MathNodeToExpr.convert(nodes, Map.of(0, IntExpr.of(21)));
        assertTrue(result.structurallyEquals(IntExpr.of(42)), "got " + result);
    }

    @Test
    public void testMissingAnsBecomesSymbol() {
        Expr result = MathNodeToExpr.convert(List.of(new AnsNode(3)), Map.of());
        assertTrue(result.variables().contains("ans3"));
    }

    @Test
    public void testSummationExpandsExactly() {
        List<MathNode> body = List.of(new ExponentNode(text("n"), text("2")));
        List<MathNode> nodes = List.of(new SummationNode(text("n"), text("1"), text("3"), body));
        assertTrue(MathNodeToExpr.convert(nodes, null).structurallyEquals(IntExpr.of(14)));

        List<MathNode> emptyRange = List.of(new SummationNode(text("n"), text("5"), text("1"), text("n")));
        assertTrue(MathNodeToExpr.convert(emptyRange, null).isZero());
    }

    @Test
    public void testDerivativeIsEvaluatedNumerically() {
        List<MathNode> body = List.of(new ExponentNode(text("x"), text("2")));
        List<MathNode> nodes = List.of(new DerivativeNode(text("x"), text("2"), body));
        Expr result = MathNodeToExpr.convert(nodes, null);
        assertTrue(result.variables().isEmpty());
        assertEquals(4.0, result.toDouble(), 1e-6);
    }

    @Test
    public void testDecimalToExprRoundsToTenPlaces() {
        assertTrue(MathNodeToExpr.decimalToExpr(3.0000000000001).structurallyEquals(IntExpr.of(3)));
        assertTrue(MathNodeToExpr.decimalToExpr(0.25).structurallyEquals(FracExpr.of(1, 4)));
    }
}
