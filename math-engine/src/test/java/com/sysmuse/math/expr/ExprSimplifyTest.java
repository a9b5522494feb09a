package com.sysmuse.math.expr;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExprSimplifyTest {

    private static final VarExpr X = new VarExpr("x");

    @Test
    public void testSquareRootExtractsPerfectSquares() {
        Expr root72 = RootExpr.sqrt(IntExpr.of(72)).simplify();
        Expr expected = new ProdExpr(List.of(IntExpr.of(6), RootExpr.sqrt(IntExpr.TWO)));
        assertTrue(root72.structurallyEquals(expected), "got " + root72);

        Expr root49 = RootExpr.sqrt(IntExpr.of(49)).simplify();
        assertTrue(root49 instanceof IntExpr);
        assertEquals(7, ((IntExpr) root49).getValue().intValue());
    }

    @Test
    public void testOddRootOfNegativeAndEvenRootKeptSymbolic() {
        Expr cubeRoot = new RootExpr(IntExpr.of(-27), IntExpr.of(3)).simplify();
        assertTrue(cubeRoot.structurallyEquals(IntExpr.of(-3)));

        Expr evenRoot = RootExpr.sqrt(IntExpr.of(-4)).simplify();
        assertTrue(evenRoot instanceof RootExpr);
    }

    @Test
    public void testLikeSurdsCombine() {
        Expr sum = new SumExpr(List.of(
                new ProdExpr(List.of(IntExpr.of(3), RootExpr.sqrt(IntExpr.TWO))),
                new ProdExpr(List.of(IntExpr.of(5), RootExpr.sqrt(IntExpr.TWO))))).simplify();
        Expr expected = new ProdExpr(List.of(IntExpr.of(8), RootExpr.sqrt(IntExpr.TWO)));
        assertTrue(sum.structurallyEquals(expected), "got " + sum);
    }

    @Test
    public void testVariableCancels() {
        Expr difference = new SumExpr(List.of(X, X.negate())).simplify();
        assertTrue(difference.isZero());
    }

    @Test
    public void testFractionsReduce() {
        assertTrue(FracExpr.of(6, 8).simplify().structurallyEquals(FracExpr.of(3, 4)));
        Expr whole = FracExpr.of(4, 2).simplify();
        assertTrue(whole instanceof IntExpr);
        assertEquals(2, ((IntExpr) whole).getValue().intValue());
        assertTrue(FracExpr.of(3, -6).simplify().structurallyEquals(FracExpr.of(-1, 2)));
    }

    @Test
    public void testRationalPowersAreExact() {
        Expr squared = new PowExpr(FracExpr.of(2, 3), IntExpr.TWO).simplify();
        assertTrue(squared.structurallyEquals(FracExpr.of(4, 9)));

        Expr reciprocal = new PowExpr(IntExpr.TWO, IntExpr.of(-2)).simplify();
        assertTrue(reciprocal.structurallyEquals(FracExpr.of(1, 4)));

        Expr big = new PowExpr(IntExpr.TWO, IntExpr.of(10)).simplify();
        assertTrue(big.structurallyEquals(IntExpr.of(1024)));
    }

    @Test
    public void testExactLogarithms() {
        assertTrue(new LogExpr(IntExpr.TWO, IntExpr.of(8), false).simplify().structurallyEquals(IntExpr.of(3)));
        assertTrue(LogExpr.ln(ConstExpr.E).simplify().isOne());
        assertTrue(LogExpr.log10(IntExpr.ONE).simplify().isZero());
        assertTrue(LogExpr.log10(IntExpr.of(7)).simplify() instanceof LogExpr);
    }

    @Test
    public void testSineOfQuarterPi() {
        Expr value = new TrigExpr(TrigFunc.SIN, new DivExpr(ConstExpr.PI, IntExpr.of(4))).simplify();
        Expr expected = new DivExpr(RootExpr.sqrt(IntExpr.TWO), IntExpr.TWO);
        assertTrue(value.structurallyEquals(expected), "got " + value);
        assertEquals(Math.sqrt(2) / 2, value.toDouble(), 1e-9);
    }

    @Test
    public void testSimplifyIsIdempotent() {
        List<Expr> samples = List.of(
                RootExpr.sqrt(IntExpr.of(72)),
                FracExpr.of(6, 8),
                new TrigExpr(TrigFunc.SIN, new DivExpr(ConstExpr.PI, IntExpr.of(4))),
                new TrigExpr(TrigFunc.COS, new DivExpr(new ProdExpr(List.of(IntExpr.of(3), ConstExpr.PI)), IntExpr.of(4))),
                new SumExpr(List.of(X, IntExpr.ONE, X)));
        for (Expr sample : samples) {
            Expr once = sample.simplify();
            assertTrue(once.simplify().structurallyEquals(once), "not idempotent: " + sample);
        }
    }

    @Test
    public void testSubstituteAndVariables() {
        Expr expr = new SumExpr(List.of(new ProdExpr(List.of(IntExpr.of(3), X)), IntExpr.ONE));
        assertEquals(java.util.Set.of("x"), expr.variables());

        Expr value = expr.substitute("x", IntExpr.TWO).simplify();
        assertTrue(value.structurallyEquals(IntExpr.of(7)), "got " + value);
        assertTrue(value.variables().isEmpty());
    }

    @Test
    public void testFreeVariableHasNoNumericalValue() {
        assertThrows(UnsupportedOperationException.class, X::toDouble);
    }

    @Test
    public void testLargePermutationStaysSymbolic() {
        Expr small = new PermExpr(IntExpr.of(5), IntExpr.of(2)).simplify();
        assertTrue(small.structurallyEquals(IntExpr.of(20)));

        Expr large = new PermExpr(IntExpr.of(300_000), IntExpr.of(300_000)).simplify();
        assertTrue(large instanceof PermExpr);
        assertTrue(Double.isInfinite(large.toDouble()));

        Expr folded = new CombExpr(IntExpr.of(300_000), IntExpr.of(299_999)).simplify();
        assertTrue(folded.structurallyEquals(IntExpr.of(300_000)));
        assertTrue(new CombExpr(IntExpr.of(300_000), IntExpr.of(150_000)).simplify() instanceof CombExpr);
    }

    @Test
    public void testRationalEqualityIsSymmetric() {
        assertTrue(FracExpr.of(4, 2).structurallyEquals(IntExpr.of(2)));
        assertTrue(IntExpr.of(2).structurallyEquals(FracExpr.of(4, 2)));
        assertFalse(IntExpr.of(2).structurallyEquals(FracExpr.of(3, 2)));
    }
}
