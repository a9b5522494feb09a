package com.sysmuse.math.solve;

import com.sysmuse.math.format.FormatSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MathSolverTest {

    private MathSolver solver;

    @BeforeEach
    public void setup() {
        solver = new MathSolver(FormatSettings.defaults());
    }

    @Test
    public void testPlainExpression() {
        assertEquals("14", solver.solve("2+3*4"));
        assertEquals("", solver.solve("2+"));
        assertNull(solver.solve("   "));
        assertNull(solver.solve(null));
    }

    @Test
    public void testLinearEquations() {
        assertEquals("x = 2", solver.solve("2x+3=7"));
        assertEquals("x = 8", solver.solve("x/4=2"));
        assertEquals("No solution", solver.solve("x=x+1"));
        assertEquals("Infinite solutions", solver.solve("x=x"));
    }

    @Test
    public void testQuadraticEquations() {
        assertEquals("x = 2\nx = 3", solver.solve("x^(2)-5*x+6=0"));
        assertEquals("x = 0\nx = 4", solver.solve("x^2-4x=0"));
        assertEquals("x = 3", solver.solve("x^2-6x+9=0"));
        assertEquals("x = 0 ± 1i", solver.solve("x^(2)+1=0"));
    }

    @Test
    public void testLinearSystems() {
        assertEquals("x = 2\ny = 1", solver.solve("x+y=3\nx-y=1"));
        assertEquals("x = 1\ny = 2\nz = 3", solver.solve("x+y+z=6\n2x-y=0\nz-y=1"));
    }

    @Test
    public void testUnsolvableInputsGiveNull() {
        assertNull(solver.solve("x+y=3"));
        assertNull(solver.solve("x+y=1\n2x+2y=2"));
        assertNull(solver.solve("x+y+z=1\nx-y=0"));
    }

    @Test
    public void testAnsReferences() {
        assertEquals("42", solver.solve("ans0*2", Map.of(0, "21")));
        assertEquals("x = 5", solver.solve("x-ans1=0", Map.of(1, "5")));
    }

    @Test
    public void testMissingAnsReadsZeroWhateverElseIsStored() {
        assertEquals("1", solver.solve("ans0+1", Map.of()));
        assertEquals("1", solver.solve("ans0+1", null));
        assertEquals("1", solver.solve("ans0+1", Map.of(3, "7")));
    }

    @Test
    public void testCoefficientsAreReadTermByTerm() {
        double[] coefficients = solver.getCoefficients("3x^2+2x-1", "x");
        assertArrayEquals(new double[]{3, 2, -1}, coefficients, 1e-12);

        assertEquals(-1.0, solver.parseCoefficient("-"));
        assertEquals(1.0, solver.parseCoefficient(""));
        assertEquals(0.5, solver.parseCoefficient("2/4"), 1e-12);
        assertEquals(0.0, solver.parseCoefficient("?"));
    }
}
