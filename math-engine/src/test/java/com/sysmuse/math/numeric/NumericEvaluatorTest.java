package com.sysmuse.math.numeric;

import com.sysmuse.math.format.FormatSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NumericEvaluatorTest {

    private NumericEvaluator evaluator;

    @BeforeEach
    public void setup() {
        evaluator = new NumericEvaluator(FormatSettings.defaults());
    }

    @Test
    public void testOperatorPrecedence() {
        assertEquals("14", evaluator.evaluate("2+3*4"));
        assertEquals("20", evaluator.evaluate("(2+3)*4"));
        assertEquals("1024", evaluator.evaluate("2^10"));
        assertEquals("-4", evaluator.evaluate("-2*2"));
        assertEquals("2.5", evaluator.evaluate("5/2"));
    }

    @Test
    public void testDivisionByZero() {
        assertEquals("∞", evaluator.evaluate("1/0"));
        assertEquals("-∞", evaluator.evaluate("-1/0"));
        assertEquals("NaN", evaluator.evaluate("0/0"));
    }

    @Test
    public void testPercentages() {
        assertEquals("150", evaluator.evaluate("50%+100"));
        assertEquals("220", evaluator.evaluate("200+10%"));
        assertEquals("180", evaluator.evaluate("200-10%"));
        assertEquals("0.5", evaluator.evaluate("50%"));
        assertEquals("25", evaluator.evaluate("50%*50"));
    }

    @Test
    public void testImplicitMultiplication() {
        assertEquals("14", evaluator.evaluate("2(3+4)"));
        assertEquals("21", evaluator.evaluate("(1+2)(3+4)"));
        assertEquals("6.283185", evaluator.evaluate("2π"));
    }

    @Test
    public void testFunctionsAndConstants() {
        assertEquals("1", evaluator.evaluate("sin(90°)"));
        assertEquals("1", evaluator.evaluate("ln(e)"));
        assertEquals("2", evaluator.evaluate("log(100)"));
        assertEquals("3", evaluator.evaluate("abs(-3)"));
        assertEquals("3", evaluator.evaluate("sqrt(9)"));
        assertEquals("1000", evaluator.evaluate("1ᴇ3"));
    }

    @Test
    public void testComplexResults() {
        assertEquals("2i", evaluator.evaluate("sqrt(-4)"));
        assertEquals("-1", evaluator.evaluate("i*i"));
        assertEquals("5 + 5i", evaluator.evaluate("(1+2i)*(3-i)"));
        assertNull(evaluator.evaluateToDouble("sqrt(-1)"));
    }

    @Test
    public void testCombinatoricsAndSeries() {
        assertEquals("120", evaluator.evaluate("5!"));
        assertEquals("20", evaluator.evaluate("perm(5,2)"));
        assertEquals("10", evaluator.evaluate("comb(5,2)"));
        assertEquals("55", evaluator.evaluate("sum(n,1,10,n)"));
        assertEquals("120", evaluator.evaluate("prod(k,1,5,k)"));
        assertEquals("0", evaluator.evaluate("sum(n,5,1,n)"));
    }

    @Test
    public void testFactorialNextToOtherFactors() {
        assertEquals("12", evaluator.evaluate("2(3)!"));
        assertEquals("12", evaluator.evaluate("3!2"));
        assertEquals("12", evaluator.evaluate("2*3!"));
        assertEquals("", evaluator.evaluate("1.5!"));
    }

    @Test
    public void testOversizedPermutationIsRejected() {
        assertEquals("", evaluator.evaluate("perm(20000000000,20000000000)"));
        assertEquals("", evaluator.evaluate("comb(40000,20000)"));
        assertEquals("100000", evaluator.evaluate("comb(100000,99999)"));
    }

    @Test
    public void testSeriesResultKeepsItsOwnFactor() {
        // 2·sum(...) must multiply, not concatenate digits
        assertEquals("12", evaluator.evaluate("2sum(n,1,3,n)"));
    }

    @Test
    public void testNumericCalculus() {
        assertEquals("4", evaluator.evaluate("diff(x,2,x^2)"));
        assertEquals("0.333333", evaluator.evaluate("int(x,0,1,x^2)"));
        assertEquals("-0.333333", evaluator.evaluate("int(x,1,0,x^2)"));
    }

    @Test
    public void testInvalidInputGivesEmptyResult() {
        assertEquals("", evaluator.evaluate("2+"));
        assertEquals("", evaluator.evaluate(""));
        assertEquals("", evaluator.evaluate("(2+3"));
        assertEquals("", evaluator.evaluate("foo(2)"));
        assertNull(evaluator.evaluateToDouble("2*"));
    }

    @Test
    public void testEvaluateComplexThrowsOnMalformedInput() {
        assertThrows(NumericParseException.class, () -> evaluator.evaluateComplex("3)"));
        assertThrows(NumericParseException.class, () -> evaluator.evaluateComplex(" "));
    }

    @Test
    public void testSumRangeLimit() {
        assertEquals("", evaluator.evaluate("sum(n,1,20000,n)"));
    }
}
