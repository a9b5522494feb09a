package com.sysmuse.math.solve;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AnsReferenceResolverTest {

    @Test
    public void testNumericAnswerIsParenthesized() {
        assertEquals("(21)*2", AnsReferenceResolver.resolve("ans0*2", Map.of(0, "21")));
        assertEquals("(-3.5)+1", AnsReferenceResolver.resolve("ans2+1", Map.of(2, "-3.5")));
        assertEquals("(5)", AnsReferenceResolver.resolve("ANS1", Map.of(1, "5")));
    }

    @Test
    public void testGroupingSeparatorsAreRemoved() {
        assertEquals("(1234567)", AnsReferenceResolver.resolve("ans0", Map.of(0, "1,234,567")));
    }

    @Test
    public void testMissingOrEmptyAnswerBecomesZero() {
        assertEquals("(0)+1", AnsReferenceResolver.resolve("ans5+1", Map.of(0, "3")));
        assertEquals("(0)", AnsReferenceResolver.resolve("ans0", Map.of(0, "")));
        assertEquals("(0)", AnsReferenceResolver.resolve("ans0", Map.of(0, "No solution")));
    }

    @Test
    public void testSolutionListContributesFirstValue() {
        assertEquals("(2)*3", AnsReferenceResolver.resolve("ans0*3", Map.of(0, "x = 2\ny = 1")));
    }

    @Test
    public void testWithoutAnswersReferencesReadAsZero() {
        assertEquals("(0)+1", AnsReferenceResolver.resolve("ans0+1", null));
        assertEquals("(0)+1", AnsReferenceResolver.resolve("ans0+1", Map.of()));
        assertEquals("2+3", AnsReferenceResolver.resolve("2+3", null));
    }
}
