package com.sysmuse.math.solve;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class VariableFinderTest {

    @Test
    public void testFindsUnknownsInOrder() {
        assertEquals(List.of("y", "x"), new ArrayList<>(VariableFinder.findVariables("2y+sin(x)=1")));
    }

    @Test
    public void testFunctionsAndConstantsAreNotUnknowns() {
        assertTrue(VariableFinder.findVariables("sqrt(2)+ln(e)+pi*i+ans0").isEmpty());
        assertTrue(VariableFinder.findVariables("1E5+2").isEmpty());
    }

    @Test
    public void testLetterRunsSplitIntoVariables() {
        assertEquals(List.of("x", "y"), new ArrayList<>(VariableFinder.findVariables("xy+1=0")));
    }
}
