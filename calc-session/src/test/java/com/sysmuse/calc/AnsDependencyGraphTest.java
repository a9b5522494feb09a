package com.sysmuse.calc;

import com.sysmuse.math.node.AnsNode;
import com.sysmuse.math.node.FractionNode;
import com.sysmuse.math.node.LiteralNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.sysmuse.math.node.MathNode.text;
import static org.junit.jupiter.api.Assertions.*;

public class AnsDependencyGraphTest {

    private static Cell cell(String text) {
        return new Cell(text(text));
    }

    @Test
    public void testFindReferencesInTextAndNodes() {
        assertEquals(Set.of(0, 2), AnsDependencyGraph.findReferences(text("ans2+ANS0")));
        assertEquals(Set.of(1), AnsDependencyGraph.findReferences(
                List.of(new FractionNode(List.of(new AnsNode(1)), text("2")))));
        assertTrue(AnsDependencyGraph.findReferences(text("answer")).isEmpty());
    }

    @Test
    public void testDependents() {
        AnsDependencyGraph graph = AnsDependencyGraph.build(List.of(
                cell("1"), cell("ans0+1"), cell("ans1*2"), cell("5")));

        assertEquals(Set.of(1), graph.dependentsOf(0));
        assertEquals(Set.of(1, 2), graph.transitiveDependents(0));
        assertTrue(graph.transitiveDependents(3).isEmpty());
        assertTrue(graph.hasReferences(2));
        assertFalse(graph.hasReferences(3));
        assertEquals(Set.of(1), graph.dependenciesOf(2));
    }

    @Test
    public void testCycles() {
        AnsDependencyGraph graph = AnsDependencyGraph.build(List.of(
                cell("ans2"), cell("ans0"), cell("ans1"), cell("ans3"), cell("ans0+1")));

        assertEquals(Set.of(0, 1, 2, 3), graph.cyclicCells());
        assertTrue(graph.isOnCycle(3));
        assertFalse(graph.isOnCycle(4));
    }

    @Test
    public void testEvaluationOrderPutsDependenciesFirst() {
        AnsDependencyGraph graph = AnsDependencyGraph.build(List.of(
                cell("ans2*2"), cell("ans0+1"), cell("3"), new Cell(List.of(new LiteralNode("ans3")))));

        assertEquals(List.of(2, 0, 1), graph.evaluationOrder(List.of(0, 1, 2, 3)));
        assertEquals(List.of(0, 1), graph.evaluationOrder(List.of(0, 1)));
    }
}
