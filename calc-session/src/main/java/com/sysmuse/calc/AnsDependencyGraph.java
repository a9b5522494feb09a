package com.sysmuse.calc;

import com.sysmuse.math.node.MathNode;
import com.sysmuse.math.serial.MathExpressionSerializer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Which cells read which other cells' answers through ANS references.
 *
 * A cell depends on every index named by an {@code AnsNode} or by {@code ans<N>}
 * typed as text, including references to cells that do not exist.
 */
public class AnsDependencyGraph {

    private static final Pattern ANS_REFERENCE = Pattern.compile("ans(\\d{1,9})", Pattern.CASE_INSENSITIVE);

    private final Map<Integer, Set<Integer>> dependencies = new TreeMap<>();

    public static AnsDependencyGraph build(List<Cell> cells) {
        AnsDependencyGraph graph = new AnsDependencyGraph();
        for (int i = 0; i < cells.size(); i++) {
            graph.dependencies.put(i, findReferences(cells.get(i).getExpression()));
        }
        return graph;
    }

    /**
     * Indices referenced by a node list, in ascending order.
     */
    public static Set<Integer> findReferences(List<MathNode> nodes) {
        Set<Integer> refs = new TreeSet<>();
        Matcher m = ANS_REFERENCE.matcher(MathExpressionSerializer.serialize(nodes));
        while (m.find()) {
            refs.add(Integer.parseInt(m.group(1)));
        }
        return refs;
    }

    public Set<Integer> dependenciesOf(int cell) {
        return dependencies.getOrDefault(cell, Set.of());
    }

    public boolean hasReferences(int cell) {
        return !dependenciesOf(cell).isEmpty();
    }

    /**
     * Cells that read the given cell's answer directly.
     */
    public Set<Integer> dependentsOf(int cell) {
        Set<Integer> result = new TreeSet<>();
        for (Map.Entry<Integer, Set<Integer>> entry : dependencies.entrySet()) {
            if (entry.getValue().contains(cell)) {
                result.add(entry.getKey());
            }
        }
        return result;
    }

    /**
     * Cells whose answers can change when the given cell changes.
     */
    public Set<Integer> transitiveDependents(int cell) {
        Set<Integer> result = new TreeSet<>();
        Deque<Integer> pending = new ArrayDeque<>(dependentsOf(cell));
        while (!pending.isEmpty()) {
            int next = pending.poll();
            if (result.add(next)) {
                pending.addAll(dependentsOf(next));
            }
        }
        return result;
    }

    /**
     * True when the cell can reach itself through its references.
     */
    public boolean isOnCycle(int cell) {
        return transitiveDependents(cell).contains(cell);
    }

    public Set<Integer> cyclicCells() {
        Set<Integer> result = new TreeSet<>();
        for (int cell : dependencies.keySet()) {
            if (isOnCycle(cell)) {
                result.add(cell);
            }
        }
        return result;
    }

    /**
     * Order in which to evaluate the given cells so that each comes after the cells
     * it reads. Cells on a cycle are left out.
     */
    public List<Integer> evaluationOrder(Collection<Integer> cells) {
        Set<Integer> wanted = new TreeSet<>(cells);
        wanted.removeAll(cyclicCells());

        List<Integer> sorted = new ArrayList<>();
        Set<Integer> visited = new HashSet<>();
        Set<Integer> visiting = new HashSet<>();
        for (int cell : wanted) {
            visit(cell, wanted, visited, visiting, sorted);
        }
        return sorted;
    }

    private void visit(int cell, Set<Integer> wanted, Set<Integer> visited,
                       Set<Integer> visiting, List<Integer> sorted) {
        if (visited.contains(cell) || visiting.contains(cell)) return;

        visiting.add(cell);
        for (int dep : dependenciesOf(cell)) {
            if (wanted.contains(dep)) {
                visit(dep, wanted, visited, visiting, sorted);
            }
        }
        visiting.remove(cell);
        visited.add(cell);
        sorted.add(cell);
    }
}
