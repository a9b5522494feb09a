package com.sysmuse.calc;

import com.sysmuse.math.config.EngineConfig;
import com.sysmuse.math.expr.Expr;
import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.node.MathNode;
import com.sysmuse.math.serial.MathExpressionSerializer;
import com.sysmuse.math.serial.MathNodeJsonCodec;
import com.sysmuse.math.solve.ExactMathEngine;
import com.sysmuse.math.solve.ExactResult;
import com.sysmuse.math.solve.MathSolver;
import com.sysmuse.util.LoggingUtil;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * An ordered list of calculator cells whose answers stay consistent.
 *
 * <p>Each cell is evaluated numerically from its serialized text, with the other
 * cells' answers available as {@code ans<N>}. The exact engine runs alongside and
 * its value is kept for exact ANS references. When a cell changes, the cells
 * reading it are re-evaluated according to the {@link RecalcPolicy}; cells on a
 * reference cycle get an empty answer.
 *
 * <p>Not thread-safe.
 */
public class CalculatorSession {

    private final MathSolver solver;
    private final ExactMathEngine exactEngine;
    private final FormatSettings settings;
    private final List<Cell> cells = new ArrayList<>();

    private RecalcPolicy recalcPolicy = RecalcPolicy.PRECISE;
    private int activeIndex = 0;

    public CalculatorSession(MathSolver solver, ExactMathEngine exactEngine, FormatSettings settings) {
        this.solver = solver;
        this.exactEngine = exactEngine;
        this.settings = settings;
    }

    public CalculatorSession(FormatSettings settings) {
        this(new MathSolver(settings), new ExactMathEngine(settings), settings);
    }

    /**
     * Session set up from the engine configuration; also initializes logging.
     */
    public static CalculatorSession fromConfig(EngineConfig config) {
        LoggingUtil.initialize(config);
        LoggingUtil.info("Starting calculator session with " + config);
        return new CalculatorSession(config.toFormatSettings());
    }

    public FormatSettings getSettings() {
        return settings;
    }

    public RecalcPolicy getRecalcPolicy() {
        return recalcPolicy;
    }

    public void setRecalcPolicy(RecalcPolicy recalcPolicy) {
        this.recalcPolicy = recalcPolicy;
    }

    public int size() {
        return cells.size();
    }

    public List<Cell> getCells() {
        return Collections.unmodifiableList(cells);
    }

    public Cell getCell(int index) {
        checkIndex(index);
        return cells.get(index);
    }

    public String getAnswer(int index) {
        return getCell(index).getAnswer();
    }

    public int getActiveIndex() {
        return activeIndex;
    }

    public void setActiveIndex(int activeIndex) {
        if (cells.isEmpty()) {
            this.activeIndex = 0;
        } else {
            this.activeIndex = Math.max(0, Math.min(activeIndex, cells.size() - 1));
        }
    }

    /**
     * Append an empty cell.
     *
     * @return its index
     */
    public int addCell() {
        return addCell(MathNode.placeholder());
    }

    /**
     * Append a cell and evaluate it.
     *
     * @return its index
     */
    public int addCell(List<MathNode> expression) {
        cells.add(new Cell(expression));
        int index = cells.size() - 1;
        // Earlier cells may already reference this index
        recalculateFrom(index);
        return index;
    }

    /**
     * Remove a cell. Later cells move up one index, so every cell holding an ANS
     * reference is re-evaluated.
     */
    public void removeCell(int index) {
        checkIndex(index);
        cells.remove(index);
        if (activeIndex >= cells.size()) {
            activeIndex = Math.max(0, cells.size() - 1);
        }

        AnsDependencyGraph graph = AnsDependencyGraph.build(cells);
        Set<Integer> affected = new TreeSet<>();
        for (int i = 0; i < cells.size(); i++) {
            if (graph.hasReferences(i)) {
                affected.add(i);
            }
        }
        reevaluate(graph, affected);
    }

    /**
     * Replace a cell's expression, evaluate it and bring dependent cells up to date.
     */
    public void updateCell(int index, List<MathNode> expression) {
        checkIndex(index);
        cells.get(index).setExpression(expression);
        recalculateFrom(index);
    }

    /**
     * Re-evaluate every cell in dependency order.
     */
    public void recalculateAll() {
        AnsDependencyGraph graph = AnsDependencyGraph.build(cells);
        Set<Integer> all = new TreeSet<>();
        for (int i = 0; i < cells.size(); i++) {
            all.add(i);
        }
        reevaluate(graph, all);
    }

    private void recalculateFrom(int changed) {
        AnsDependencyGraph graph = AnsDependencyGraph.build(cells);
        Set<Integer> affected = new TreeSet<>();
        affected.add(changed);

        switch (recalcPolicy) {
            case PRECISE:
                affected.addAll(graph.transitiveDependents(changed));
                break;
            case ANY_ANS_REFERENCE:
                for (int i = 0; i < cells.size(); i++) {
                    if (graph.hasReferences(i)) {
                        affected.add(i);
                    }
                }
                break;
            default:
                throw new IllegalStateException("Unknown recalculation policy: " + recalcPolicy);
        }
        reevaluate(graph, affected);
    }

    private void reevaluate(AnsDependencyGraph graph, Set<Integer> affected) {
        Set<Integer> cyclic = graph.cyclicCells();
        for (int index : affected) {
            if (cyclic.contains(index)) {
                LoggingUtil.debug("Cell " + index + " is on an ANS reference cycle");
                Cell cell = cells.get(index);
                cell.setAnswer("");
                cell.setExactValue(null);
            }
        }

        List<Integer> order = recalcPolicy == RecalcPolicy.PRECISE
                ? graph.evaluationOrder(affected)
                : new ArrayList<>(withoutAll(affected, cyclic));
        for (int index : order) {
            evaluateCell(index);
        }
    }

    private static Set<Integer> withoutAll(Set<Integer> cells, Set<Integer> removed) {
        Set<Integer> result = new TreeSet<>(cells);
        result.removeAll(removed);
        return result;
    }

    /**
     * Evaluate one cell against the current answers of all other cells.
     */
    void evaluateCell(int index) {
        Cell cell = cells.get(index);

        Map<Integer, String> ansValues = new HashMap<>();
        Map<Integer, Expr> ansExpressions = new HashMap<>();
        for (int i = 0; i < cells.size(); i++) {
            if (i == index) continue;
            Cell other = cells.get(i);
            if (!other.getAnswer().isEmpty()) {
                ansValues.put(i, other.getAnswer());
            }
            if (other.getExactValue() != null) {
                ansExpressions.put(i, other.getExactValue());
            }
        }

        String text = MathExpressionSerializer.serialize(cell.getExpression());
        String answer = solver.solve(text, ansValues);
        cell.setAnswer(answer);

        ExactResult exact = exactEngine.evaluate(cell.getExpression(), ansExpressions);
        cell.setExactValue(exact.isEmpty() || exact.hasError() ? null : exact.getExpr());

        LoggingUtil.debug("Cell " + index + ": " + text + " => " + cell.getAnswer());
    }

    public void save(CellPersistence persistence) throws IOException {
        persistence.save(cells, activeIndex);
    }

    /**
     * Replace the cells with a saved session. Stored answers are shown as saved,
     * then every cell is evaluated again so exact values are available.
     *
     * @return false when nothing was stored
     */
    public boolean restore(CellPersistence persistence) {
        SessionSnapshot snapshot = persistence.load();
        if (snapshot.isEmpty()) {
            return false;
        }

        cells.clear();
        for (CellRecord record : snapshot.getCells()) {
            Cell cell = new Cell(MathNodeJsonCodec.deserializeFromJson(record.getExpression()));
            cell.setAnswer(record.getAnswer());
            cells.add(cell);
        }
        setActiveIndex(snapshot.getActiveIndex());
        recalculateAll();
        return true;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= cells.size()) {
            throw new IndexOutOfBoundsException("No cell at index " + index + " (size " + cells.size() + ")");
        }
    }
}
