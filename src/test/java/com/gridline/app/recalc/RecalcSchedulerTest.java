package com.gridline.app.recalc;

import com.gridline.app.formula.CellInputParser;
import com.gridline.app.formula.ReferencePreprocessor;
import com.gridline.app.graph.DependencyGraph;
import com.gridline.app.models.Cell;
import com.gridline.app.models.CellRef;
import com.gridline.app.models.CellStore;
import com.gridline.app.models.EvalErrorCode;
import com.gridline.app.models.Value;
import com.gridline.app.runtime.EvaluationResult;
import com.gridline.app.runtime.ExpressionRuntime;
import com.gridline.app.runtime.FormulaFunction;
import com.gridline.app.runtime.GridView;
import com.gridline.app.runtime.SpelExpressionRuntime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecalcSchedulerTest {

    private CellStore store;
    private DependencyGraph graph;
    private CountingRuntime runtime;
    private RecalcScheduler scheduler;
    private final CellInputParser parser = new CellInputParser(new ReferencePreprocessor());

    @BeforeEach
    void setUp() {
        store = new CellStore();
        graph = new DependencyGraph(store);
        runtime = new CountingRuntime(SpelExpressionRuntime.withBuiltins(64, 10_000));
        // SERIES(n) -> [1, 2, ..., n]
        runtime.registerFunction("SERIES", (grid, args) -> {
            List<Object> items = new ArrayList<>();
            for (int i = 1; i <= ((Number) args[0]).intValue(); i++) {
                items.add(i);
            }
            return items;
        });
        scheduler = new RecalcScheduler(store, graph, runtime, (ref, cell) -> store.put(ref, cell));
    }

    private static CellRef ref(String address) {
        return CellRef.parse(address);
    }

    private void set(String address, String input) {
        CellRef ref = ref(address);
        Cell cell = parser.parse(input, ref);
        store.put(ref, cell);
        if (cell.isFormula()) {
            graph.setFormulaEdges(ref, cell.getPreprocessed());
        } else {
            graph.removeEdges(ref);
        }
    }

    private Value value(String address) {
        return store.get(ref(address)).visibleValue();
    }

    /**
     * Diamond A1 -> (B1, C1) -> D1: every affected formula runs once, after its inputs,
     * and formulas outside the change are not evaluated.
     */
    @Test
    void testEachDependentEvaluatedOnce() {
        set("A1", "1");
        set("B1", "=A1 * 2");
        set("C1", "=A1 + 1");
        set("D1", "=B1 + C1");
        set("E1", "=7 * 1");
        scheduler.recomputeAll();

        runtime.counts.clear();
        set("A1", "5");
        List<CellRef> order = scheduler.recompute(Collections.singletonList(ref("A1")));

        assertEquals(Arrays.asList(ref("B1"), ref("C1"), ref("D1")), order);
        assertEquals(Integer.valueOf(1), runtime.counts.get(ref("B1")));
        assertEquals(Integer.valueOf(1), runtime.counts.get(ref("C1")));
        assertEquals(Integer.valueOf(1), runtime.counts.get(ref("D1")));
        assertNull(runtime.counts.get(ref("E1")));
        assertEquals(Value.number(16), value("D1"));
    }

    @Test
    void testSumCascade() {
        set("A1", "10");
        set("A2", "20");
        set("A3", "=SUM(A1:A2)");
        scheduler.recomputeAll();
        assertEquals(Value.number(30), value("A3"));

        set("A1", "15");
        scheduler.recompute(Collections.singletonList(ref("A1")));
        assertEquals(Value.number(35), value("A3"));
    }

    @Test
    void testArraySpillsDownward() {
        set("B1", "1");
        set("B2", "2");
        set("B3", "3");
        set("A1", "=VEC(B1:B3)");
        scheduler.recompute(Collections.singletonList(ref("A1")));

        assertEquals(Value.number(1), value("A1"));
        assertEquals(Cell.spillChild(ref("A1"), Value.number(2)), store.get(ref("A2")));
        assertEquals(Cell.spillChild(ref("A1"), Value.number(3)), store.get(ref("A3")));
        assertEquals(2, store.spillChildrenOf(ref("A1")).size());
    }

    @Test
    void testShrinkingSpillClearsCells() {
        set("B1", "1");
        set("B2", "2");
        set("B3", "3");
        set("A1", "=VEC(B1:B3)");
        scheduler.recompute(Collections.singletonList(ref("A1")));

        set("A1", "=VEC(B1:B1)");
        scheduler.recompute(Collections.singletonList(ref("A1")));

        assertEquals(Value.number(1), value("A1"));
        assertTrue(store.get(ref("A2")).isEmpty());
        assertTrue(store.get(ref("A3")).isEmpty());
        assertTrue(store.spillChildrenOf(ref("A1")).isEmpty());
    }

    @Test
    void testReadersOfSpilledCellsFollowChanges() {
        set("B1", "1");
        set("B2", "2");
        set("B3", "3");
        set("A1", "=VEC(B1:B3)");
        set("C2", "=A2 * 10");
        scheduler.recomputeAll();
        assertEquals(Value.number(20), value("C2"));

        set("B2", "7");
        List<CellRef> order = scheduler.recompute(Collections.singletonList(ref("B2")));
        assertEquals(Arrays.asList(ref("A1"), ref("C2")), order);
        assertEquals(Value.number(70), value("C2"));
    }

    /**
     * A spill into occupied cells fails the origin but keeps its previous result and spill.
     */
    @Test
    void testBlockedSpillKeepsPreviousResult() {
        set("B1", "2");
        set("A1", "=SERIES(B1)");
        set("A3", "blocker");
        scheduler.recomputeAll();
        assertEquals(Value.number(2), store.get(ref("A2")).getSpilledValue());

        set("B1", "3");
        scheduler.recompute(Collections.singletonList(ref("B1")));

        Cell origin = store.get(ref("A1"));
        assertEquals(EvalErrorCode.SPILL_BLOCKED, origin.getLastError().getCode());
        assertEquals("#SPILL!", origin.getLastError().getMarker());
        assertEquals(2, origin.getCachedResult().getItems().size());
        assertTrue(store.get(ref("A2")).isSpillChildOf(ref("A1")));
        assertEquals(Cell.text("blocker"), store.get(ref("A3")));
    }

    @Test
    void testSpillWouldCreateCycle() {
        set("B1", "=A2 + 1");
        set("A1", "={1, 2, B1}");
        scheduler.recomputeAll();

        assertEquals(EvalErrorCode.SPILL_BLOCKED, store.get(ref("A1")).getLastError().getCode());
        assertTrue(store.get(ref("A2")).isEmpty());
        assertEquals(Value.number(1), value("B1"));
    }

    /**
     * A formula reading the cell a spill grows into runs after the spilling formula, once.
     */
    @Test
    void testReaderOfGrowingSpillEvaluatedOnce() {
        set("C1", "0");
        set("D1", "1");
        set("D2", "2");
        set("A1", "=C1 + B2");
        set("B1", "=C1 > 1 ? VEC(D1:D2) : 5");
        scheduler.recomputeAll();
        assertTrue(store.get(ref("B2")).isEmpty());

        runtime.counts.clear();
        set("C1", "2");
        List<CellRef> order = scheduler.recompute(Collections.singletonList(ref("C1")));

        assertEquals(Arrays.asList(ref("B1"), ref("A1")), order);
        assertEquals(Integer.valueOf(1), runtime.counts.get(ref("A1")));
        assertEquals(Integer.valueOf(1), runtime.counts.get(ref("B1")));
        assertTrue(store.get(ref("B2")).isSpillChildOf(ref("B1")));
        assertEquals(Value.number(4), value("A1"));
    }

    @Test
    void testFailingReplacementClearsSpill() {
        set("B1", "1");
        set("B2", "2");
        set("B3", "3");
        set("A1", "=VEC(B1:B3)");
        scheduler.recompute(Collections.singletonList(ref("A1")));
        assertEquals(2, store.spillChildrenOf(ref("A1")).size());

        set("A1", "=1 +");
        scheduler.recompute(Collections.singletonList(ref("A1")));

        assertEquals(EvalErrorCode.EVALUATION, store.get(ref("A1")).getLastError().getCode());
        assertTrue(store.get(ref("A2")).isEmpty());
        assertTrue(store.get(ref("A3")).isEmpty());
        assertTrue(store.spillChildrenOf(ref("A1")).isEmpty());
    }

    @Test
    void testScalarResultClearsSpill() {
        set("A1", "=SERIES(3)");
        scheduler.recomputeAll();
        assertEquals(2, store.spillChildrenOf(ref("A1")).size());

        set("A1", "=42");
        scheduler.recompute(Collections.singletonList(ref("A1")));
        assertTrue(store.spillChildrenOf(ref("A1")).isEmpty());
        assertEquals(Value.number(42), value("A1"));
    }

    /**
     * An error propagates to readers as an upstream error; unrelated formulas still evaluate.
     */
    @Test
    void testErrorsPropagateUpstream() {
        set("A1", "=1 +");
        set("B1", "=A1 * 2");
        set("C1", "=5");
        scheduler.recomputeAll();

        assertEquals(EvalErrorCode.EVALUATION, store.get(ref("A1")).getLastError().getCode());
        assertEquals(EvalErrorCode.UPSTREAM, store.get(ref("B1")).getLastError().getCode());
        assertNull(store.get(ref("C1")).getLastError());
        assertEquals(Value.number(5), value("C1"));

        set("A1", "=1 + 1");
        scheduler.recompute(Collections.singletonList(ref("A1")));
        assertNull(store.get(ref("B1")).getLastError());
        assertEquals(Value.number(4), value("B1"));
    }

    private static class CountingRuntime implements ExpressionRuntime {

        private final ExpressionRuntime delegate;
        private final Map<CellRef, Integer> counts = new HashMap<>();

        CountingRuntime(ExpressionRuntime delegate) {
            this.delegate = delegate;
        }

        @Override
        public EvaluationResult evaluate(CellRef cell, String preprocessed, GridView grid) {
            counts.merge(cell, 1, Integer::sum);
            return delegate.evaluate(cell, preprocessed, grid);
        }

        @Override
        public void registerFunction(String name, FormulaFunction function) {
            delegate.registerFunction(name, function);
        }
    }
}
