package com.gridline.app.graph;

import com.gridline.app.exceptions.CircularReferenceException;
import com.gridline.app.exceptions.FormulaParseException;
import com.gridline.app.formula.FormulaLexer;
import com.gridline.app.formula.FormulaToken;
import com.gridline.app.formula.FormulaTokenType;
import com.gridline.app.formula.FormulaTokens;
import com.gridline.app.formula.RangeFunction;
import com.gridline.app.models.Cell;
import com.gridline.app.models.CellRange;
import com.gridline.app.models.CellRef;
import com.gridline.app.models.CellStore;

import java.util.*;

/**
 * Dependency edges between formula cells and the cells/ranges they read.
 *
 * Every formula in the store has an entry, possibly without edges, so that it can be
 * found inside a range. Single-cell edges are indexed in reverse; range edges are kept
 * as intervals and scanned for containment. A spill child counts as its owner:
 * reading B2 while B2 is spilled from B1 makes the reader depend on B1.
 *
 * Not thread-safe: the owning document's lock guards it.
 */
public class DependencyGraph {

    private static final Set<String> ACCESSORS = new HashSet<>(Arrays.asList("CELL", "VALUE"));

    private final CellStore store;
    private final FormulaLexer lexer = new FormulaLexer();

    // Forward: formula -> what it reads
    private final Map<CellRef, FormulaEdges> precedents = new HashMap<>();
    // Reverse for single-cell edges: cell -> formulas reading it
    private final Map<CellRef, Set<CellRef>> cellReaders = new HashMap<>();
    // Formulas with at least one range edge
    private final Set<CellRef> rangeReaders = new TreeSet<>();

    public DependencyGraph(CellStore store) {
        this.store = store;
    }

    // ------------------------
    // Edge extraction
    // ------------------------

    /**
     * Reads the accessor and range-helper calls of preprocessed formula text.
     * Coordinates must be integer literals; anything computed is rejected.
     */
    public FormulaEdges extractEdges(String preprocessed) {
        List<FormulaToken> tokens = lexer.tokenize(preprocessed);
        SortedSet<CellRef> cells = new TreeSet<>();
        List<CellRange> ranges = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            if (!FormulaTokens.isCallName(tokens, i)) {
                continue;
            }
            String name = tokens.get(i).getText();
            RangeFunction rangeFunction = RangeFunction.fromRuntimeName(name);
            if (!ACCESSORS.contains(name) && rangeFunction == null) {
                continue;
            }
            int close = FormulaTokens.findClosingParen(tokens, i + 1, tokens.size());
            if (close < 0) {
                throw new FormulaParseException("Unmatched parenthesis in " + name + " call",
                        preprocessed, tokens.get(i).getStart(), preprocessed.length());
            }
            List<int[]> args = FormulaTokens.splitArguments(tokens, i + 2, close);
            if (rangeFunction == null) {
                if (args.size() != 2) {
                    throw new FormulaParseException(name + " expects (column, row)", preprocessed,
                            tokens.get(i).getStart(), tokens.get(close).getEnd());
                }
                int col = integerLiteral(preprocessed, tokens, args.get(0));
                int row = integerLiteral(preprocessed, tokens, args.get(1));
                cells.add(CellRef.of(row, col));
            } else {
                for (int k = 0; k < rangeFunction.getRangeArgumentCount(); k++) {
                    int p = rangeFunction.rewrittenRangePosition(k);
                    if (p + 3 >= args.size()) {
                        throw new FormulaParseException(name + " is missing range coordinates", preprocessed,
                                tokens.get(i).getStart(), tokens.get(close).getEnd());
                    }
                    CellRef first = CellRef.of(integerLiteral(preprocessed, tokens, args.get(p + 1)),
                            integerLiteral(preprocessed, tokens, args.get(p)));
                    CellRef second = CellRef.of(integerLiteral(preprocessed, tokens, args.get(p + 3)),
                            integerLiteral(preprocessed, tokens, args.get(p + 2)));
                    CellRange range = CellRange.of(first, second);
                    if (!ranges.contains(range)) {
                        ranges.add(range);
                    }
                }
            }
        }
        return new FormulaEdges(cells, ranges);
    }

    private static int integerLiteral(String text, List<FormulaToken> tokens, int[] span) {
        if (span[1] - span[0] == 1) {
            FormulaToken token = tokens.get(span[0]);
            if (token.is(FormulaTokenType.NUMBER) && token.getText().chars().allMatch(Character::isDigit)) {
                try {
                    return Integer.parseInt(token.getText());
                } catch (NumberFormatException e) {
                    throw new FormulaParseException("Coordinate out of range", text, token.getStart(), token.getEnd());
                }
            }
        }
        int start = span[0] < span[1] ? tokens.get(span[0]).getStart() : 0;
        int end = span[0] < span[1] ? tokens.get(span[1] - 1).getEnd() : text.length();
        throw new FormulaParseException("Cell coordinates must be integer literals", text, start, end);
    }

    // ------------------------
    // Mutation
    // ------------------------

    public void setFormulaEdges(CellRef ref, String preprocessed) {
        setEdges(ref, extractEdges(preprocessed));
    }

    /**
     * Replaces the outgoing edges of a formula cell.
     */
    public void setEdges(CellRef ref, FormulaEdges edges) {
        removeEdges(ref);
        precedents.put(ref, edges);
        for (CellRef target : edges.getCells()) {
            cellReaders.computeIfAbsent(target, k -> new TreeSet<>()).add(ref);
        }
        if (!edges.getRanges().isEmpty()) {
            rangeReaders.add(ref);
        }
    }

    /**
     * Drops a cell from the graph as a formula. Edges from other formulas to it stay.
     */
    public void removeEdges(CellRef ref) {
        FormulaEdges old = precedents.remove(ref);
        if (old == null) {
            return;
        }
        for (CellRef target : old.getCells()) {
            Set<CellRef> readers = cellReaders.get(target);
            if (readers != null) {
                readers.remove(ref);
                if (readers.isEmpty()) {
                    cellReaders.remove(target);
                }
            }
        }
        rangeReaders.remove(ref);
    }

    /**
     * Re-derives every edge from the formulas in the store.
     * Throws CircularReferenceException when the stored formulas form a cycle.
     */
    public void rebuild(CellStore source) {
        clear();
        for (Map.Entry<CellRef, Cell> entry : source.snapshot().entrySet()) {
            if (entry.getValue().isFormula()) {
                setFormulaEdges(entry.getKey(), entry.getValue().getPreprocessed());
            }
        }
        order(precedents.keySet());
    }

    public void clear() {
        precedents.clear();
        cellReaders.clear();
        rangeReaders.clear();
    }

    // ------------------------
    // Queries
    // ------------------------

    public FormulaEdges getEdges(CellRef ref) {
        return precedents.getOrDefault(ref, FormulaEdges.none());
    }

    public boolean isFormula(CellRef ref) {
        return precedents.containsKey(ref);
    }

    /**
     * Formulas that read ref directly, including readers of ref's spill children.
     */
    public Set<CellRef> directDependents(CellRef ref) {
        Set<CellRef> result = new TreeSet<>();
        collectReaders(ref, result);
        for (CellRef child : store.spillChildrenOf(ref)) {
            collectReaders(child, result);
        }
        return result;
    }

    private void collectReaders(CellRef ref, Set<CellRef> result) {
        result.addAll(cellReaders.getOrDefault(ref, Collections.emptySet()));
        for (CellRef reader : rangeReaders) {
            for (CellRange range : precedents.get(reader).getRanges()) {
                if (range.contains(ref)) {
                    result.add(reader);
                    break;
                }
            }
        }
    }

    /**
     * Cells whose value must be known before ref is evaluated:
     * direct cells, owners of spilled cells it reads, formulas and spill owners inside its ranges.
     */
    public Set<CellRef> directPrecedents(CellRef ref) {
        return precedentsOf(getEdges(ref), null);
    }

    /**
     * @param pendingFormula a formula about to be (re)written, or null. Its current spill
     *                       children are not aliased to it since they are re-derived when it
     *                       is evaluated; a range covering the cell itself still counts.
     */
    private Set<CellRef> precedentsOf(FormulaEdges edges, CellRef pendingFormula) {
        Set<CellRef> result = new TreeSet<>();
        for (CellRef cell : edges.getCells()) {
            result.add(cell);
            CellRef owner = store.ownerOf(cell);
            if (owner != null && !owner.equals(pendingFormula)) {
                result.add(owner);
            }
        }
        for (CellRange range : edges.getRanges()) {
            for (CellRef formula : precedents.keySet()) {
                if (range.contains(formula)) {
                    result.add(formula);
                }
            }
            if (pendingFormula != null && range.contains(pendingFormula)) {
                result.add(pendingFormula);
            }
            for (Map.Entry<CellRef, SortedSet<CellRef>> spill : store.getSpillIndex().entrySet()) {
                if (spill.getKey().equals(pendingFormula)) {
                    continue;
                }
                for (CellRef child : spill.getValue()) {
                    if (range.contains(child)) {
                        result.add(spill.getKey());
                        break;
                    }
                }
            }
        }
        return result;
    }

    /**
     * Every transitive dependent of ref (ref itself excluded), in evaluation order.
     */
    public List<CellRef> dependentsOf(CellRef ref) {
        Set<CellRef> visited = new HashSet<>();
        Queue<CellRef> queue = new LinkedList<>();
        queue.add(ref);
        while (!queue.isEmpty()) {
            CellRef current = queue.poll();
            for (CellRef dependent : directDependents(current)) {
                if (visited.add(dependent)) {
                    queue.add(dependent);
                }
            }
        }
        visited.remove(ref);
        return order(visited);
    }

    /**
     * Topological order of the given cells considering only edges among them.
     * Ties go to the smaller (row, column).
     */
    public List<CellRef> order(Collection<CellRef> cells) {
        return order(cells, Collections.emptyMap());
    }

    /**
     * Same as {@link #order(Collection)} with extra ordering constraints:
     * each key is placed after every cell of its value set.
     */
    public List<CellRef> order(Collection<CellRef> cells, Map<CellRef, Set<CellRef>> runsAfter) {
        Set<CellRef> members = new HashSet<>(cells);
        Map<CellRef, Integer> indegree = new HashMap<>();
        Map<CellRef, List<CellRef>> waiting = new HashMap<>();
        PriorityQueue<CellRef> ready = new PriorityQueue<>();
        for (CellRef cell : members) {
            Set<CellRef> before = new HashSet<>(directPrecedents(cell));
            before.addAll(runsAfter.getOrDefault(cell, Collections.emptySet()));
            before.remove(cell);
            before.retainAll(members);
            for (CellRef precedent : before) {
                waiting.computeIfAbsent(precedent, k -> new ArrayList<>()).add(cell);
            }
            indegree.put(cell, before.size());
            if (before.isEmpty()) {
                ready.add(cell);
            }
        }
        List<CellRef> result = new ArrayList<>(members.size());
        while (!ready.isEmpty()) {
            CellRef cell = ready.poll();
            result.add(cell);
            for (CellRef dependent : waiting.getOrDefault(cell, Collections.emptyList())) {
                int remaining = indegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (result.size() < members.size()) {
            Set<CellRef> stuck = new TreeSet<>(members);
            stuck.removeAll(result);
            throw new CircularReferenceException("Circular reference among " + stuck);
        }
        return result;
    }

    /**
     * True if giving ref the candidate edges would create a cycle. Does not modify the graph.
     */
    public boolean wouldCycle(CellRef ref, FormulaEdges candidate) {
        Deque<CellRef> stack = new ArrayDeque<>(precedentsOf(candidate, ref));
        Set<CellRef> visited = new HashSet<>();
        while (!stack.isEmpty()) {
            CellRef current = stack.pop();
            if (current.equals(ref)) {
                return true;
            }
            if (visited.add(current) && precedents.containsKey(current)) {
                stack.addAll(precedentsOf(precedents.get(current), ref));
            }
        }
        return false;
    }

    /**
     * True if a (transitively) reads b.
     */
    public boolean dependsOn(CellRef a, CellRef b) {
        Deque<CellRef> stack = new ArrayDeque<>(directPrecedents(a));
        Set<CellRef> visited = new HashSet<>();
        while (!stack.isEmpty()) {
            CellRef current = stack.pop();
            if (current.equals(b)) {
                return true;
            }
            if (visited.add(current) && precedents.containsKey(current)) {
                stack.addAll(directPrecedents(current));
            }
        }
        return false;
    }

    // ------------------------
    // Views
    // ------------------------

    /**
     * Formula -> what it reads, as display strings ("A1", "B1:B3").
     */
    public Map<String, List<String>> getForwardGraph() {
        Map<String, List<String>> forward = new LinkedHashMap<>();
        for (CellRef formula : new TreeSet<>(precedents.keySet())) {
            FormulaEdges edges = precedents.get(formula);
            List<String> targets = new ArrayList<>();
            for (CellRef cell : edges.getCells()) {
                targets.add(cell.toString());
            }
            for (CellRange range : edges.getRanges()) {
                targets.add(range.toString());
            }
            forward.put(formula.toString(), targets);
        }
        return forward;
    }

    /**
     * Cell or range -> formulas that read it.
     */
    public Map<String, List<String>> getReverseGraph() {
        Map<String, Set<CellRef>> reverse = new TreeMap<>();
        for (Map.Entry<CellRef, Set<CellRef>> entry : new TreeMap<>(cellReaders).entrySet()) {
            reverse.computeIfAbsent(entry.getKey().toString(), k -> new TreeSet<>()).addAll(entry.getValue());
        }
        for (CellRef reader : rangeReaders) {
            for (CellRange range : precedents.get(reader).getRanges()) {
                reverse.computeIfAbsent(range.toString(), k -> new TreeSet<>()).add(reader);
            }
        }
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (Map.Entry<String, Set<CellRef>> entry : reverse.entrySet()) {
            List<String> readers = new ArrayList<>();
            for (CellRef reader : entry.getValue()) {
                readers.add(reader.toString());
            }
            result.put(entry.getKey(), readers);
        }
        return result;
    }

    /**
     * Copy of all formula edges, for comparing graph states.
     */
    public SortedMap<CellRef, FormulaEdges> snapshot() {
        return new TreeMap<>(precedents);
    }
}
