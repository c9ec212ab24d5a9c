package com.gridline.app.runtime;

import com.gridline.app.formula.RangeFunction;
import com.gridline.app.models.CellRange;
import com.gridline.app.models.CellRef;
import com.gridline.app.models.ChartSpec;
import com.gridline.app.models.Value;
import com.gridline.app.models.ValueType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * The accessor and range helpers that preprocessed formulas call:
 * {@code CELL}, {@code VALUE} and one {@code NAME_RANGE} helper per {@link RangeFunction}.
 * Results are plain Java objects (Double, String, Boolean, List) so formulas can keep
 * operating on them; aggregates read non-numeric and empty cells as 0.
 */
public class BuiltinFunctions {

    private final long maxRangeCells;

    public BuiltinFunctions(long maxRangeCells) {
        this.maxRangeCells = maxRangeCells;
    }

    public void registerAll(ExpressionRuntime runtime) {
        runtime.registerFunction("CELL", (grid, args) -> {
            expectArgs("CELL", args, 2, 2);
            return grid.number(ref(args, 0));
        });
        runtime.registerFunction("VALUE", (grid, args) -> {
            expectArgs("VALUE", args, 2, 2);
            return grid.typed(ref(args, 0)).toPlainObject();
        });

        registerAggregate(runtime, RangeFunction.SUM, values -> sum(values));
        registerAggregate(runtime, RangeFunction.AVG, values -> values.isEmpty() ? 0 : sum(values) / values.size());
        registerAggregate(runtime, RangeFunction.AVERAGE, values -> values.isEmpty() ? 0 : sum(values) / values.size());
        registerAggregate(runtime, RangeFunction.COUNT, values -> {
            int count = 0;
            for (Value value : values) {
                if (value != null) {
                    count++;
                }
            }
            return count;
        });
        registerAggregate(runtime, RangeFunction.MIN, values -> {
            double min = Double.POSITIVE_INFINITY;
            for (Value value : values) {
                min = Math.min(min, numericOrZero(value));
            }
            return values.isEmpty() ? 0 : min;
        });
        registerAggregate(runtime, RangeFunction.MAX, values -> {
            double max = Double.NEGATIVE_INFINITY;
            for (Value value : values) {
                max = Math.max(max, numericOrZero(value));
            }
            return values.isEmpty() ? 0 : max;
        });
        registerAggregate(runtime, RangeFunction.PRODUCT, values -> {
            double product = 1;
            for (Value value : values) {
                product *= numericOrZero(value);
            }
            return product;
        });
        registerAggregate(runtime, RangeFunction.MEDIAN, values -> {
            List<Double> numbers = new ArrayList<>(values.size());
            for (Value value : values) {
                numbers.add(numericOrZero(value));
            }
            if (numbers.isEmpty()) {
                return 0;
            }
            Collections.sort(numbers);
            int n = numbers.size();
            return n % 2 == 1 ? numbers.get(n / 2) : (numbers.get(n / 2 - 1) + numbers.get(n / 2)) / 2;
        });

        runtime.registerFunction(RangeFunction.VEC.getRuntimeName(), (grid, args) -> {
            expectArgs("VEC", args, 4, 4);
            List<Object> items = new ArrayList<>();
            for (Value value : readRange(grid, args, 0)) {
                items.add(value == null ? "" : value.toPlainObject());
            }
            return items;
        });
        runtime.registerFunction(RangeFunction.CONCAT.getRuntimeName(), (grid, args) -> {
            expectArgs("CONCAT", args, 4, 5);
            String separator = args.length == 5 ? String.valueOf(args[4]) : "";
            List<String> parts = new ArrayList<>();
            for (Value value : readRange(grid, args, 0)) {
                if (value != null) {
                    parts.add(value.display());
                }
            }
            return String.join(separator, parts);
        });
        runtime.registerFunction(RangeFunction.LOOKUP.getRuntimeName(), (grid, args) -> {
            expectArgs("LOOKUP", args, 9, 9);
            List<Value> search = readRange(grid, args, 1);
            List<Value> results = readRange(grid, args, 5);
            if (search.size() != results.size()) {
                throw new IllegalArgumentException("LOOKUP: search and return ranges must have the same size");
            }
            for (int i = 0; i < search.size(); i++) {
                if (matches(args[0], search.get(i))) {
                    Value found = results.get(i);
                    return found == null ? "" : found.toPlainObject();
                }
            }
            throw new IllegalArgumentException("LOOKUP: value not found");
        });

        registerChart(runtime, RangeFunction.BARCHART, "BAR");
        registerChart(runtime, RangeFunction.LINECHART, "LINE");
        registerChart(runtime, RangeFunction.SCATTER, "SCATTER");
    }

    private void registerAggregate(ExpressionRuntime runtime, RangeFunction function,
                                   ToDoubleFunction<List<Value>> aggregate) {
        runtime.registerFunction(function.getRuntimeName(), (grid, args) -> {
            expectArgs(function.name(), args, 4, 4);
            return aggregate.applyAsDouble(readRange(grid, args, 0));
        });
    }

    private void registerChart(ExpressionRuntime runtime, RangeFunction function, String kind) {
        runtime.registerFunction(function.getRuntimeName(), (grid, args) -> {
            expectArgs(function.name(), args, 4, 5);
            CellRange range = CellRange.of(ref(args, 0), ref(args, 2));
            checkSize(range);
            return new ChartSpec(kind, range, args.length == 5 ? String.valueOf(args[4]) : null);
        });
    }

    private List<Value> readRange(GridView grid, Object[] args, int offset) {
        int c1 = index(args[offset]);
        int r1 = index(args[offset + 1]);
        int c2 = index(args[offset + 2]);
        int r2 = index(args[offset + 3]);
        checkSize(CellRange.of(CellRef.of(r1, c1), CellRef.of(r2, c2)));
        return grid.range(c1, r1, c2, r2);
    }

    private void checkSize(CellRange range) {
        if (range.size() > maxRangeCells) {
            throw new IllegalArgumentException("Range " + range + " exceeds maximum size of " + maxRangeCells + " cells");
        }
    }

    private static CellRef ref(Object[] args, int offset) {
        return CellRef.of(index(args[offset + 1]), index(args[offset]));
    }

    private static int index(Object arg) {
        if (arg instanceof Number) {
            double d = ((Number) arg).doubleValue();
            if (d >= 0 && d <= Integer.MAX_VALUE && d == Math.rint(d)) {
                return (int) d;
            }
        }
        throw new IllegalArgumentException("Cell coordinate must be a non-negative integer: " + arg);
    }

    private static void expectArgs(String name, Object[] args, int min, int max) {
        if (args.length < min || args.length > max) {
            throw new IllegalArgumentException(name + " called with " + args.length + " arguments");
        }
    }

    private static double sum(List<Value> values) {
        double total = 0;
        for (Value value : values) {
            total += numericOrZero(value);
        }
        return total;
    }

    private static double numericOrZero(Value value) {
        return value != null && value.getType() == ValueType.NUMBER ? value.getNumber() : 0;
    }

    // numbers compare numerically, everything else by displayed text
    private static boolean matches(Object needle, Value candidate) {
        if (candidate == null) {
            return "".equals(needle);
        }
        if (needle instanceof Number && candidate.getType() == ValueType.NUMBER) {
            return ((Number) needle).doubleValue() == candidate.getNumber();
        }
        if (needle instanceof Boolean && candidate.getType() == ValueType.BOOL) {
            return needle.equals(candidate.getBool());
        }
        return String.valueOf(needle).equals(candidate.display());
    }
}
