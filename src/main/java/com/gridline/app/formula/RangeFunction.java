package com.gridline.app.formula;

import java.util.Arrays;

/**
 * Functions that accept range arguments ({@code SUM(A1:B5)}), and which argument
 * positions must hold a range. Each is rewritten to its runtime helper
 * {@code NAME_RANGE(c1, r1, c2, r2, ...)}.
 */
public enum RangeFunction {
    SUM(0),
    AVG(0),
    AVERAGE(0),
    COUNT(0),
    MIN(0),
    MAX(0),
    PRODUCT(0),
    MEDIAN(0),
    CONCAT(0),
    VEC(0),
    BARCHART(0),
    LINECHART(0),
    SCATTER(0),
    LOOKUP(1, 2);

    private static final String RUNTIME_SUFFIX = "_RANGE";

    private final int[] rangeArguments;

    RangeFunction(int... rangeArguments) {
        this.rangeArguments = rangeArguments;
    }

    public String getRuntimeName() {
        return name() + RUNTIME_SUFFIX;
    }

    public boolean isRangeArgument(int index) {
        for (int position : rangeArguments) {
            if (position == index) {
                return true;
            }
        }
        return false;
    }

    public int getRangeArgument(int k) {
        return rangeArguments[k];
    }

    public int getRangeArgumentCount() {
        return rangeArguments.length;
    }

    /**
     * Position of the first coordinate of the k-th range in the rewritten call,
     * where every earlier range already occupies four arguments instead of one.
     */
    public int rewrittenRangePosition(int k) {
        return rangeArguments[k] + 3 * k;
    }

    /**
     * Looks up a function by the name users write. Names are upper case only.
     */
    public static RangeFunction fromName(String name) {
        for (RangeFunction function : values()) {
            if (function.name().equals(name)) {
                return function;
            }
        }
        return null;
    }

    public static RangeFunction fromRuntimeName(String name) {
        if (!name.endsWith(RUNTIME_SUFFIX)) {
            return null;
        }
        return fromName(name.substring(0, name.length() - RUNTIME_SUFFIX.length()));
    }

    @Override
    public String toString() {
        return name() + Arrays.toString(rangeArguments);
    }
}
