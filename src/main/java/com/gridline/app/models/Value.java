package com.gridline.app.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of evaluating a formula: number, text, bool, array of values,
 * chart descriptor or error. Immutable.
 */
public final class Value {

    private final ValueType type;
    private final double number;
    private final String text;
    private final boolean bool;
    private final List<Value> items;
    private final ChartSpec chart;
    private final EvalError error;

    private Value(ValueType type, double number, String text, boolean bool,
                  List<Value> items, ChartSpec chart, EvalError error) {
        this.type = type;
        this.number = number;
        this.text = text;
        this.bool = bool;
        this.items = items;
        this.chart = chart;
        this.error = error;
    }

    public static Value number(double number) {
        return new Value(ValueType.NUMBER, number, null, false, null, null, null);
    }

    public static Value text(String text) {
        return new Value(ValueType.TEXT, 0, Objects.requireNonNull(text), false, null, null, null);
    }

    public static Value bool(boolean bool) {
        return new Value(ValueType.BOOL, 0, null, bool, null, null, null);
    }

    public static Value array(List<Value> items) {
        return new Value(ValueType.ARRAY, 0, null, false,
                Collections.unmodifiableList(new ArrayList<>(items)), null, null);
    }

    public static Value chart(ChartSpec chart) {
        return new Value(ValueType.CHART, 0, null, false, null, Objects.requireNonNull(chart), null);
    }

    public static Value error(EvalError error) {
        return new Value(ValueType.ERROR, 0, null, false, null, null, Objects.requireNonNull(error));
    }

    public ValueType getType() {
        return type;
    }

    public double getNumber() {
        return number;
    }

    public String getText() {
        return text;
    }

    public boolean getBool() {
        return bool;
    }

    public List<Value> getItems() {
        return items;
    }

    public ChartSpec getChart() {
        return chart;
    }

    public EvalError getError() {
        return error;
    }

    public boolean isArray() {
        return type == ValueType.ARRAY;
    }

    /**
     * Converts to plain Java objects (Double, String, Boolean, List) for JSON responses.
     */
    public Object toPlainObject() {
        switch (type) {
            case NUMBER:
                return number;
            case TEXT:
                return text;
            case BOOL:
                return bool;
            case ARRAY:
                List<Object> plain = new ArrayList<>(items.size());
                for (Value item : items) {
                    plain.add(item.toPlainObject());
                }
                return plain;
            case CHART:
                return chart.toString();
            case ERROR:
                return error.getMarker();
            default:
                throw new IllegalStateException("Unknown value type: " + type);
        }
    }

    /**
     * Text shown for this value in a grid.
     */
    public String display() {
        switch (type) {
            case NUMBER:
                return formatNumber(number);
            case TEXT:
                return text;
            case BOOL:
                return bool ? "TRUE" : "FALSE";
            case ARRAY:
                List<String> parts = new ArrayList<>(items.size());
                for (Value item : items) {
                    parts.add(item.display());
                }
                return "[" + String.join(", ", parts) + "]";
            case CHART:
                return chart.toString();
            case ERROR:
                return error.getMarker();
            default:
                throw new IllegalStateException("Unknown value type: " + type);
        }
    }

    /**
     * Integral values print without a fraction ("42"), others use the shortest
     * representation that parses back to the same double. Negative zero keeps its sign ("-0.0").
     */
    public static String formatNumber(double n) {
        if (Double.compare(n, -0.0) == 0) {
            return Double.toString(n);
        }
        if (!Double.isNaN(n) && !Double.isInfinite(n) && n == Math.rint(n) && Math.abs(n) < 1e15) {
            return Long.toString((long) n);
        }
        return Double.toString(n);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Value)) {
            return false;
        }
        Value other = (Value) o;
        return type == other.type
                && Double.compare(number, other.number) == 0
                && bool == other.bool
                && Objects.equals(text, other.text)
                && Objects.equals(items, other.items)
                && Objects.equals(chart, other.chart)
                && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, number, text, bool, items, chart, error);
    }

    @Override
    public String toString() {
        return type + "(" + display() + ")";
    }
}
