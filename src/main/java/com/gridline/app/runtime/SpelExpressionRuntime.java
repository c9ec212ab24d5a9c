package com.gridline.app.runtime;

import com.gridline.app.exceptions.PoisonedReferenceException;
import com.gridline.app.models.CellRef;
import com.gridline.app.models.ChartSpec;
import com.gridline.app.models.EvalError;
import com.gridline.app.models.Value;
import com.gridline.app.models.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.convert.TypeDescriptor;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.MethodExecutor;
import org.springframework.expression.MethodResolver;
import org.springframework.expression.TypedValue;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.DataBindingMethodResolver;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ExpressionRuntime} backed by Spring Expression Language.
 *
 * Formulas run in a {@link SimpleEvaluationContext}: no type references, no bean access,
 * no assignment. Top-level calls such as {@code CELL(0, 0)} resolve to registered
 * functions; calls on results ({@code VEC_RANGE(0, 0, 0, 2).size()}) use plain
 * instance-method invocation.
 */
public class SpelExpressionRuntime implements ExpressionRuntime {

    private static final Logger log = LoggerFactory.getLogger(SpelExpressionRuntime.class);

    private final ExpressionParser parser = new SpelExpressionParser();
    private final Map<String, FormulaFunction> functions = new ConcurrentHashMap<>();
    private final Map<String, Expression> parsedExpressions;
    private final MethodResolver functionResolver = new FunctionResolver();

    public SpelExpressionRuntime(int cacheSize) {
        this.parsedExpressions = Collections.synchronizedMap(new LinkedHashMap<String, Expression>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Expression> eldest) {
                return size() > cacheSize;
            }
        });
    }

    /**
     * A runtime with the accessor and range helpers already registered.
     */
    public static SpelExpressionRuntime withBuiltins(int cacheSize, long maxRangeCells) {
        SpelExpressionRuntime runtime = new SpelExpressionRuntime(cacheSize);
        new BuiltinFunctions(maxRangeCells).registerAll(runtime);
        return runtime;
    }

    @Override
    public void registerFunction(String name, FormulaFunction function) {
        functions.put(name, function);
    }

    @Override
    public EvaluationResult evaluate(CellRef cell, String preprocessed, GridView grid) {
        try {
            Expression expression = parsedExpressions.computeIfAbsent(preprocessed, parser::parseExpression);
            EvaluationContext context = SimpleEvaluationContext.forReadOnlyDataBinding()
                    .withMethodResolvers(functionResolver, DataBindingMethodResolver.forInstanceMethodInvocation())
                    .withRootObject(new FormulaScope(cell, grid))
                    .build();
            return toResult(expression.getValue(context));
        } catch (RuntimeException e) {
            PoisonedReferenceException poisoned = findPoisoned(e);
            if (poisoned != null) {
                return EvaluationResult.failure(EvalError.upstream(poisoned.getSource()));
            }
            log.debug("Formula at {} failed: {}", cell, e.getMessage());
            return EvaluationResult.failure(EvalError.evaluation(e.getMessage()));
        }
    }

    private static PoisonedReferenceException findPoisoned(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof PoisonedReferenceException) {
                return (PoisonedReferenceException) t;
            }
        }
        return null;
    }

    private static EvaluationResult toResult(Object raw) {
        Value value = toValue(raw);
        if (value.getType() == ValueType.ERROR) {
            return EvaluationResult.failure(value.getError());
        }
        return EvaluationResult.success(value);
    }

    static Value toValue(Object raw) {
        if (raw == null) {
            return Value.text("");
        }
        if (raw instanceof Value) {
            return (Value) raw;
        }
        if (raw instanceof Number) {
            return Value.number(((Number) raw).doubleValue());
        }
        if (raw instanceof Boolean) {
            return Value.bool((Boolean) raw);
        }
        if (raw instanceof ChartSpec) {
            return Value.chart((ChartSpec) raw);
        }
        if (raw instanceof Collection) {
            List<Value> items = new ArrayList<>();
            for (Object item : (Collection<?>) raw) {
                items.add(toValue(item));
            }
            return Value.array(items);
        }
        if (raw instanceof Object[]) {
            List<Value> items = new ArrayList<>();
            for (Object item : (Object[]) raw) {
                items.add(toValue(item));
            }
            return Value.array(items);
        }
        return Value.text(raw.toString());
    }

    /**
     * Root object of every evaluation; registered functions are resolved against it.
     */
    static final class FormulaScope {

        private final CellRef cell;
        private final GridView grid;

        FormulaScope(CellRef cell, GridView grid) {
            this.cell = cell;
            this.grid = grid;
        }

        @Override
        public String toString() {
            return "formula at " + cell;
        }
    }

    private final class FunctionResolver implements MethodResolver {

        @Override
        public MethodExecutor resolve(EvaluationContext context, Object targetObject, String name,
                                      List<TypeDescriptor> argumentTypes) {
            if (targetObject instanceof FormulaScope && functions.containsKey(name)) {
                return new FunctionExecutor(name);
            }
            return null;
        }
    }

    private final class FunctionExecutor implements MethodExecutor {

        private final String name;

        FunctionExecutor(String name) {
            this.name = name;
        }

        @Override
        public TypedValue execute(EvaluationContext context, Object target, Object... arguments) {
            FormulaFunction function = functions.get(name);
            if (function == null) {
                throw new IllegalStateException("Function " + name + " is no longer registered");
            }
            return new TypedValue(function.invoke(((FormulaScope) target).grid, arguments));
        }
    }
}
