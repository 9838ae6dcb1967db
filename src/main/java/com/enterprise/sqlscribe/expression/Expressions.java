package com.enterprise.sqlscribe.expression;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Static factory for {@link Expression} nodes, and the single place where
 * loosely typed API arguments are normalized.
 */
public final class Expressions {

    private Expressions() {}

    public static ColumnRef column(String name) {
        return new ColumnRef(null, name);
    }

    public static ColumnRef column(String qualifier, String name) {
        return new ColumnRef(qualifier, name);
    }

    public static Star star() {
        return Star.INSTANCE;
    }

    public static Literal literal(Object value) {
        return new Literal(value);
    }

    public static FunctionCall call(String functionName, Object... args) {
        return new FunctionCall(functionName, list(args));
    }

    public static Aliased alias(Object expression, String alias) {
        return new Aliased(of(expression), alias);
    }

    public static AliasRef aliasRef(String name) {
        return new AliasRef(name);
    }

    /**
     * Normalizes a select/group-by/function argument: an {@link Expression}
     * is used as is, a {@code String} names a column and {@code "*"} is {@link Star}.
     */
    public static Expression of(Object columnOrExpression) {
        Objects.requireNonNull(columnOrExpression, "column or expression must not be null");
        if (columnOrExpression instanceof Expression e) {
            return e;
        }
        if (columnOrExpression instanceof String s) {
            return "*".equals(s) ? star() : column(s);
        }
        throw new IllegalArgumentException(
                "Expected a column name or an Expression but got "
                        + columnOrExpression.getClass().getName());
    }

    /**
     * Normalizes the right-hand side of a comparison: an {@link Expression}
     * is used as is, anything else becomes a {@link Literal}.
     */
    public static Expression value(Object expressionOrValue) {
        Objects.requireNonNull(expressionOrValue,
                "Comparison value is null. Compare against a column or a non-null value");
        if (expressionOrValue instanceof Expression e) {
            return e;
        }
        return literal(expressionOrValue);
    }

    public static List<Expression> list(Object... columnsOrExpressions) {
        return Arrays.stream(columnsOrExpressions)
                .map(Expressions::of)
                .toList();
    }
}
