package com.enterprise.sqlscribe.expression;

import com.enterprise.sqlscribe.param.SqlLiteralFormatter;

import java.util.Objects;

/**
 * Inline value. Only types {@link SqlLiteralFormatter} can render are accepted.
 */
public record Literal(Object value) implements Expression {

    public Literal {
        Objects.requireNonNull(value, "Literal value is null. Compare against a column or a non-null value");
        SqlLiteralFormatter.requireSupported(value);
    }
}
