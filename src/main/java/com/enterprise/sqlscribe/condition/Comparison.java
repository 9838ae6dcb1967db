package com.enterprise.sqlscribe.condition;

import com.enterprise.sqlscribe.core.ComparisonOp;
import com.enterprise.sqlscribe.expression.Expression;

import java.util.Objects;

/**
 * {@code left op right}. Nothing is checked against a real schema.
 */
public record Comparison(ComparisonOp op, Expression left, Expression right) implements Condition {

    public Comparison {
        Objects.requireNonNull(op, "operator must not be null");
        Objects.requireNonNull(left, "left operand must not be null");
        Objects.requireNonNull(right, "right operand must not be null");
    }
}
