package com.enterprise.sqlscribe.condition;

/**
 * Immutable predicate tree: a {@link Comparison} leaf or a {@link BooleanCombination}.
 * Combining never mutates either operand.
 */
public interface Condition {

    default Condition and(Condition other) {
        return new BooleanCombination(BooleanCombination.Logic.AND, this, other);
    }

    default Condition or(Condition other) {
        return new BooleanCombination(BooleanCombination.Logic.OR, this, other);
    }
}
