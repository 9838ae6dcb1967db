package com.enterprise.sqlscribe.condition;

import java.util.Objects;

/**
 * Binary AND/OR node. Created via {@link Condition#and}/{@link Condition#or}
 * or {@link Conditions#and}/{@link Conditions#or}.
 */
public record BooleanCombination(Logic logic, Condition left, Condition right) implements Condition {

    public enum Logic { AND, OR }

    public BooleanCombination {
        Objects.requireNonNull(logic, "logic must not be null");
        Objects.requireNonNull(left, "left condition must not be null");
        Objects.requireNonNull(right, "right condition must not be null");
    }
}
