package com.enterprise.sqlscribe.builder;

import com.enterprise.sqlscribe.condition.Condition;
import com.enterprise.sqlscribe.core.JoinType;
import com.enterprise.sqlscribe.core.TableRef;

import java.util.Objects;

public record JoinClause(JoinType type, TableRef table, Condition on) {

    public JoinClause {
        Objects.requireNonNull(type, "join type must not be null");
        Objects.requireNonNull(table, "joined table must not be null");
        Objects.requireNonNull(on, "ON condition must not be null");
    }
}
