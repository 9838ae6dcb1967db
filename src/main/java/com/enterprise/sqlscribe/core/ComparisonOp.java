package com.enterprise.sqlscribe.core;

/**
 * Binary comparison operators of a predicate leaf.
 */
public enum ComparisonOp {
    EQ("="),
    NEQ("<>"),
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<=");

    private final String sql;

    ComparisonOp(String sql) { this.sql = sql; }

    public String sql() { return sql; }

    /** {@code left op right}, single spaces around the operator. */
    public String render(String left, String right) {
        return left + " " + sql + " " + right;
    }
}
