package com.enterprise.sqlscribe.core;

import com.enterprise.sqlscribe.exception.MalformedJoinTypeException;

import java.util.Locale;

public enum JoinType {
    INNER("INNER JOIN", null),
    LEFT("LEFT JOIN", null),
    RIGHT("RIGHT JOIN", Capability.RIGHT_JOIN),
    FULL("FULL JOIN", Capability.FULL_JOIN);

    private final String sql;
    private final Capability requires;

    JoinType(String sql, Capability requires) {
        this.sql = sql;
        this.requires = requires;
    }

    /** Default keyword spelling; dialects may override it. */
    public String sql() { return sql; }

    /** Capability a dialect must declare to render this join, or null if every dialect has it. */
    public Capability requires() { return requires; }

    /**
     * Parses a join type name case-insensitively ({@code "inner"}, {@code "LEFT"}, ...).
     *
     * @throws MalformedJoinTypeException if the name is not one of the enumerated types
     */
    public static JoinType parse(String name) {
        if (name == null || name.isBlank()) {
            throw new MalformedJoinTypeException(String.valueOf(name));
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MalformedJoinTypeException(name);
        }
    }
}
