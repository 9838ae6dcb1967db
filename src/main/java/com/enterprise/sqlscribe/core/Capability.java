package com.enterprise.sqlscribe.core;

/**
 * Optional SQL features a dialect may or may not support.
 * Checked through {@link com.enterprise.sqlscribe.dialect.DialectRules#require(Capability)}.
 */
public enum Capability {
    OFFSET,
    RIGHT_JOIN,
    FULL_JOIN
}
