package com.enterprise.sqlscribe.core;

import com.enterprise.sqlscribe.validation.IdentifierValidator;

import java.util.Objects;

/**
 * A table as it appears in a FROM or JOIN clause: name, optional schema and optional alias.
 * Each part is quoted independently on render, e.g. {@code "hr"."employee" AS "e"}.
 */
public record TableRef(String schema, String name, String alias) {

    public TableRef {
        Objects.requireNonNull(name, "table name must not be null");
        IdentifierValidator.validateIdentifier(name);
        if (schema != null) IdentifierValidator.validateIdentifier(schema);
        if (alias != null) IdentifierValidator.validateIdentifier(alias);
    }

    public static TableRef of(String name) {
        return new TableRef(null, name, null);
    }

    public static TableRef of(String schema, String name) {
        return new TableRef(schema, name, null);
    }

    /** Returns a copy of this reference carrying the given alias. */
    public TableRef as(String newAlias) {
        return new TableRef(schema, name, Objects.requireNonNull(newAlias, "alias must not be null"));
    }

    public boolean hasSchema() { return schema != null; }

    public boolean hasAlias() { return alias != null; }
}
