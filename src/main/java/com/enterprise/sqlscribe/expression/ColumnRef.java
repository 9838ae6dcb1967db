package com.enterprise.sqlscribe.expression;

import com.enterprise.sqlscribe.validation.IdentifierValidator;

import java.util.Objects;

/**
 * Column reference, optionally qualified by the owning table's name.
 */
public record ColumnRef(String qualifier, String name) implements Expression {

    public ColumnRef {
        Objects.requireNonNull(name, "column name must not be null");
        IdentifierValidator.validateIdentifier(name);
        if (qualifier != null) IdentifierValidator.validateIdentifier(qualifier);
    }

    public boolean isQualified() { return qualifier != null; }

    /** {@code qualifier.name}, or just the name. */
    public String qualifiedName() {
        return qualifier == null ? name : qualifier + "." + name;
    }
}
