package com.enterprise.sqlscribe.exception;

import java.util.Collection;

/**
 * Thrown when a table column (or a schema table) is looked up by a name
 * that is not currently declared.
 */
public class UnknownFieldException extends IllegalArgumentException {

    private final String field;

    public UnknownFieldException(String owner, String field, Collection<String> known) {
        super("'" + field + "' is not declared on " + owner + "; known: " + known);
        this.field = field;
    }

    public String field() { return field; }
}
