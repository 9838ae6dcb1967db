package com.enterprise.sqlscribe.expression;

import com.enterprise.sqlscribe.validation.IdentifierValidator;

/**
 * Refers back to an alias declared elsewhere in the statement, e.g. in GROUP BY.
 */
public record AliasRef(String name) implements Expression {

    public AliasRef {
        IdentifierValidator.validateIdentifier(name);
    }
}
