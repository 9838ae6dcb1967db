package com.enterprise.sqlscribe.expression;

import com.enterprise.sqlscribe.validation.IdentifierValidator;

import java.util.Objects;

/**
 * {@code expression AS alias} in a select list. Outside a select list the
 * alias is dropped and the wrapped expression renders on its own.
 */
public record Aliased(Expression expression, String alias) implements Expression {

    public Aliased {
        Objects.requireNonNull(expression, "aliased expression must not be null");
        Objects.requireNonNull(alias, "alias must not be null");
        IdentifierValidator.validateIdentifier(alias);
    }
}
