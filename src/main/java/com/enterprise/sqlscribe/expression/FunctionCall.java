package com.enterprise.sqlscribe.expression;

import com.enterprise.sqlscribe.validation.IdentifierValidator;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * {@code NAME(arg, ...)}. The name is normalized to upper case at construction.
 */
public record FunctionCall(String name, List<Expression> args) implements Expression {

    public FunctionCall {
        Objects.requireNonNull(name, "function name must not be null");
        name = IdentifierValidator.validateIdentifier(name).toUpperCase(Locale.ROOT);
        args = List.copyOf(args);
    }
}
