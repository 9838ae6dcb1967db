package com.enterprise.sqlscribe.validation;

import com.enterprise.sqlscribe.exception.InvalidIdentifierException;

import java.util.regex.Pattern;

/**
 * Guard for names that end up in SQL text unparameterized: tables, schemas,
 * columns, aliases and function names. Qualification is modelled separately,
 * so dots are rejected here.
 */
public final class IdentifierValidator {

    private IdentifierValidator() {}

    // Letters/underscore start, then alphanumeric/underscore
    private static final Pattern IDENTIFIER_PATTERN =
            Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public static String validateIdentifier(String identifier) {
        if (identifier == null || !IDENTIFIER_PATTERN.matcher(identifier).matches()) {
            throw new InvalidIdentifierException(identifier);
        }
        return identifier;
    }

    public static boolean isValidIdentifier(String identifier) {
        return identifier != null && IDENTIFIER_PATTERN.matcher(identifier).matches();
    }
}
