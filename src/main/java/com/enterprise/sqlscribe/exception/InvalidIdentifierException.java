package com.enterprise.sqlscribe.exception;

public class InvalidIdentifierException extends IllegalArgumentException {

    public InvalidIdentifierException(String identifier) {
        super("Invalid identifier: " + identifier);
    }
}
