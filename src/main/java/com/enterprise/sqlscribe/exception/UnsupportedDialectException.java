package com.enterprise.sqlscribe.exception;

/**
 * Thrown when a dialect identifier is not registered.
 */
public class UnsupportedDialectException extends IllegalArgumentException {

    private final String dialectId;

    public UnsupportedDialectException(String dialectId) {
        super("Unsupported dialect: " + dialectId);
        this.dialectId = dialectId;
    }

    public String dialectId() { return dialectId; }
}
