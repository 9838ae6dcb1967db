package com.enterprise.sqlscribe.exception;

/**
 * Thrown by {@code build()} when the query is missing a required part.
 */
public class IncompleteQueryException extends IllegalStateException {

    public IncompleteQueryException(String message) {
        super(message);
    }
}
