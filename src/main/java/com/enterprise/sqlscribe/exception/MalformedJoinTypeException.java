package com.enterprise.sqlscribe.exception;

public class MalformedJoinTypeException extends IllegalArgumentException {

    public MalformedJoinTypeException(String joinType) {
        super("Invalid join type: " + joinType + " (expected INNER, LEFT, RIGHT or FULL)");
    }
}
