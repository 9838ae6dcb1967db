package com.enterprise.sqlscribe.expression;

/**
 * {@code *}, as in {@code COUNT(*)}. Never quoted or qualified.
 */
public record Star() implements Expression {

    public static final Star INSTANCE = new Star();
}
