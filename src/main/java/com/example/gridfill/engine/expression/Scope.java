package com.example.gridfill.engine.expression;

/**
 * Name resolution used by expressions.
 */
public interface Scope {

    boolean contains(String name);

    /**
     * Value bound to {@code name}; only meaningful when {@link #contains(String)} is true.
     */
    Object lookup(String name);
}
