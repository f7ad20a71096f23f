package com.example.gridfill.engine.expression;

import java.util.Map;

/**
 * Shape of a data value as seen by expressions. Everything that is not a scalar, a byte array,
 * a mapping or a sequence is a host {@code OBJECT} (JavaBean, date, hyperlink, group record) whose
 * properties are read through getters.
 */
public enum ValueKind {
    NULL, BOOLEAN, NUMBER, STRING, SEQUENCE, MAPPING, BINARY, OBJECT;

    public static ValueKind of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof Number) {
            return NUMBER;
        }
        if (value instanceof CharSequence || value instanceof Character || value instanceof Enum) {
            return STRING;
        }
        if (value instanceof byte[]) {
            return BINARY;
        }
        if (value instanceof Map) {
            return MAPPING;
        }
        if (value instanceof Iterable || value.getClass().isArray()) {
            return SEQUENCE;
        }
        return OBJECT;
    }
}
