package com.example.gridfill.engine.expression;

import lombok.Value;

/**
 * Marker pair delimiting expressions inside cell text, {@code ${...}} by default.
 */
@Value
public class Notation {
    public static final Notation DEFAULT = new Notation("${", "}");

    String begin;
    String end;

    public static Notation of(String begin, String end) {
        if (begin == null || begin.isEmpty() || end == null || end.isEmpty()) {
            throw new IllegalArgumentException("Expression notation markers must not be empty");
        }
        return DEFAULT.begin.equals(begin) && DEFAULT.end.equals(end) ? DEFAULT : new Notation(begin, end);
    }
}
