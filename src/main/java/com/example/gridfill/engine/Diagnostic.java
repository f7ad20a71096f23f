package com.example.gridfill.engine;

import lombok.Value;

/**
 * A non-fatal problem recorded during a fill: the offending cell rendered empty and processing went on.
 */
@Value
public class Diagnostic {
    String code;
    String location;
    String message;

    @Override
    public String toString() {
        return code + (location == null ? "" : " at " + location) + ": " + message;
    }
}
