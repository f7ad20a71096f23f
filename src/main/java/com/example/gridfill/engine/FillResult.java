package com.example.gridfill.engine;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a successful fill: the serialized document, when the entry point produces bytes, and every
 * diagnostic recorded along the way.
 */
public class FillResult {
    private final byte[] content;
    private final List<Diagnostic> diagnostics;

    public FillResult(byte[] content, List<Diagnostic> diagnostics) {
        this.content = content;
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    /**
     * Serialized output, or null when the fill wrote to a path or stream.
     */
    public byte[] getContent() {
        return content;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
