package com.example.gridfill.exception;

import com.example.gridfill.engine.Diagnostic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class for every failure raised while compiling or filling a template.
 * Carries a stable error code, a human readable description, the template location
 * (e.g. {@code Sheet1!B4}) when known, and the non-fatal diagnostics recorded before the failure.
 */
public class GridFillException extends RuntimeException {
    private final String code;
    private final String description;
    private final String location;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public GridFillException(String code, String description) {
        this(code, description, null, null);
    }

    public GridFillException(String code, String description, Throwable cause) {
        this(code, description, null, cause);
    }

    public GridFillException(String code, String description, String location, Throwable cause) {
        super(location == null ? code + ": " + description : code + " at " + location + ": " + description, cause);
        this.code = code;
        this.description = description;
        this.location = location;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public String getLocation() {
        return location;
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Attach diagnostics collected before this failure surfaced.
     */
    public GridFillException withDiagnostics(List<Diagnostic> collected) {
        if (collected != null) {
            diagnostics.addAll(collected);
        }
        return this;
    }
}
