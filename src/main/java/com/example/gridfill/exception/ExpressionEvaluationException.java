package com.example.gridfill.exception;

/**
 * An expression failed to parse or evaluate against the current context.
 * Recoverable by default: the engine records a diagnostic and continues unless fail-fast is set.
 */
public class ExpressionEvaluationException extends GridFillException {

    public ExpressionEvaluationException(String code, String description) {
        super(code, description);
    }

    public ExpressionEvaluationException(String code, String description, String location) {
        super(code, description, location, null);
    }

    public ExpressionEvaluationException(String code, String description, String location, Throwable cause) {
        super(code, description, location, cause);
    }

    /**
     * Same failure, pinned to the template cell it was raised for.
     */
    public ExpressionEvaluationException at(String cellLocation) {
        if (getLocation() != null || cellLocation == null) {
            return this;
        }
        return new ExpressionEvaluationException(getCode(), getDescription(), cellLocation, this);
    }
}
