package com.example.gridfill.exception;

/**
 * Raised by the service layer when a template or data resource cannot be located or read.
 */
public class TemplateLoadingException extends GridFillException {

    public TemplateLoadingException(String code, String description) {
        super(code, description);
    }

    public TemplateLoadingException(String code, String description, Throwable cause) {
        super(code, description, cause);
    }
}
