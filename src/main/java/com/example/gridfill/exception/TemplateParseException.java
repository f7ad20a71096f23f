package com.example.gridfill.exception;

/**
 * A cell annotation could not be turned into a command: unknown command name,
 * missing required attribute, malformed declaration or bad cell reference.
 */
public class TemplateParseException extends GridFillException {

    public TemplateParseException(String code, String description, String location) {
        super(code, description, location, null);
    }

    public TemplateParseException(String code, String description, String location, Throwable cause) {
        super(code, description, location, cause);
    }
}
