package com.example.gridfill.exception;

/**
 * The commands of a template parse but do not fit together: regions out of bounds,
 * overlapping siblings, empty each blocks, multisheet mismatches.
 */
public class TemplateConfigurationException extends GridFillException {

    public TemplateConfigurationException(String code, String description, String location) {
        super(code, description, location, null);
    }
}
