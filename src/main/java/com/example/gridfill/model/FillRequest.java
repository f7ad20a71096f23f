package com.example.gridfill.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Request object for a template fill
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FillRequest {
    /**
     * Template id, relative to gridfill.templates.location (e.g. "employees.xlsx" or "reports/sales")
     */
    private String templateId;

    /**
     * Data the template expressions are evaluated against
     */
    @Builder.Default
    private Map<String, Object> data = new HashMap<>();

    /**
     * Optional JSON or YAML data file; entries of {@code data} win over entries loaded from it
     */
    private String dataPath;

    /**
     * Per-request overrides of the gridfill.* fill options (failFast, keepTemplateSheet, notationBegin, ...)
     */
    @Builder.Default
    private Map<String, Object> options = new HashMap<>();
}
