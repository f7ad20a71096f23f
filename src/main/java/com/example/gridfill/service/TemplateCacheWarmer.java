package com.example.gridfill.service;

import com.example.gridfill.config.GridFillProperties;
import com.example.gridfill.engine.CompiledTemplate;
import com.example.gridfill.engine.Diagnostic;
import com.example.gridfill.engine.GridFiller;
import com.example.gridfill.exception.GridFillException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Compiles the templates listed in {@code gridfill.templates.preload-ids} at startup so the first fill of each
 * does not pay for parsing, and reports malformed expressions early.
 *
 * gridfill:
 *   templates:
 *     preload-ids:
 *       - employees.xlsx
 *       - sales-by-region
 */
@Slf4j
@Component
public class TemplateCacheWarmer {

    private final TemplateLoader templateLoader;
    private final GridFiller gridFiller;
    private final GridFillProperties properties;

    public TemplateCacheWarmer(TemplateLoader templateLoader, GridFiller gridFiller, GridFillProperties properties) {
        this.templateLoader = templateLoader;
        this.gridFiller = gridFiller;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void warmCache() {
        GridFillProperties.Templates templates = properties.getTemplates();
        if (!templates.isCacheEnabled()) {
            log.info("Template cache warming skipped (caching disabled)");
            return;
        }
        List<String> ids = templates.getPreloadIds();
        if (ids == null || ids.isEmpty()) {
            log.info("Template cache warming skipped (no templates configured)");
            return;
        }

        log.info("Starting template cache warming for {} template(s)", ids.size());
        long startTime = System.currentTimeMillis();
        int warmed = 0;
        for (String templateId : ids) {
            if (warmTemplate(templateId, templates.isValidateOnPreload())) {
                warmed++;
            }
        }
        log.info("Template cache warming completed in {}ms ({}/{} warmed)",
                System.currentTimeMillis() - startTime, warmed, ids.size());
    }

    private boolean warmTemplate(String templateId, boolean validate) {
        try {
            CompiledTemplate template = templateLoader.loadTemplate(templateId);
            log.info("  Warmed: {} ({} area(s))", templateId, template.getAreas().size());
            if (validate) {
                List<Diagnostic> diagnostics = gridFiller.validate(template, properties.toFillOptions());
                for (Diagnostic diagnostic : diagnostics) {
                    log.warn("    {}: {}", templateId, diagnostic);
                }
            }
            return true;
        } catch (GridFillException e) {
            log.error("  Failed to warm template: {} [{}] {}", templateId, e.getCode(), e.getDescription());
            return false;
        }
    }
}
