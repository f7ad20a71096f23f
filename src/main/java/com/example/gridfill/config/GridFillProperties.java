package com.example.gridfill.config;

import com.example.gridfill.engine.FillOptions;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Service-wide fill defaults and template loading settings.
 *
 * Example application.yml:
 *
 * gridfill:
 *   fail-fast: false
 *   keep-template-sheet: false
 *   templates:
 *     location: classpath:templates/
 *     preload-ids:
 *       - employees.xlsx
 */
@Data
@Component
@ConfigurationProperties(prefix = "gridfill")
public class GridFillProperties {

    private String notationBegin = "${";

    private String notationEnd = "}";

    private boolean keepTemplateSheet = false;

    private boolean hideTemplateSheet = false;

    /**
     * Abort on the first expression error instead of rendering the cell empty
     */
    private boolean failFast = false;

    private boolean recalculateOnOpen = true;

    /**
     * Put a comment carrying the error on every cell whose expression failed
     */
    private boolean annotateErrors = false;

    private Templates templates = new Templates();

    public FillOptions toFillOptions() {
        return FillOptions.builder()
                .notationBegin(notationBegin)
                .notationEnd(notationEnd)
                .keepTemplateSheet(keepTemplateSheet)
                .hideTemplateSheet(hideTemplateSheet)
                .failFast(failFast)
                .recalculateOnOpen(recalculateOnOpen)
                .annotateErrors(annotateErrors)
                .build();
    }

    @Data
    public static class Templates {

        /**
         * Directory template ids are resolved against: a classpath: or file: location
         */
        private String location = "classpath:templates/";

        private boolean cacheEnabled = true;

        /**
         * Template ids compiled at startup
         */
        private List<String> preloadIds = new ArrayList<>();

        private boolean validateOnPreload = true;
    }
}
