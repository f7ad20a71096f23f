package com.example.gridfill.service;

import com.example.gridfill.aspect.LogExecutionTime;
import com.example.gridfill.config.GridFillProperties;
import com.example.gridfill.engine.CompiledTemplate;
import com.example.gridfill.engine.GridFiller;
import com.example.gridfill.exception.TemplateLoadingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;

/**
 * Loads spreadsheet templates and JSON/YAML data files.
 * Template ids are resolved against {@code gridfill.templates.location}, which may be a classpath: or file:
 * location; other resource paths may carry their own prefix.
 */
@Slf4j
@Component
public class TemplateLoader {
    private static final String[] TEMPLATE_EXTENSIONS = {"", ".xlsx", ".xls"};

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final RawResourceLoader rawResourceLoader;
    private final GridFillProperties properties;
    private final GridFiller gridFiller;

    public TemplateLoader(RawResourceLoader rawResourceLoader, GridFillProperties properties, GridFiller gridFiller) {
        this.rawResourceLoader = rawResourceLoader;
        this.properties = properties;
        this.gridFiller = gridFiller;
    }

    /**
     * Load and compile a template
     *
     * @param templateId template file name relative to the template location; the extension may be omitted
     * @return compiled template, shared by every fill of the same id
     */
    @LogExecutionTime("Compiling Template")
    @Cacheable(value = "compiledTemplates", key = "#templateId")
    public CompiledTemplate loadTemplate(String templateId) {
        RawResourceLoader.checkPath(templateId);
        String location = properties.getTemplates().getLocation();
        for (String ext : TEMPLATE_EXTENSIONS) {
            String candidate = location + templateId + ext;
            if (rawResourceLoader.isReadable(candidate)) {
                log.info("Resolved template '{}' to {}", templateId, candidate);
                return gridFiller.compile(templateId, rawResourceLoader.getResourceBytes(candidate));
            }
        }
        throw new TemplateLoadingException(
                "TEMPLATE_NOT_FOUND",
                "Template not found: " + templateId + " (location " + location + ")"
        );
    }

    /**
     * Read a JSON or YAML data file into the root map of a fill. The format follows the file extension;
     * anything other than .yaml or .yml is read as JSON.
     */
    public Map<String, Object> loadData(String path) {
        byte[] bytes = rawResourceLoader.getResourceBytes(path);
        String lower = path.toLowerCase(Locale.ROOT);
        ObjectMapper mapper = lower.endsWith(".yaml") || lower.endsWith(".yml") ? yamlMapper : jsonMapper;
        try {
            Map<String, Object> data = mapper.readValue(bytes, new TypeReference<Map<String, Object>>() {});
            log.debug("Loaded {} top-level data entries from {}", data == null ? 0 : data.size(), path);
            return data;
        } catch (IOException e) {
            log.error("Failed to parse data file: {}", path, e);
            throw new TemplateLoadingException(
                    "DATA_READ_ERROR",
                    "Failed to parse data file " + path + ": " + e.getMessage(),
                    e
            );
        }
    }

    /**
     * Clear every compiled template and raw resource from the cache
     */
    @CacheEvict(value = {"compiledTemplates", "rawResources"}, allEntries = true)
    public void clearCache() {
        log.info("Cleared compiled template and raw resource caches");
    }
}
