package com.example.gridfill.service;

import com.example.gridfill.aspect.LogExecutionTime;
import com.example.gridfill.config.GridFillProperties;
import com.example.gridfill.engine.CompiledTemplate;
import com.example.gridfill.engine.Diagnostic;
import com.example.gridfill.engine.FillOptions;
import com.example.gridfill.engine.FillResult;
import com.example.gridfill.engine.GridFiller;
import com.example.gridfill.exception.TemplateLoadingException;
import com.example.gridfill.model.FillRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fills stored or uploaded templates with request data, on top of the gridfill.* defaults.
 */
@Slf4j
@Service
public class FillService {
    private final TemplateLoader templateLoader;
    private final GridFiller gridFiller;
    private final GridFillProperties properties;

    public FillService(TemplateLoader templateLoader, GridFiller gridFiller, GridFillProperties properties) {
        this.templateLoader = templateLoader;
        this.gridFiller = gridFiller;
        this.properties = properties;
    }

    @LogExecutionTime("Filling Template")
    public FillResult fill(FillRequest request) {
        if (request.getTemplateId() == null || request.getTemplateId().isBlank()) {
            throw new TemplateLoadingException("INVALID_PATH", "templateId is required");
        }
        CompiledTemplate template = templateLoader.loadTemplate(request.getTemplateId());
        Map<String, Object> data = mergeData(request);
        return gridFiller.fillToBytes(template, data, resolveOptions(request.getOptions()));
    }

    /**
     * Fill a template that came with the request instead of from the template location. Uploaded templates
     * are compiled per call and never cached.
     */
    @LogExecutionTime("Filling Uploaded Template")
    public FillResult fillUpload(byte[] template, String name, Map<String, Object> data, Map<String, Object> options) {
        CompiledTemplate compiled = gridFiller.compile(name == null ? "upload" : name, template);
        return gridFiller.fillToBytes(compiled, data == null ? new HashMap<>() : data, resolveOptions(options));
    }

    public List<Diagnostic> validate(String templateId) {
        CompiledTemplate template = templateLoader.loadTemplate(templateId);
        return gridFiller.validate(template, properties.toFillOptions());
    }

    private Map<String, Object> mergeData(FillRequest request) {
        Map<String, Object> data = new HashMap<>();
        if (request.getDataPath() != null && !request.getDataPath().isBlank()) {
            data.putAll(templateLoader.loadData(request.getDataPath()));
        }
        if (request.getData() != null) {
            data.putAll(request.getData());
        }
        return data;
    }

    /**
     * Service defaults overridden by request options. Keys are accepted in camelCase or kebab-case;
     * unknown keys are ignored with a warning.
     */
    FillOptions resolveOptions(Map<String, Object> overrides) {
        FillOptions.FillOptionsBuilder builder = properties.toFillOptions().toBuilder();
        if (overrides == null) {
            return builder.build();
        }
        for (Map.Entry<String, Object> entry : overrides.entrySet()) {
            Object value = entry.getValue();
            switch (normalizeKey(entry.getKey())) {
                case "notationbegin":
                    builder.notationBegin(String.valueOf(value));
                    break;
                case "notationend":
                    builder.notationEnd(String.valueOf(value));
                    break;
                case "keeptemplatesheet":
                    builder.keepTemplateSheet(toBoolean(value));
                    break;
                case "hidetemplatesheet":
                    builder.hideTemplateSheet(toBoolean(value));
                    break;
                case "failfast":
                    builder.failFast(toBoolean(value));
                    break;
                case "recalculateonopen":
                    builder.recalculateOnOpen(toBoolean(value));
                    break;
                case "annotateerrors":
                    builder.annotateErrors(toBoolean(value));
                    break;
                default:
                    log.warn("Ignoring unknown fill option '{}'", entry.getKey());
            }
        }
        return builder.build();
    }

    private static String normalizeKey(String key) {
        return key == null ? "" : key.replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && Boolean.parseBoolean(value.toString().trim());
    }
}
