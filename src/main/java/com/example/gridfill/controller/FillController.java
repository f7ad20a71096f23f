package com.example.gridfill.controller;

import com.example.gridfill.engine.Diagnostic;
import com.example.gridfill.engine.FillResult;
import com.example.gridfill.exception.ExpressionEvaluationException;
import com.example.gridfill.exception.GridFillException;
import com.example.gridfill.exception.TemplateConfigurationException;
import com.example.gridfill.exception.TemplateLoadingException;
import com.example.gridfill.exception.TemplateParseException;
import com.example.gridfill.model.FillRequest;
import com.example.gridfill.service.FillService;
import com.example.gridfill.service.TemplateLoader;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API for filling spreadsheet templates
 */
@Slf4j
@RestController
@RequestMapping("/api/fill")
@RequiredArgsConstructor
public class FillController {
    static final String XLSX_MEDIA_TYPE = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";
    static final String DIAGNOSTICS_HEADER = "X-Fill-Diagnostics";

    private final FillService fillService;
    private final TemplateLoader templateLoader;
    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Fill a stored template and download the workbook
     *
     * POST /api/fill
     * {
     *   "templateId": "employees.xlsx",
     *   "data": { "employees": [ { "name": "Elsa", "salary": 1500 } ] },
     *   "options": { "failFast": false }
     * }
     *
     * The number of non-fatal diagnostics is returned in the X-Fill-Diagnostics header.
     */
    @PostMapping
    public ResponseEntity<?> fill(@RequestBody FillRequest request) {
        log.info("Received fill request for template: {}", request.getTemplateId());
        try {
            FillResult result = fillService.fill(request);
            return workbook(result, fileName(request.getTemplateId()));
        } catch (GridFillException e) {
            return error(e);
        }
    }

    /**
     * Fill a template uploaded with the request. Multipart parts: {@code template} (the workbook),
     * optional {@code data} and {@code options} (JSON objects).
     */
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> fillUpload(@RequestPart("template") MultipartFile template,
                                        @RequestParam(value = "data", required = false) String data,
                                        @RequestParam(value = "options", required = false) String options) {
        String name = template.getOriginalFilename() == null ? "upload.xlsx" : template.getOriginalFilename();
        log.info("Received fill request for uploaded template: {} ({} bytes)", name, template.getSize());
        try {
            FillResult result = fillService.fillUpload(template.getBytes(), name, parseJson(data, "data"),
                    parseJson(options, "options"));
            return workbook(result, fileName(name));
        } catch (GridFillException e) {
            return error(e);
        } catch (IOException e) {
            log.error("Failed to read uploaded template {}", name, e);
            Map<String, Object> body = new HashMap<>();
            body.put("code", "RESOURCE_READ_ERROR");
            body.put("description", "Failed to read uploaded template: " + e.getMessage());
            return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
        }
    }

    /**
     * Syntax check of every expression of a stored template
     */
    @GetMapping("/templates/{templateId}/validate")
    public ResponseEntity<?> validate(@PathVariable String templateId) {
        try {
            List<Diagnostic> diagnostics = fillService.validate(templateId);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("templateId", templateId);
            body.put("valid", diagnostics.isEmpty());
            body.put("diagnostics", describe(diagnostics));
            return ResponseEntity.ok(body);
        } catch (GridFillException e) {
            return error(e);
        }
    }

    @DeleteMapping("/templates/cache")
    public ResponseEntity<String> clearCache() {
        templateLoader.clearCache();
        return ResponseEntity.ok("Template caches cleared");
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Grid fill service is running");
    }

    private ResponseEntity<byte[]> workbook(FillResult result, String fileName) {
        byte[] xlsx = result.getContent();
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.parseMediaType(XLSX_MEDIA_TYPE));
        headers.setContentDispositionFormData("attachment", fileName);
        headers.setContentLength(xlsx.length);
        headers.set(DIAGNOSTICS_HEADER, String.valueOf(result.getDiagnostics().size()));
        if (result.hasDiagnostics()) {
            log.warn("Fill of {} finished with {} diagnostic(s)", fileName, result.getDiagnostics().size());
        }
        return new ResponseEntity<>(xlsx, headers, HttpStatus.OK);
    }

    private ResponseEntity<Map<String, Object>> error(GridFillException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", e.getCode());
        body.put("description", e.getDescription());
        if (e.getLocation() != null) {
            body.put("location", e.getLocation());
        }
        if (!e.getDiagnostics().isEmpty()) {
            body.put("diagnostics", describe(e.getDiagnostics()));
        }
        HttpStatus status = statusOf(e);
        log.warn("Fill request failed with {} {}: {}", status.value(), e.getCode(), e.getDescription());
        return new ResponseEntity<>(body, status);
    }

    static HttpStatus statusOf(GridFillException e) {
        String code = e.getCode();
        if ("TEMPLATE_NOT_FOUND".equals(code) || "INVALID_PATH".equals(code)) {
            return HttpStatus.NOT_FOUND;
        }
        if ("DATA_READ_ERROR".equals(code) || e instanceof ExpressionEvaluationException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (e instanceof TemplateParseException || e instanceof TemplateConfigurationException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static List<Map<String, String>> describe(List<Diagnostic> diagnostics) {
        List<Map<String, String>> out = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            Map<String, String> entry = new LinkedHashMap<>();
            entry.put("code", diagnostic.getCode());
            entry.put("location", diagnostic.getLocation());
            entry.put("message", diagnostic.getMessage());
            out.add(entry);
        }
        return out;
    }

    private Map<String, Object> parseJson(String json, String part) {
        if (json == null || json.isBlank()) {
            return new HashMap<>();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new TemplateLoadingException(
                    "DATA_READ_ERROR",
                    "Part '" + part + "' is not a JSON object: " + e.getOriginalMessage(),
                    e
            );
        }
    }

    private static String fileName(String templateId) {
        if (templateId == null || templateId.isBlank()) {
            return "document.xlsx";
        }
        String base = templateId.substring(templateId.lastIndexOf('/') + 1);
        if (base.endsWith(".xlsx")) {
            base = base.substring(0, base.length() - 5);
        } else if (base.endsWith(".xls")) {
            base = base.substring(0, base.length() - 4);
        }
        return base + "-filled.xlsx";
    }
}
