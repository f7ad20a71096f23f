package com.example.gridfill.service;

import com.example.gridfill.aspect.LogExecutionTime;
import com.example.gridfill.config.GridFillProperties;
import com.example.gridfill.exception.TemplateLoadingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads raw resource bytes (templates, data files) through the {@code rawResources} cache.
 * Kept apart from {@link TemplateLoader} so its calls go through the cache proxy.
 */
@Slf4j
@Component
public class RawResourceLoader {
    private final ResourceLoader resourceLoader;
    private final GridFillProperties properties;

    public RawResourceLoader(ResourceLoader resourceLoader, GridFillProperties properties) {
        this.resourceLoader = resourceLoader;
        this.properties = properties;
    }

    /**
     * Fetch raw bytes of a resource
     *
     * @param path classpath:, file: or plain classpath path
     */
    @LogExecutionTime("Fetching Raw Resource")
    @Cacheable(value = "rawResources", key = "#path")
    public byte[] getResourceBytes(String path) {
        checkPath(path);
        String logMsg = properties.getTemplates().isCacheEnabled()
                ? "Fetching raw resource (cache miss): {}"
                : "Fetching raw resource: {}";
        log.info(logMsg, path);
        Resource resource = resourceLoader.getResource(path);
        if (!resource.exists()) {
            throw new TemplateLoadingException(
                    "TEMPLATE_NOT_FOUND",
                    "Resource not found: " + path
            );
        }
        return readBytes(resource, path);
    }

    /**
     * Whether {@code path} names a readable resource. Not cached, so a template added after startup is found.
     */
    public boolean isReadable(String path) {
        Resource resource = resourceLoader.getResource(path);
        return resource.exists() && resource.isReadable();
    }

    static void checkPath(String path) {
        if (path == null || path.isBlank()) {
            throw new TemplateLoadingException(
                    "INVALID_PATH",
                    "Resource path cannot be null or empty"
            );
        }
        if (path.contains("..")) {
            throw new TemplateLoadingException(
                    "INVALID_PATH",
                    "Resource path must not leave the template location: " + path
            );
        }
    }

    private static byte[] readBytes(Resource resource, String path) {
        try (InputStream is = resource.getInputStream()) {
            return is.readAllBytes();
        } catch (IOException e) {
            log.error("Failed to read resource bytes from stream: {}", path, e);
            throw new TemplateLoadingException(
                    "RESOURCE_READ_ERROR",
                    "Failed to read resource: " + path,
                    e
            );
        }
    }
}
