package com.example.gridfill.service;

import com.example.gridfill.config.GridFillProperties;
import com.example.gridfill.engine.GridFiller;
import com.example.gridfill.engine.TemplateWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Raw resource reads go through the Spring cache proxy, from data loading and template loading alike
 */
@SpringJUnitConfig(RawResourceLoaderCacheTest.CacheConfig.class)
public class RawResourceLoaderCacheTest {

    @Configuration
    @EnableCaching
    static class CacheConfig {
        @Bean
        CacheManager cacheManager() {
            return new ConcurrentMapCacheManager("compiledTemplates", "rawResources");
        }

        @Bean
        @Primary
        ResourceLoader resourceLoader() {
            return Mockito.mock(ResourceLoader.class);
        }

        @Bean
        GridFillProperties gridFillProperties() {
            return new GridFillProperties();
        }

        @Bean
        RawResourceLoader rawResourceLoader(ResourceLoader resourceLoader, GridFillProperties properties) {
            return new RawResourceLoader(resourceLoader, properties);
        }

        @Bean
        TemplateLoader templateLoader(RawResourceLoader rawResourceLoader, GridFillProperties properties) {
            return new TemplateLoader(rawResourceLoader, properties, new GridFiller());
        }
    }

    @Autowired
    private CacheManager cacheManager;

    @Autowired
    private ResourceLoader resourceLoader;

    @Autowired
    private TemplateLoader templateLoader;

    private Resource resource;

    @BeforeEach
    void setup() {
        cacheManager.getCache("rawResources").clear();
        cacheManager.getCache("compiledTemplates").clear();
        Mockito.reset(resourceLoader);
        resource = Mockito.mock(Resource.class);
        when(resource.exists()).thenReturn(true);
        when(resource.isReadable()).thenReturn(true);
        when(resourceLoader.getResource(anyString())).thenReturn(resource);
    }

    @Test
    public void testSecondDataReadIsServedFromCache() throws Exception {
        byte[] json = "{\"title\":\"Report\"}".getBytes(StandardCharsets.UTF_8);
        when(resource.getInputStream()).thenAnswer(invocation -> new ByteArrayInputStream(json));

        Map<String, Object> first = templateLoader.loadData("file:/data/report.json");
        Map<String, Object> second = templateLoader.loadData("file:/data/report.json");

        assertEquals("Report", first.get("title"));
        assertEquals(first, second);
        verify(resource, times(1)).getInputStream();
        assertNotNull(cacheManager.getCache("rawResources").get("file:/data/report.json"));
    }

    @Test
    public void testTemplateBytesLandInRawResourceCache() throws Exception {
        byte[] template = TemplateWorkbook.create("Sheet1")
                .value("A1", "${title}").comment("A1", "jx:area(lastCell=\"A1\")")
                .toBytes();
        when(resource.getInputStream()).thenAnswer(invocation -> new ByteArrayInputStream(template));

        templateLoader.loadTemplate("report");
        templateLoader.loadTemplate("report");

        verify(resource, times(1)).getInputStream();
        assertNotNull(cacheManager.getCache("rawResources").get("classpath:templates/report"));
        assertNotNull(cacheManager.getCache("compiledTemplates").get("report"));
    }
}
