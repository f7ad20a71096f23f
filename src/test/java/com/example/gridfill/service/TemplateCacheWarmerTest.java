package com.example.gridfill.service;

import com.example.gridfill.config.GridFillProperties;
import com.example.gridfill.engine.CompiledTemplate;
import com.example.gridfill.engine.Diagnostic;
import com.example.gridfill.engine.GridFiller;
import com.example.gridfill.exception.TemplateLoadingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.Arrays;
import java.util.Collections;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class TemplateCacheWarmerTest {

    private TemplateLoader templateLoader;
    private GridFiller gridFiller;
    private GridFillProperties properties;
    private TemplateCacheWarmer warmer;

    @BeforeEach
    void setup() {
        templateLoader = Mockito.mock(TemplateLoader.class);
        gridFiller = Mockito.mock(GridFiller.class);
        properties = new GridFillProperties();
        warmer = new TemplateCacheWarmer(templateLoader, gridFiller, properties);
    }

    @Test
    public void testWarmsEveryConfiguredTemplate() {
        CompiledTemplate template = Mockito.mock(CompiledTemplate.class);
        properties.getTemplates().setPreloadIds(Arrays.asList("employees.xlsx", "missing", "sales"));
        when(templateLoader.loadTemplate("employees.xlsx")).thenReturn(template);
        when(templateLoader.loadTemplate("sales")).thenReturn(template);
        when(templateLoader.loadTemplate("missing"))
                .thenThrow(new TemplateLoadingException("TEMPLATE_NOT_FOUND", "Template not found: missing"));
        when(gridFiller.validate(eq(template), any()))
                .thenReturn(Collections.singletonList(new Diagnostic("MALFORMED_EXPRESSION", "Sheet1!A1", "bad")));

        warmer.warmCache();

        verify(templateLoader).loadTemplate("employees.xlsx");
        verify(templateLoader).loadTemplate("missing");
        verify(templateLoader).loadTemplate("sales");
        verify(gridFiller, Mockito.times(2)).validate(eq(template), any());
    }

    @Test
    public void testSkipsValidationWhenDisabled() {
        CompiledTemplate template = Mockito.mock(CompiledTemplate.class);
        properties.getTemplates().setPreloadIds(Collections.singletonList("employees.xlsx"));
        properties.getTemplates().setValidateOnPreload(false);
        when(templateLoader.loadTemplate("employees.xlsx")).thenReturn(template);

        warmer.warmCache();

        verify(templateLoader).loadTemplate("employees.xlsx");
        verify(gridFiller, never()).validate(any(CompiledTemplate.class), any());
    }

    @Test
    public void testSkipsWhenCachingDisabled() {
        properties.getTemplates().setCacheEnabled(false);
        properties.getTemplates().setPreloadIds(Collections.singletonList("employees.xlsx"));

        warmer.warmCache();

        verify(templateLoader, never()).loadTemplate(anyString());
    }
}
