package com.example.gridfill.config;

import com.example.gridfill.engine.GridFiller;
import com.example.gridfill.engine.expression.ExpressionEvaluator;
import com.example.gridfill.engine.expression.FunctionRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GridFillConfiguration {

    @Bean
    public ExpressionEvaluator expressionEvaluator() {
        return new ExpressionEvaluator(FunctionRegistry.standard());
    }

    @Bean
    public GridFiller gridFiller(ExpressionEvaluator expressionEvaluator) {
        return new GridFiller(expressionEvaluator);
    }
}
