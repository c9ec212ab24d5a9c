package com.gridline.app.config;

import com.gridline.app.runtime.ExpressionRuntime;
import com.gridline.app.runtime.SpelExpressionRuntime;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the formula runtime shared by all documents.
 */
@Configuration
public class EngineConfiguration {

    @Bean
    public ExpressionRuntime expressionRuntime(GridlineProperties properties) {
        return SpelExpressionRuntime.withBuiltins(properties.getExpressionCacheSize(), properties.getMaxRangeCells());
    }
}
