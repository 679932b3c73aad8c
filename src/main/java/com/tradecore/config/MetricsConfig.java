package com.tradecore.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Micrometer setup for the engine.
 *
 * <p>Provides an in-memory registry unless an exporter registry is already present, and
 * tags every meter with the application name. Custom meters live in
 * {@link com.tradecore.observability.EngineMetricsService}.
 */
@Configuration
public class MetricsConfig {

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry(@Value("${spring.application.name:tradecore}") String applicationName) {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        registry.config().commonTags("application", applicationName);
        return registry;
    }
}
