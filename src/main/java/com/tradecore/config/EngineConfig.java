package com.tradecore.config;

import com.tradecore.core.engine.EngineSettings;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Loop timing for the trading orchestrator. Prefix {@code tradecore.engine.*}. */
@Configuration
public class EngineConfig {

    @Bean
    public EngineSettings engineSettings(
            @Value("${tradecore.engine.ingest-interval-ms:100}") long ingestIntervalMs,
            @Value("${tradecore.engine.decision-interval-ms:50}") long decisionIntervalMs,
            @Value("${tradecore.engine.min-samples:10}") int minSamples,
            @Value("${tradecore.engine.stop-timeout-ms:5000}") long stopTimeoutMs) {
        return EngineSettings.builder()
                .ingestInterval(Duration.ofMillis(ingestIntervalMs))
                .decisionInterval(Duration.ofMillis(decisionIntervalMs))
                .minSamples(minSamples)
                .stopTimeout(Duration.ofMillis(stopTimeoutMs))
                .build();
    }
}
