package com.tradecore.core.engine;

import java.time.Duration;
import lombok.Builder;
import lombok.Data;

/**
 * Loop timing for the {@link TradingOrchestrator}. Built from {@code tradecore.engine.*}
 * by {@link com.tradecore.config.EngineConfig}.
 */
@Data
@Builder
public class EngineSettings {

    /** Pause between market-data polls of one ingestion loop. */
    @Builder.Default
    private Duration ingestInterval = Duration.ofMillis(100);

    /** Pause between decision passes. */
    @Builder.Default
    private Duration decisionInterval = Duration.ofMillis(50);

    /** Samples a symbol needs before strategies see it. */
    @Builder.Default
    private int minSamples = 10;

    /** How long stop() waits for loops before interrupting them. */
    @Builder.Default
    private Duration stopTimeout = Duration.ofSeconds(5);
}
