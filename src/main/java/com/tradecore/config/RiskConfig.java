package com.tradecore.config;

import com.tradecore.risk.RiskParams;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the global {@link RiskParams} bean from application.properties.
 *
 * <p>Properties prefix: {@code tradecore.risk.*}. Every limit has a default, so the
 * engine never runs without risk checks.
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskParams riskParams(
            @Value("${tradecore.risk.max-position-size:1000}") double maxPositionSize,
            @Value("${tradecore.risk.max-loss-per-trade:100}") double maxLossPerTrade,
            @Value("${tradecore.risk.max-daily-loss:500}") double maxDailyLoss,
            @Value("${tradecore.risk.stop-loss-pct:0.02}") double stopLossPct,
            @Value("${tradecore.risk.take-profit-pct:0.04}") double takeProfitPct) {
        return RiskParams.builder()
                .maxPositionSize(maxPositionSize)
                .maxLossPerTrade(maxLossPerTrade)
                .maxDailyLoss(maxDailyLoss)
                .stopLossPct(stopLossPct)
                .takeProfitPct(takeProfitPct)
                .build();
    }
}
