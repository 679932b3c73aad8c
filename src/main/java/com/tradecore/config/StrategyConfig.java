package com.tradecore.config;

import com.tradecore.strategy.StrategyRegistry;
import com.tradecore.strategy.impl.MeanReversionStrategy;
import com.tradecore.strategy.impl.MomentumStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the {@link StrategyRegistry} from {@code tradecore.strategy.*}.
 *
 * <p>Registration order is evaluation order: momentum first, then mean reversion.
 */
@Configuration
public class StrategyConfig {

    private static final Logger log = LoggerFactory.getLogger(StrategyConfig.class);

    @Value("${tradecore.strategy.momentum.enabled:true}")
    private boolean momentumEnabled;

    @Value("${tradecore.strategy.momentum.lookback-period:10}")
    private int momentumLookback;

    @Value("${tradecore.strategy.momentum.threshold:0.02}")
    private double momentumThreshold;

    @Value("${tradecore.strategy.momentum.quantity:100}")
    private double momentumQuantity;

    @Value("${tradecore.strategy.mean-reversion.enabled:true}")
    private boolean meanReversionEnabled;

    @Value("${tradecore.strategy.mean-reversion.lookback-period:20}")
    private int meanReversionLookback;

    @Value("${tradecore.strategy.mean-reversion.threshold:0.03}")
    private double meanReversionThreshold;

    @Value("${tradecore.strategy.mean-reversion.quantity:50}")
    private double meanReversionQuantity;

    @Bean
    public StrategyRegistry strategyRegistry() {
        StrategyRegistry registry = new StrategyRegistry();
        if (momentumEnabled) {
            registry.register(new MomentumStrategy(momentumLookback, momentumThreshold, momentumQuantity));
        }
        if (meanReversionEnabled) {
            registry.register(
                    new MeanReversionStrategy(meanReversionLookback, meanReversionThreshold, meanReversionQuantity));
        }
        log.info("Strategy registry initialized with {} strategies", registry.size());
        return registry;
    }
}
