package com.tradecore.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradecore.core.engine.TradingOrchestrator;
import com.tradecore.domain.enums.EngineState;
import com.tradecore.marketdata.PriceHistoryStore;
import com.tradecore.risk.RiskParams;
import com.tradecore.simulator.SimulatedOrderGateway;
import com.tradecore.strategy.StrategyRegistry;
import com.tradecore.strategy.impl.MeanReversionStrategy;
import com.tradecore.strategy.impl.MomentumStrategy;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

/**
 * Boots the full paper-trading context and runs the engine briefly against the
 * simulators.
 */
@SpringBootTest(
        properties = {
            "tradecore.engine.auto-start=false",
            "tradecore.engine.ingest-interval-ms=10",
            "tradecore.simulator.latency-ms=1",
            "tradecore.risk.max-position-size=500"
        })
class TradecoreApplicationIntegrationTest {

    @Autowired
    private TradingOrchestrator tradingOrchestrator;

    @Autowired
    private PriceHistoryStore priceHistoryStore;

    @Autowired
    private StrategyRegistry strategyRegistry;

    @Autowired
    private RiskParams riskParams;

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    private SimulatedOrderGateway simulatedOrderGateway;

    @AfterEach
    void tearDown() {
        tradingOrchestrator.stop();
        priceHistoryStore.clear();
    }

    @Test
    @DisplayName("Context wires the configured strategies, limits and meters")
    void contextWiring() {
        assertThat(strategyRegistry.size()).isEqualTo(2);
        MomentumStrategy momentum = (MomentumStrategy)
                strategyRegistry.findByName(MomentumStrategy.NAME).orElseThrow();
        assertThat(momentum.getLookbackPeriod()).isEqualTo(10);
        assertThat(momentum.getMomentumThreshold()).isEqualTo(0.02);
        MeanReversionStrategy meanReversion = (MeanReversionStrategy)
                strategyRegistry.findByName(MeanReversionStrategy.NAME).orElseThrow();
        assertThat(meanReversion.getLookbackPeriod()).isEqualTo(20);
        assertThat(meanReversion.getDeviationThreshold()).isEqualTo(0.03);
        assertThat(priceHistoryStore.getCapacity()).isEqualTo(1000);
        assertThat(riskParams.getMaxPositionSize()).isEqualTo(500.0);
        assertThat(riskParams.getMaxLossPerTrade()).isEqualTo(100.0);
        assertThat(tradingOrchestrator.getState()).isEqualTo(EngineState.STOPPED);
        assertThat(meterRegistry.find("orders.pending").gauge()).isNotNull();
        assertThat(meterRegistry.find("signals.generated").counter()).isNotNull();
        assertThat(simulatedOrderGateway.getOpenOrderIds()).isEmpty();
    }

    @Test
    @DisplayName("Engine ingests simulated prices and stops cleanly")
    void engineRunsAgainstSimulators() throws Exception {
        tradingOrchestrator.start(List.of("BTC/USD", "ETH/USD"));

        long deadline = System.currentTimeMillis() + 5000;
        while ((priceHistoryStore.size("BTC/USD") < 5 || priceHistoryStore.size("ETH/USD") < 5)
                && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        tradingOrchestrator.stop();

        assertThat(priceHistoryStore.size("BTC/USD")).isGreaterThanOrEqualTo(5);
        assertThat(priceHistoryStore.size("ETH/USD")).isGreaterThanOrEqualTo(5);
        assertThat(tradingOrchestrator.getState()).isEqualTo(EngineState.STOPPED);
        assertThat(tradingOrchestrator.isHealthy()).isTrue();
    }
}
