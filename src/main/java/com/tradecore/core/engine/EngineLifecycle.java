package com.tradecore.core.engine;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Ties the {@link TradingOrchestrator} to the Spring context lifecycle.
 *
 * <p>With {@code tradecore.engine.auto-start=true} the engine starts trading
 * {@code tradecore.engine.symbols} once the context is refreshed. The engine is always
 * stopped on context shutdown, before the beans it uses are destroyed.
 */
@Component
public class EngineLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(EngineLifecycle.class);

    private final TradingOrchestrator tradingOrchestrator;
    private final boolean autoStart;
    private final List<String> symbols;

    public EngineLifecycle(
            TradingOrchestrator tradingOrchestrator,
            @Value("${tradecore.engine.auto-start:false}") boolean autoStart,
            @Value("${tradecore.engine.symbols:}") List<String> symbols) {
        this.tradingOrchestrator = tradingOrchestrator;
        this.autoStart = autoStart;
        this.symbols = symbols;
    }

    @Override
    public void start() {
        if (symbols.isEmpty()) {
            log.warn("Auto-start enabled but tradecore.engine.symbols is empty, engine not started");
            return;
        }
        tradingOrchestrator.start(symbols);
    }

    @Override
    public void stop() {
        tradingOrchestrator.stop();
    }

    @Override
    public boolean isRunning() {
        return tradingOrchestrator.isRunning();
    }

    @Override
    public boolean isAutoStartup() {
        return autoStart;
    }

    @Override
    public int getPhase() {
        // Stop early so loops are gone before the gateway executor shuts down
        return Integer.MAX_VALUE - 1;
    }
}
