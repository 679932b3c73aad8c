package com.tradecore.strategy;

import com.tradecore.strategy.base.TradingStrategy;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered collection of the strategies the decision loop runs on every cycle.
 *
 * <p>Registration order is evaluation order. Backed by a {@link CopyOnWriteArrayList}:
 * registration is rare and iteration happens every decision cycle, so readers get a
 * stable view without locking.
 */
public class StrategyRegistry {

    private static final Logger log = LoggerFactory.getLogger(StrategyRegistry.class);

    private final List<TradingStrategy> strategies = new CopyOnWriteArrayList<>();

    public StrategyRegistry() {}

    public StrategyRegistry(List<TradingStrategy> strategies) {
        strategies.forEach(this::register);
    }

    /**
     * Appends a strategy. Names must be unique so that events and metrics stay unambiguous.
     *
     * @throws IllegalArgumentException if a strategy with the same name is already registered
     */
    public synchronized void register(TradingStrategy strategy) {
        if (findByName(strategy.getName()).isPresent()) {
            throw new IllegalArgumentException("Strategy already registered: " + strategy.getName());
        }
        strategies.add(strategy);
        log.info("Registered strategy {} (position {})", strategy.getName(), strategies.size());
    }

    /** Snapshot of the registered strategies in evaluation order. */
    public List<TradingStrategy> getStrategies() {
        return List.copyOf(strategies);
    }

    public Optional<TradingStrategy> findByName(String name) {
        return strategies.stream().filter(s -> s.getName().equals(name)).findFirst();
    }

    public int size() {
        return strategies.size();
    }
}
