package com.tradecore.strategy.base;

import com.tradecore.domain.model.OrderBookSnapshot;
import com.tradecore.domain.model.PriceSample;
import com.tradecore.domain.model.TradingSignal;
import java.util.List;
import java.util.Optional;

/**
 * Contract for all signal-generating strategies.
 *
 * <p>Implementations are pure functions of their inputs: no mutable state between calls,
 * so the decision loop may evaluate one instance for any number of symbols, from any
 * thread. The price window is ordered oldest first and is an immutable copy.
 */
public interface TradingStrategy {

    /**
     * Evaluates the window and order book and optionally emits a signal.
     *
     * @param prices    the symbol's recent samples, oldest first
     * @param orderBook a fresh order book snapshot for the same symbol
     * @return a signal, or empty when the strategy sees no opportunity
     */
    Optional<TradingSignal> analyze(List<PriceSample> prices, OrderBookSnapshot orderBook);

    /** Name used in logs, events and metrics. */
    String getName();
}
