package com.tradecore.marketdata;

import com.tradecore.domain.model.OrderBookSnapshot;
import com.tradecore.domain.model.PriceSample;
import java.util.Optional;

/**
 * Abstraction over the market data feed. Every component that needs prices or order
 * book depth goes through this interface, never through a feed-specific class.
 *
 * <p>An empty result means "no data this tick" and is not an error; callers skip the
 * tick. Implementations may block on I/O and may throw unchecked exceptions, which
 * the polling loops log and survive.
 *
 * <p>The paper-trading implementation is
 * {@link com.tradecore.simulator.SimulatedMarketDataSource}.
 */
public interface MarketDataSource {

    /**
     * Fetches the latest price sample for a symbol.
     *
     * @param symbol the trading symbol (e.g., "BTC/USD")
     * @return the latest sample, or empty when the feed has nothing for this tick
     */
    Optional<PriceSample> getPrice(String symbol);

    /**
     * Fetches a fresh order book snapshot for a symbol.
     *
     * @param symbol the trading symbol
     * @return the snapshot, or empty when the feed has nothing for this tick
     */
    Optional<OrderBookSnapshot> getOrderBook(String symbol);
}
