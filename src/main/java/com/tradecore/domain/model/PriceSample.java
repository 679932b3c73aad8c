package com.tradecore.domain.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A single price observation for a symbol, as delivered by the market data source.
 *
 * <p>Immutable once created. Price is expected to be positive and volume non-negative;
 * the ingestor drops samples that violate this before they reach the history store.
 */
@Value
@Builder
public class PriceSample {

    String symbol;

    double price;

    Instant timestamp;

    /** Traded volume observed with this sample. */
    double volume;

    /** True when price is positive and finite and volume is non-negative and finite. */
    public boolean isWellFormed() {
        return symbol != null
                && Double.isFinite(price)
                && price > 0
                && Double.isFinite(volume)
                && volume >= 0;
    }
}
