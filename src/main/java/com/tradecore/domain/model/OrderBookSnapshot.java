package com.tradecore.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.OptionalDouble;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Point-in-time view of the order book for a symbol.
 *
 * <p>Bids are ordered by descending price, asks by ascending price, so the first
 * element of each list is the top of book. The level lists are immutable.
 */
@Value
@Builder
public class OrderBookSnapshot {

    String symbol;

    @Singular
    List<BookLevel> bids;

    @Singular
    List<BookLevel> asks;

    Instant timestamp;

    public OptionalDouble bestBid() {
        return bids.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(bids.get(0).getPrice());
    }

    public OptionalDouble bestAsk() {
        return asks.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(asks.get(0).getPrice());
    }

    /** Midpoint of best bid and best ask. Empty when either side has no levels. */
    public OptionalDouble midPrice() {
        if (bids.isEmpty() || asks.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((bids.get(0).getPrice() + asks.get(0).getPrice()) / 2.0);
    }

    public OptionalDouble spread() {
        if (bids.isEmpty() || asks.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(asks.get(0).getPrice() - bids.get(0).getPrice());
    }
}
