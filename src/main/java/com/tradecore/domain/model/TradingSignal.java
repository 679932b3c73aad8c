package com.tradecore.domain.model;

import com.tradecore.domain.enums.OrderSide;
import lombok.Builder;
import lombok.Value;

/**
 * A strategy's recommendation to buy or sell a symbol.
 *
 * <p>Produced by a {@link com.tradecore.strategy.base.TradingStrategy} and consumed
 * exactly once by the decision loop, which turns it into an {@link Order}.
 */
@Value
@Builder
public class TradingSignal {

    String symbol;

    OrderSide side;

    /** Strength of the signal in [0, 1]. */
    double confidence;

    /** Price the strategy expects to trade at; also the reference price for risk checks. */
    double targetPrice;

    double quantity;
}
