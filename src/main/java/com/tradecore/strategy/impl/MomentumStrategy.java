package com.tradecore.strategy.impl;

import com.tradecore.domain.enums.OrderSide;
import com.tradecore.domain.model.OrderBookSnapshot;
import com.tradecore.domain.model.PriceSample;
import com.tradecore.domain.model.TradingSignal;
import com.tradecore.strategy.base.TradingStrategy;
import java.util.List;
import java.util.Optional;

/**
 * Trend-following strategy: trades in the direction of a sufficiently large price move
 * that is backed by volume.
 *
 * <p>Over the last {@code lookbackPeriod} samples it compares the latest price with the
 * oldest price of the window. A signal is emitted only when the relative change exceeds
 * {@code momentumThreshold} in magnitude AND the mean volume of the window exceeds
 * {@value #MIN_AVERAGE_VOLUME}. Rising prices produce BUY, falling prices SELL.
 * Confidence is the magnitude of the change, capped at 1. The target price is the latest
 * price.
 */
public class MomentumStrategy implements TradingStrategy {

    public static final String NAME = "MomentumStrategy";

    static final double MIN_AVERAGE_VOLUME = 1000.0;

    public static final double DEFAULT_QUANTITY = 100.0;

    private final int lookbackPeriod;
    private final double momentumThreshold;
    private final double quantity;

    public MomentumStrategy(int lookbackPeriod, double momentumThreshold) {
        this(lookbackPeriod, momentumThreshold, DEFAULT_QUANTITY);
    }

    public MomentumStrategy(int lookbackPeriod, double momentumThreshold, double quantity) {
        if (lookbackPeriod < 2) {
            throw new IllegalArgumentException("Momentum lookback must be at least 2: " + lookbackPeriod);
        }
        this.lookbackPeriod = lookbackPeriod;
        this.momentumThreshold = momentumThreshold;
        this.quantity = quantity;
    }

    @Override
    public Optional<TradingSignal> analyze(List<PriceSample> prices, OrderBookSnapshot orderBook) {
        if (prices.size() < lookbackPeriod) {
            return Optional.empty();
        }

        List<PriceSample> window = prices.subList(prices.size() - lookbackPeriod, prices.size());
        PriceSample latest = window.get(window.size() - 1);
        double oldestPrice = window.get(0).getPrice();

        double priceChange = (latest.getPrice() - oldestPrice) / oldestPrice;
        double averageVolume =
                window.stream().mapToDouble(PriceSample::getVolume).sum() / lookbackPeriod;

        if (Math.abs(priceChange) <= momentumThreshold || averageVolume <= MIN_AVERAGE_VOLUME) {
            return Optional.empty();
        }

        return Optional.of(TradingSignal.builder()
                .symbol(latest.getSymbol())
                .side(priceChange > 0 ? OrderSide.BUY : OrderSide.SELL)
                .confidence(Math.min(Math.abs(priceChange), 1.0))
                .targetPrice(latest.getPrice())
                .quantity(quantity)
                .build());
    }

    @Override
    public String getName() {
        return NAME;
    }

    public int getLookbackPeriod() {
        return lookbackPeriod;
    }

    public double getMomentumThreshold() {
        return momentumThreshold;
    }
}
