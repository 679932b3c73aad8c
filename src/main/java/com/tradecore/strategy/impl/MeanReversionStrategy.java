package com.tradecore.strategy.impl;

import com.tradecore.domain.enums.OrderSide;
import com.tradecore.domain.model.OrderBookSnapshot;
import com.tradecore.domain.model.PriceSample;
import com.tradecore.domain.model.TradingSignal;
import com.tradecore.strategy.base.TradingStrategy;
import java.util.List;
import java.util.Optional;

/**
 * Fades moves away from the recent mean.
 *
 * <p>Computes the arithmetic mean price over the last {@code lookbackPeriod} samples and
 * the relative deviation of the latest price from it. When the deviation exceeds
 * {@code deviationThreshold} in magnitude it emits SELL above the mean and BUY below it,
 * targeting the mean itself.
 */
public class MeanReversionStrategy implements TradingStrategy {

    public static final String NAME = "MeanReversionStrategy";

    public static final double DEFAULT_QUANTITY = 50.0;

    private final int lookbackPeriod;
    private final double deviationThreshold;
    private final double quantity;

    public MeanReversionStrategy(int lookbackPeriod, double deviationThreshold) {
        this(lookbackPeriod, deviationThreshold, DEFAULT_QUANTITY);
    }

    public MeanReversionStrategy(int lookbackPeriod, double deviationThreshold, double quantity) {
        if (lookbackPeriod < 1) {
            throw new IllegalArgumentException("Mean reversion lookback must be positive: " + lookbackPeriod);
        }
        this.lookbackPeriod = lookbackPeriod;
        this.deviationThreshold = deviationThreshold;
        this.quantity = quantity;
    }

    @Override
    public Optional<TradingSignal> analyze(List<PriceSample> prices, OrderBookSnapshot orderBook) {
        if (prices.size() < lookbackPeriod) {
            return Optional.empty();
        }

        List<PriceSample> window = prices.subList(prices.size() - lookbackPeriod, prices.size());
        PriceSample latest = window.get(window.size() - 1);

        double mean = window.stream().mapToDouble(PriceSample::getPrice).average().orElse(0.0);
        if (mean <= 0) {
            return Optional.empty();
        }
        double deviation = (latest.getPrice() - mean) / mean;

        if (Math.abs(deviation) <= deviationThreshold) {
            return Optional.empty();
        }

        // Above the mean we expect a move back down
        return Optional.of(TradingSignal.builder()
                .symbol(latest.getSymbol())
                .side(deviation > 0 ? OrderSide.SELL : OrderSide.BUY)
                .confidence(Math.min(Math.abs(deviation), 1.0))
                .targetPrice(mean)
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

    public double getDeviationThreshold() {
        return deviationThreshold;
    }
}
