package com.tradecore.simulator;

import com.tradecore.domain.model.BookLevel;
import com.tradecore.domain.model.OrderBookSnapshot;
import com.tradecore.domain.model.PriceSample;
import com.tradecore.marketdata.MarketDataSource;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Paper trading {@link MarketDataSource} that generates a random walk per symbol.
 *
 * <p>Each {@link #getPrice} call moves the symbol's price by a normally distributed
 * relative step of {@code volatility} and reports a volume drawn uniformly from
 * [100, 10000). Order books have five levels per side spaced 0.01 around the last price.
 *
 * <p>Active when {@code tradecore.trading-mode=PAPER} (the default).
 */
@Component
@ConditionalOnProperty(name = "tradecore.trading-mode", havingValue = "PAPER", matchIfMissing = true)
public class SimulatedMarketDataSource implements MarketDataSource {

    private static final Logger log = LoggerFactory.getLogger(SimulatedMarketDataSource.class);

    static final int BOOK_DEPTH = 5;
    static final double TICK_SIZE = 0.01;
    static final double MIN_VOLUME = 100.0;
    static final double MAX_VOLUME = 10_000.0;
    private static final double MIN_PRICE = 0.01;

    private final double startPrice;
    private final double volatility;
    private final Random random;
    private final Map<String, Double> lastPrices = new ConcurrentHashMap<>();

    @Autowired
    public SimulatedMarketDataSource(
            @Value("${tradecore.simulator.start-price:100.0}") double startPrice,
            @Value("${tradecore.simulator.volatility:0.001}") double volatility) {
        this(startPrice, volatility, new Random());
    }

    public SimulatedMarketDataSource(double startPrice, double volatility, Random random) {
        if (startPrice <= 0) {
            throw new IllegalArgumentException("Start price must be positive: " + startPrice);
        }
        this.startPrice = startPrice;
        this.volatility = volatility;
        this.random = random;
        log.info("Simulated market data source: startPrice={}, volatility={}", startPrice, volatility);
    }

    @Override
    public Optional<PriceSample> getPrice(String symbol) {
        double price = lastPrices.compute(symbol, (s, previous) -> nextPrice(previous));
        double volume = MIN_VOLUME + random.nextDouble() * (MAX_VOLUME - MIN_VOLUME);
        return Optional.of(PriceSample.builder()
                .symbol(symbol)
                .price(price)
                .volume(volume)
                .timestamp(Instant.now())
                .build());
    }

    @Override
    public Optional<OrderBookSnapshot> getOrderBook(String symbol) {
        double mid = lastPrices.getOrDefault(symbol, startPrice);
        OrderBookSnapshot.OrderBookSnapshotBuilder book =
                OrderBookSnapshot.builder().symbol(symbol).timestamp(Instant.now());
        for (int level = 1; level <= BOOK_DEPTH; level++) {
            book.bid(BookLevel.of(mid - level * TICK_SIZE, levelQuantity()));
            book.ask(BookLevel.of(mid + level * TICK_SIZE, levelQuantity()));
        }
        return Optional.of(book.build());
    }

    private double nextPrice(Double previous) {
        if (previous == null) {
            return startPrice;
        }
        double next = previous * (1.0 + random.nextGaussian() * volatility);
        return Math.max(next, MIN_PRICE);
    }

    private double levelQuantity() {
        return MIN_VOLUME + random.nextDouble() * (MAX_VOLUME - MIN_VOLUME);
    }
}
