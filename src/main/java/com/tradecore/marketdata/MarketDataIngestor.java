package com.tradecore.marketdata;

import com.tradecore.domain.model.PriceSample;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polling loop that pulls price samples for one symbol into the {@link PriceHistoryStore}.
 *
 * <p>The orchestrator runs one ingestor per symbol. The loop re-checks the shared
 * running flag before every fetch and after every sleep, so it exits within one polling
 * interval of the flag flipping. Per-iteration failures are logged and the loop moves on
 * to the next poll. An interrupt ends the loop.
 */
public class MarketDataIngestor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MarketDataIngestor.class);

    private final String symbol;
    private final MarketDataSource marketDataSource;
    private final PriceHistoryStore priceHistoryStore;
    private final AtomicBoolean running;
    private final Duration pollInterval;

    public MarketDataIngestor(
            String symbol,
            MarketDataSource marketDataSource,
            PriceHistoryStore priceHistoryStore,
            AtomicBoolean running,
            Duration pollInterval) {
        this.symbol = symbol;
        this.marketDataSource = marketDataSource;
        this.priceHistoryStore = priceHistoryStore;
        this.running = running;
        this.pollInterval = pollInterval;
    }

    @Override
    public void run() {
        log.info("Ingestion loop started: symbol={}, interval={}ms", symbol, pollInterval.toMillis());

        while (running.get()) {
            try {
                pollOnce();
            } catch (RuntimeException e) {
                log.warn("Ingestion iteration failed for {}: {}", symbol, e.getMessage(), e);
            }

            try {
                TimeUnit.MILLISECONDS.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Ingestion loop interrupted: symbol={}", symbol);
                break;
            }
        }

        log.info("Ingestion loop stopped: symbol={}", symbol);
    }

    /**
     * Fetches one sample and records it.
     *
     * @return true if a sample was recorded, false on a data gap or a malformed sample
     */
    public boolean pollOnce() {
        if (!running.get()) {
            return false;
        }

        Optional<PriceSample> sample = marketDataSource.getPrice(symbol);
        if (sample.isEmpty()) {
            return false;
        }

        PriceSample priceSample = sample.get();
        if (!priceSample.isWellFormed() || !symbol.equals(priceSample.getSymbol())) {
            log.debug("Dropping malformed sample for {}: {}", symbol, priceSample);
            return false;
        }

        priceHistoryStore.record(symbol, priceSample);
        return true;
    }

    public String getSymbol() {
        return symbol;
    }
}
