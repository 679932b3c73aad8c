package com.tradecore.core.engine;

import com.tradecore.domain.enums.OrderType;
import com.tradecore.domain.model.Order;
import com.tradecore.domain.model.OrderBookSnapshot;
import com.tradecore.domain.model.PriceSample;
import com.tradecore.domain.model.TradingSignal;
import com.tradecore.event.EventPublisherHelper;
import com.tradecore.marketdata.MarketDataSource;
import com.tradecore.marketdata.PriceHistoryStore;
import com.tradecore.oms.OrderCoordinator;
import com.tradecore.oms.OrderSubmissionResult;
import com.tradecore.risk.RiskManager;
import com.tradecore.strategy.StrategyRegistry;
import com.tradecore.strategy.base.TradingStrategy;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single decision loop of a run.
 *
 * <p>Each pass walks the symbols in order. A symbol with at least {@code minSamples}
 * recorded samples gets a fresh order book; every registered strategy sees the same
 * window and book. Each signal becomes a MARKET order that goes through
 * {@link RiskManager#executeWithinLimits}, which submits it via the
 * {@link OrderCoordinator} and books the position only after a confirmed submission.
 *
 * <p>The running flag is checked before every external call. A strategy that throws is
 * skipped for that pass; other strategies and symbols still run.
 */
public class DecisionLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DecisionLoop.class);

    private final List<String> symbols;
    private final MarketDataSource marketDataSource;
    private final PriceHistoryStore priceHistoryStore;
    private final StrategyRegistry strategyRegistry;
    private final RiskManager riskManager;
    private final OrderCoordinator orderCoordinator;
    private final EventPublisherHelper eventPublisherHelper;
    private final AtomicBoolean running;
    private final Duration interval;
    private final int minSamples;

    public DecisionLoop(
            List<String> symbols,
            MarketDataSource marketDataSource,
            PriceHistoryStore priceHistoryStore,
            StrategyRegistry strategyRegistry,
            RiskManager riskManager,
            OrderCoordinator orderCoordinator,
            EventPublisherHelper eventPublisherHelper,
            AtomicBoolean running,
            Duration interval,
            int minSamples) {
        this.symbols = List.copyOf(symbols);
        this.marketDataSource = marketDataSource;
        this.priceHistoryStore = priceHistoryStore;
        this.strategyRegistry = strategyRegistry;
        this.riskManager = riskManager;
        this.orderCoordinator = orderCoordinator;
        this.eventPublisherHelper = eventPublisherHelper;
        this.running = running;
        this.interval = interval;
        this.minSamples = minSamples;
    }

    @Override
    public void run() {
        log.info(
                "Decision loop started: symbols={}, interval={}ms, strategies={}",
                symbols,
                interval.toMillis(),
                strategyRegistry.size());

        while (running.get()) {
            try {
                runOnce();
            } catch (RuntimeException e) {
                log.error("Decision pass failed: {}", e.getMessage(), e);
            }

            try {
                TimeUnit.MILLISECONDS.sleep(interval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Decision loop interrupted");
                break;
            }
        }

        log.info("Decision loop stopped");
    }

    /**
     * One pass over all symbols.
     *
     * @return number of orders submitted in this pass
     */
    public int runOnce() {
        int submitted = 0;
        for (String symbol : symbols) {
            if (!running.get()) {
                break;
            }
            submitted += evaluateSymbol(symbol);
        }
        return submitted;
    }

    private int evaluateSymbol(String symbol) {
        List<PriceSample> window = priceHistoryStore.snapshot(symbol);
        if (window.size() < minSamples) {
            return 0;
        }

        if (!running.get()) {
            return 0;
        }
        Optional<OrderBookSnapshot> orderBook = marketDataSource.getOrderBook(symbol);
        if (orderBook.isEmpty()) {
            log.debug("No order book for {}, skipping pass", symbol);
            return 0;
        }

        int submitted = 0;
        for (TradingStrategy strategy : strategyRegistry.getStrategies()) {
            if (!running.get()) {
                break;
            }

            Optional<TradingSignal> signal;
            try {
                signal = strategy.analyze(window, orderBook.get());
            } catch (RuntimeException e) {
                log.warn("Strategy {} failed on {}: {}", strategy.getName(), symbol, e.getMessage(), e);
                continue;
            }

            if (signal.isPresent() && processSignal(symbol, signal.get(), strategy.getName())) {
                submitted++;
            }
        }
        return submitted;
    }

    private boolean processSignal(String symbol, TradingSignal signal, String strategyName) {
        log.debug(
                "Signal from {}: {} {} {} @ {} (confidence {})",
                strategyName,
                signal.getSide(),
                signal.getQuantity(),
                symbol,
                signal.getTargetPrice(),
                signal.getConfidence());
        eventPublisherHelper.publishSignal(this, signal, strategyName);

        if (!running.get()) {
            return false;
        }

        Order order = Order.builder()
                .id(UUID.randomUUID().toString())
                .symbol(symbol)
                .side(signal.getSide())
                .type(OrderType.MARKET)
                .quantity(signal.getQuantity())
                .strategyName(strategyName)
                .createdAt(Instant.now())
                .build();

        OrderSubmissionResult result =
                riskManager.executeWithinLimits(order, signal.getTargetPrice(), orderCoordinator::submit);

        switch (result.getOutcome()) {
            case SUBMITTED:
                log.info(
                        "Order placed: id={}, {} {} {} from {}",
                        result.getOrderId(),
                        order.getSide(),
                        order.getQuantity(),
                        symbol,
                        strategyName);
                return true;
            case RISK_REJECTED:
                eventPublisherHelper.publishOrderRiskRejected(this, order, result.getRejectionReason());
                return false;
            default:
                // Coordinator already logged and published the gateway failure
                return false;
        }
    }
}
