package com.tradecore.core.engine;

import com.tradecore.domain.enums.EngineState;
import com.tradecore.event.EngineEventType;
import com.tradecore.event.EventPublisherHelper;
import com.tradecore.exception.EngineStateException;
import com.tradecore.marketdata.MarketDataIngestor;
import com.tradecore.marketdata.MarketDataSource;
import com.tradecore.marketdata.PriceHistoryStore;
import com.tradecore.oms.OrderCoordinator;
import com.tradecore.risk.RiskManager;
import com.tradecore.strategy.StrategyRegistry;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

/**
 * Owns the polling loops of the engine and their lifecycle.
 *
 * <p>{@link #start} spawns one {@link MarketDataIngestor} per distinct symbol and exactly
 * one {@link DecisionLoop}, all on a fixed pool created for that run and sharing a fresh
 * running flag. {@link #stop} clears the flag and waits for the pool to drain; loops that
 * are still busy after the stop timeout are interrupted. The engine can be started again
 * after a stop.
 *
 * <p>Every loop runs under a supervisor. A loop that dies with an exception or error, or
 * returns while the engine is still running, is recorded in {@link #getLoopFailures()}
 * and announced with a LOOP_TERMINATED engine event.
 */
@Service
public class TradingOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TradingOrchestrator.class);

    private final MarketDataSource marketDataSource;
    private final PriceHistoryStore priceHistoryStore;
    private final StrategyRegistry strategyRegistry;
    private final RiskManager riskManager;
    private final OrderCoordinator orderCoordinator;
    private final EventPublisherHelper eventPublisherHelper;
    private final EngineSettings engineSettings;

    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final Map<String, Throwable> loopFailures = new ConcurrentHashMap<>();

    private volatile EngineState state = EngineState.STOPPED;
    private volatile List<String> activeSymbols = List.of();

    /** Guarded by {@link #lifecycleLock}. Replaced on every start. */
    private AtomicBoolean running = new AtomicBoolean(false);

    /** Guarded by {@link #lifecycleLock}. */
    private ExecutorService loopExecutor;

    public TradingOrchestrator(
            MarketDataSource marketDataSource,
            PriceHistoryStore priceHistoryStore,
            StrategyRegistry strategyRegistry,
            RiskManager riskManager,
            OrderCoordinator orderCoordinator,
            EventPublisherHelper eventPublisherHelper,
            EngineSettings engineSettings) {
        this.marketDataSource = marketDataSource;
        this.priceHistoryStore = priceHistoryStore;
        this.strategyRegistry = strategyRegistry;
        this.riskManager = riskManager;
        this.orderCoordinator = orderCoordinator;
        this.eventPublisherHelper = eventPublisherHelper;
        this.engineSettings = engineSettings;
    }

    /**
     * Starts ingestion for the given symbols and the decision loop.
     *
     * @param symbols symbols to trade; duplicates are ignored
     * @throws IllegalArgumentException if the list is empty or contains a blank symbol
     * @throws EngineStateException if the engine is already running
     */
    public void start(List<String> symbols) {
        List<String> distinctSymbols = validateSymbols(symbols);

        lifecycleLock.lock();
        try {
            if (state == EngineState.RUNNING) {
                throw new EngineStateException(
                        "Engine is already running", Map.of("activeSymbols", activeSymbols));
            }

            AtomicBoolean runFlag = new AtomicBoolean(true);
            loopFailures.clear();
            loopExecutor = Executors.newFixedThreadPool(
                    distinctSymbols.size() + 1, new CustomizableThreadFactory("tradecore-loop-"));

            for (String symbol : distinctSymbols) {
                MarketDataIngestor ingestor = new MarketDataIngestor(
                        symbol, marketDataSource, priceHistoryStore, runFlag, engineSettings.getIngestInterval());
                loopExecutor.execute(supervise("ingest-" + symbol, ingestor, runFlag));
            }

            DecisionLoop decisionLoop = new DecisionLoop(
                    distinctSymbols,
                    marketDataSource,
                    priceHistoryStore,
                    strategyRegistry,
                    riskManager,
                    orderCoordinator,
                    eventPublisherHelper,
                    runFlag,
                    engineSettings.getDecisionInterval(),
                    engineSettings.getMinSamples());
            loopExecutor.execute(supervise("decision", decisionLoop, runFlag));

            running = runFlag;
            activeSymbols = distinctSymbols;
            state = EngineState.RUNNING;
        } finally {
            lifecycleLock.unlock();
        }

        log.info("Trading engine started: symbols={}, strategies={}", distinctSymbols, strategyRegistry.size());
        eventPublisherHelper.publishEngineEvent(
                this, EngineEventType.STARTED, "Engine started", Map.of("symbols", distinctSymbols));
    }

    /**
     * Stops all loops and waits for them to finish. No-op when already stopped.
     */
    public void stop() {
        lifecycleLock.lock();
        try {
            if (state == EngineState.STOPPED) {
                log.debug("Stop requested but engine is not running");
                return;
            }

            log.info("Stopping trading engine...");
            running.set(false);
            awaitLoops();

            loopExecutor = null;
            activeSymbols = List.of();
            state = EngineState.STOPPED;
        } finally {
            lifecycleLock.unlock();
        }

        log.info("Trading engine stopped");
        eventPublisherHelper.publishEngineEvent(this, EngineEventType.STOPPED, "Engine stopped");
    }

    public EngineState getState() {
        return state;
    }

    public boolean isRunning() {
        return state == EngineState.RUNNING;
    }

    public List<String> getActiveSymbols() {
        return activeSymbols;
    }

    /** Loops of the current (or last) run that ended abnormally, keyed by loop name. */
    public Map<String, Throwable> getLoopFailures() {
        return Map.copyOf(loopFailures);
    }

    /** True while no loop of the current (or last) run has ended abnormally. */
    public boolean isHealthy() {
        return loopFailures.isEmpty();
    }

    private List<String> validateSymbols(List<String> symbols) {
        if (symbols == null || symbols.isEmpty()) {
            throw new IllegalArgumentException("At least one symbol is required");
        }
        for (String symbol : symbols) {
            if (symbol == null || symbol.isBlank()) {
                throw new IllegalArgumentException("Symbols must not be blank: " + symbols);
            }
        }
        return List.copyOf(new LinkedHashSet<>(symbols));
    }

    /** Caller holds the lifecycle lock. */
    private void awaitLoops() {
        long timeoutMs = engineSettings.getStopTimeout().toMillis();
        loopExecutor.shutdown();
        try {
            if (!loopExecutor.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Loops still running after {}ms, interrupting", timeoutMs);
                loopExecutor.shutdownNow();
                if (!loopExecutor.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                    log.error("Loops did not terminate after interrupt");
                }
            }
        } catch (InterruptedException e) {
            loopExecutor.shutdownNow();
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for loops to stop");
        }
    }

    private Runnable supervise(String loopName, Runnable loop, AtomicBoolean runFlag) {
        return () -> {
            try {
                loop.run();
                if (runFlag.get()) {
                    recordFailure(loopName, new IllegalStateException("Loop exited while engine was running"));
                }
            } catch (RuntimeException e) {
                recordFailure(loopName, e);
            } catch (Error e) {
                recordFailure(loopName, e);
                throw e;
            }
        };
    }

    private void recordFailure(String loopName, Throwable cause) {
        loopFailures.put(loopName, cause);
        log.error("Loop {} terminated abnormally", loopName, cause);
        eventPublisherHelper.publishEngineEvent(
                this,
                EngineEventType.LOOP_TERMINATED,
                "Loop " + loopName + " terminated abnormally",
                Map.of("loop", loopName, "cause", String.valueOf(cause)));
    }
}
