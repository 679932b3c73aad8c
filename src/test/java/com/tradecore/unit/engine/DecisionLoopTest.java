package com.tradecore.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradecore.core.engine.DecisionLoop;
import com.tradecore.domain.enums.OrderSide;
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
import com.tradecore.risk.RiskParams;
import com.tradecore.strategy.StrategyRegistry;
import com.tradecore.strategy.base.TradingStrategy;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class DecisionLoopTest {

    private static final String SYMBOL = "BTC/USD";

    @Mock
    private MarketDataSource marketDataSource;

    @Mock
    private OrderCoordinator orderCoordinator;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    @Mock
    private TradingStrategy strategy;

    private PriceHistoryStore store;
    private StrategyRegistry registry;
    private RiskManager riskManager;
    private AtomicBoolean running;
    private DecisionLoop decisionLoop;

    @BeforeEach
    void setUp() {
        store = new PriceHistoryStore(100);
        registry = new StrategyRegistry();
        riskManager = new RiskManager(
                RiskParams.builder().maxPositionSize(100).maxLossPerTrade(1000).build(),
                mock(ApplicationEventPublisher.class));
        running = new AtomicBoolean(true);
        decisionLoop = new DecisionLoop(
                List.of(SYMBOL),
                marketDataSource,
                store,
                registry,
                riskManager,
                orderCoordinator,
                eventPublisherHelper,
                running,
                Duration.ofMillis(5),
                3);
    }

    private void recordSamples(int count) {
        for (int i = 0; i < count; i++) {
            store.record(SYMBOL, PriceSample.builder()
                    .symbol(SYMBOL)
                    .price(100 + i)
                    .volume(5000)
                    .timestamp(Instant.now())
                    .build());
        }
    }

    private static OrderBookSnapshot book() {
        return OrderBookSnapshot.builder().symbol(SYMBOL).timestamp(Instant.now()).build();
    }

    private static TradingSignal buySignal(double quantity) {
        return TradingSignal.builder()
                .symbol(SYMBOL)
                .side(OrderSide.BUY)
                .confidence(0.5)
                .targetPrice(105)
                .quantity(quantity)
                .build();
    }

    private void registerStrategy(String name) {
        when(strategy.getName()).thenReturn(name);
        registry.register(strategy);
    }

    @Test
    @DisplayName("Symbols below the sample minimum are not evaluated")
    void belowMinimum_skipped() {
        recordSamples(2);

        assertThat(decisionLoop.runOnce()).isZero();
        verify(marketDataSource, never()).getOrderBook(anyString());
    }

    @Test
    @DisplayName("Missing order book skips the symbol")
    void noOrderBook_skipped() {
        recordSamples(3);
        registry.register(strategy);
        when(marketDataSource.getOrderBook(SYMBOL)).thenReturn(Optional.empty());

        assertThat(decisionLoop.runOnce()).isZero();
        verify(strategy, never()).analyze(anyList(), any());
    }

    @Test
    @DisplayName("Approved signal becomes a submitted MARKET order and a position")
    void signal_submittedAndBooked() {
        recordSamples(3);
        registerStrategy("Momo");
        when(marketDataSource.getOrderBook(SYMBOL)).thenReturn(Optional.of(book()));
        when(strategy.analyze(anyList(), any())).thenReturn(Optional.of(buySignal(10)));
        when(orderCoordinator.submit(any(Order.class)))
                .thenAnswer(invocation -> OrderSubmissionResult.submitted(invocation.<Order>getArgument(0).getId()));

        assertThat(decisionLoop.runOnce()).isEqualTo(1);

        ArgumentCaptor<Order> captor = ArgumentCaptor.forClass(Order.class);
        verify(orderCoordinator).submit(captor.capture());
        Order order = captor.getValue();
        assertThat(order.getId()).isNotBlank();
        assertThat(order.getType()).isEqualTo(OrderType.MARKET);
        assertThat(order.getSymbol()).isEqualTo(SYMBOL);
        assertThat(order.getQuantity()).isEqualTo(10.0);
        assertThat(order.getStrategyName()).isEqualTo("Momo");

        assertThat(riskManager.getPosition(SYMBOL).orElseThrow().getQuantity()).isEqualTo(10.0);
        assertThat(riskManager.getPosition(SYMBOL).orElseThrow().getAveragePrice()).isEqualTo(105.0);
        verify(eventPublisherHelper).publishSignal(any(), any(TradingSignal.class), eq("Momo"));
    }

    @Test
    @DisplayName("Risk rejection never reaches the coordinator")
    void riskRejected_notSubmitted() {
        recordSamples(3);
        registerStrategy("Momo");
        when(marketDataSource.getOrderBook(SYMBOL)).thenReturn(Optional.of(book()));
        when(strategy.analyze(anyList(), any())).thenReturn(Optional.of(buySignal(500)));

        assertThat(decisionLoop.runOnce()).isZero();

        verify(orderCoordinator, never()).submit(any(Order.class));
        verify(eventPublisherHelper).publishOrderRiskRejected(any(), any(Order.class), anyString());
        assertThat(riskManager.getPosition(SYMBOL)).isEmpty();
    }

    @Test
    @DisplayName("Gateway failure leaves positions untouched")
    void gatewayFailure_noPosition() {
        recordSamples(3);
        registerStrategy("Momo");
        when(marketDataSource.getOrderBook(SYMBOL)).thenReturn(Optional.of(book()));
        when(strategy.analyze(anyList(), any())).thenReturn(Optional.of(buySignal(10)));
        when(orderCoordinator.submit(any(Order.class))).thenReturn(OrderSubmissionResult.gatewayFailed("down"));

        assertThat(decisionLoop.runOnce()).isZero();
        assertThat(riskManager.getPosition(SYMBOL)).isEmpty();
    }

    @Test
    @DisplayName("A failing strategy does not stop the others")
    void failingStrategy_isolated() {
        recordSamples(3);
        TradingStrategy broken = mock(TradingStrategy.class);
        when(broken.getName()).thenReturn("Broken");
        when(broken.analyze(anyList(), any())).thenThrow(new IllegalStateException("boom"));
        registry.register(broken);
        registerStrategy("Momo");
        when(marketDataSource.getOrderBook(SYMBOL)).thenReturn(Optional.of(book()));
        when(strategy.analyze(anyList(), any())).thenReturn(Optional.of(buySignal(10)));
        when(orderCoordinator.submit(any(Order.class))).thenReturn(OrderSubmissionResult.submitted("x"));

        assertThat(decisionLoop.runOnce()).isEqualTo(1);
    }

    @Test
    @DisplayName("Nothing external is called once the flag is cleared")
    void stopped_noExternalCalls() {
        recordSamples(3);
        running.set(false);

        assertThat(decisionLoop.runOnce()).isZero();
        verify(marketDataSource, never()).getOrderBook(anyString());
    }
}
