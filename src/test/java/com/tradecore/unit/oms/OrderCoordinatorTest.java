package com.tradecore.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradecore.config.GatewayConfig;
import com.tradecore.domain.enums.OrderSide;
import com.tradecore.domain.enums.OrderStatus;
import com.tradecore.domain.enums.OrderType;
import com.tradecore.domain.model.Order;
import com.tradecore.event.EventPublisherHelper;
import com.tradecore.exception.GatewayException;
import com.tradecore.oms.CancelResult;
import com.tradecore.oms.OrderCoordinator;
import com.tradecore.oms.OrderGateway;
import com.tradecore.oms.OrderSubmissionResult;
import io.github.resilience4j.timelimiter.TimeLimiter;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class OrderCoordinatorTest {

    @Mock
    private OrderGateway orderGateway;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private ExecutorService gatewayExecutor;
    private OrderCoordinator orderCoordinator;

    @BeforeEach
    void setUp() {
        gatewayExecutor = Executors.newCachedThreadPool();
        orderCoordinator = new OrderCoordinator(
                orderGateway, TimeLimiter.of(Duration.ofMillis(200)), gatewayExecutor, eventPublisherHelper);
    }

    @AfterEach
    void tearDown() {
        gatewayExecutor.shutdownNow();
    }

    private static Order order(String id) {
        return Order.builder()
                .id(id)
                .symbol("BTC/USD")
                .side(OrderSide.BUY)
                .type(OrderType.MARKET)
                .quantity(10)
                .build();
    }

    @Nested
    @DisplayName("Submission")
    class Submission {

        @Test
        @DisplayName("Accepted order is pending as SUBMITTED with the gateway id")
        void accepted_pending() {
            when(orderGateway.submitOrder(any(Order.class))).thenReturn("GW-1");

            OrderSubmissionResult result = orderCoordinator.submit(order("o-1"));

            assertThat(result.isAccepted()).isTrue();
            assertThat(result.getOrderId()).isEqualTo("o-1");
            assertThat(orderCoordinator.getPendingCount()).isEqualTo(1);
            Order pending = orderCoordinator.getPendingOrder("o-1").orElseThrow();
            assertThat(pending.getStatus()).isEqualTo(OrderStatus.SUBMITTED);
            assertThat(pending.getGatewayOrderId()).isEqualTo("GW-1");
            assertThat(pending.getSubmittedAt()).isNotNull();
            verify(eventPublisherHelper).publishOrderSubmitted(eq(orderCoordinator), any(Order.class));
        }

        @Test
        @DisplayName("Gateway error removes the order and reports GATEWAY_FAILED")
        void gatewayError_failed() {
            when(orderGateway.submitOrder(any(Order.class))).thenThrow(new GatewayException("venue closed"));
            Order order = order("o-1");

            OrderSubmissionResult result = orderCoordinator.submit(order);

            assertThat(result.getOutcome()).isEqualTo(OrderSubmissionResult.Outcome.GATEWAY_FAILED);
            assertThat(result.getRejectionReason()).contains("venue closed");
            assertThat(orderCoordinator.getPendingCount()).isZero();
            assertThat(order.getStatus()).isEqualTo(OrderStatus.REJECTED);
            verify(eventPublisherHelper).publishOrderFailed(eq(orderCoordinator), eq(order), anyString());
        }

        @Test
        @DisplayName("Slow gateway times out instead of blocking")
        void slowGateway_timesOut() {
            when(orderGateway.submitOrder(any(Order.class))).thenAnswer(invocation -> {
                Thread.sleep(2000);
                return "GW-late";
            });

            long startedAt = System.currentTimeMillis();
            OrderSubmissionResult result = orderCoordinator.submit(order("o-1"));
            long elapsed = System.currentTimeMillis() - startedAt;

            assertThat(result.getOutcome()).isEqualTo(OrderSubmissionResult.Outcome.GATEWAY_FAILED);
            assertThat(result.getRejectionReason()).contains("timed out");
            assertThat(elapsed).isLessThan(1500);
            assertThat(orderCoordinator.getPendingCount()).isZero();
        }

        @Test
        @DisplayName("Duplicate id is refused without a second gateway call")
        void duplicateId_refused() {
            when(orderGateway.submitOrder(any(Order.class))).thenReturn("GW-1");
            orderCoordinator.submit(order("o-1"));

            OrderSubmissionResult second = orderCoordinator.submit(order("o-1"));

            assertThat(second.isAccepted()).isFalse();
            assertThat(second.getRejectionReason()).contains("Duplicate");
            assertThat(orderCoordinator.getPendingCount()).isEqualTo(1);
            verify(orderGateway, times(1)).submitOrder(any(Order.class));
        }

        @Test
        @DisplayName("Order without an id is a programming error")
        void missingId_throws() {
            assertThatThrownBy(() -> orderCoordinator.submit(order(null)))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("Unknown id is NOT_FOUND without a gateway call")
        void unknown_notFound() {
            assertThat(orderCoordinator.cancel("missing")).isEqualTo(CancelResult.NOT_FOUND);
            verify(orderGateway, never()).cancelOrder(anyString());
        }

        @Test
        @DisplayName("Second cancel of the same id is a no-op")
        void cancelTwice_secondIsNoop() {
            when(orderGateway.submitOrder(any(Order.class))).thenReturn("GW-1");
            orderCoordinator.submit(order("o-1"));

            assertThat(orderCoordinator.cancel("o-1")).isEqualTo(CancelResult.REMOVED);
            assertThat(orderCoordinator.cancel("o-1")).isEqualTo(CancelResult.NOT_FOUND);

            assertThat(orderCoordinator.getPendingCount()).isZero();
            verify(orderGateway, times(1)).cancelOrder("GW-1");
            verify(eventPublisherHelper).publishOrderCancelled(eq(orderCoordinator), any(Order.class));
        }

        @Test
        @DisplayName("Failed gateway cancel keeps the order pending")
        void gatewayFailure_keepsPending() {
            when(orderGateway.submitOrder(any(Order.class))).thenReturn("GW-1");
            doThrow(new GatewayException("cancel rejected")).when(orderGateway).cancelOrder("GW-1");
            orderCoordinator.submit(order("o-1"));

            assertThat(orderCoordinator.cancel("o-1")).isEqualTo(CancelResult.FAILED);

            assertThat(orderCoordinator.getPendingOrder("o-1")).isPresent();
        }
    }

    @Nested
    @DisplayName("Execution feedback")
    class Feedback {

        @Test
        @DisplayName("Fill removes the order and publishes FILLED")
        void fill_removes() {
            when(orderGateway.submitOrder(any(Order.class))).thenReturn("GW-1");
            orderCoordinator.submit(order("o-1"));

            assertThat(orderCoordinator.onOrderFilled("o-1")).isTrue();

            assertThat(orderCoordinator.getPendingOrders()).isEmpty();
            verify(eventPublisherHelper).publishOrderFilled(eq(orderCoordinator), any(Order.class));
        }

        @Test
        @DisplayName("Venue rejection removes the order with its reason")
        void rejection_removes() {
            when(orderGateway.submitOrder(any(Order.class))).thenReturn("GW-1");
            orderCoordinator.submit(order("o-1"));

            assertThat(orderCoordinator.onOrderRejected("o-1", "insufficient margin")).isTrue();

            assertThat(orderCoordinator.getPendingCount()).isZero();
            verify(eventPublisherHelper)
                    .publishOrderRejected(eq(orderCoordinator), any(Order.class), eq("insufficient margin"));
        }

        @Test
        @DisplayName("Feedback for unknown ids is ignored")
        void unknownFeedback_ignored() {
            assertThat(orderCoordinator.onOrderFilled("missing")).isFalse();
            assertThat(orderCoordinator.onOrderRejected("missing", "x")).isFalse();
        }

        @Test
        @DisplayName("Pending orders are handed out as copies")
        void pendingOrders_areCopies() {
            when(orderGateway.submitOrder(any(Order.class))).thenReturn("GW-1");
            orderCoordinator.submit(order("o-1"));

            orderCoordinator.getPendingOrders().get(0).setStatus(OrderStatus.FILLED);

            assertThat(orderCoordinator.getPendingOrder("o-1").orElseThrow().getStatus())
                    .isEqualTo(OrderStatus.SUBMITTED);
        }
    }

    @Nested
    @DisplayName("Configured gateway executor")
    class ConfiguredGatewayExecutor {

        private ThreadPoolTaskExecutor executor;
        private OrderCoordinator coordinator;

        @BeforeEach
        void setUp() {
            GatewayConfig gatewayConfig = new GatewayConfig();
            ReflectionTestUtils.setField(gatewayConfig, "timeoutMs", 200L);
            ReflectionTestUtils.setField(gatewayConfig, "corePoolSize", 1);
            ReflectionTestUtils.setField(gatewayConfig, "maxPoolSize", 1);
            ReflectionTestUtils.setField(gatewayConfig, "queueCapacity", 1);
            executor = gatewayConfig.gatewayExecutor();
            executor.initialize();
            coordinator = new OrderCoordinator(
                    orderGateway, gatewayConfig.gatewayTimeLimiter(), executor, eventPublisherHelper);
        }

        @AfterEach
        void tearDown() {
            executor.getThreadPoolExecutor().shutdownNow();
        }

        @Test
        @DisplayName("Saturated executor fails the submission fast without calling the gateway")
        void saturated_failsFast() {
            CountDownLatch release = new CountDownLatch(1);
            Runnable blocker = () -> {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            };
            // One running, one queued
            executor.execute(blocker);
            executor.execute(blocker);

            long startedAt = System.currentTimeMillis();
            OrderSubmissionResult result = coordinator.submit(order("o-1"));
            long elapsed = System.currentTimeMillis() - startedAt;
            release.countDown();

            assertThat(result.getOutcome()).isEqualTo(OrderSubmissionResult.Outcome.GATEWAY_FAILED);
            assertThat(result.getRejectionReason()).contains("saturated");
            assertThat(elapsed).isLessThan(1000);
            assertThat(coordinator.getPendingCount()).isZero();
            verify(orderGateway, never()).submitOrder(any(Order.class));
        }

        @Test
        @DisplayName("Timed-out call is interrupted and later calls run on gateway threads")
        void timeout_interruptsWorker() throws Exception {
            CountDownLatch interrupted = new CountDownLatch(1);
            AtomicReference<String> callingThread = new AtomicReference<>();
            when(orderGateway.submitOrder(any(Order.class)))
                    .thenAnswer(invocation -> {
                        try {
                            new CountDownLatch(1).await();
                        } catch (InterruptedException e) {
                            interrupted.countDown();
                            throw new GatewayException("interrupted", e);
                        }
                        return "GW-never";
                    })
                    .thenAnswer(invocation -> {
                        callingThread.set(Thread.currentThread().getName());
                        return "GW-2";
                    });

            OrderSubmissionResult first = coordinator.submit(order("o-1"));

            assertThat(first.getRejectionReason()).contains("timed out");
            assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();

            OrderSubmissionResult second = coordinator.submit(order("o-2"));

            assertThat(second.isAccepted()).isTrue();
            assertThat(callingThread.get()).startsWith("gateway-");
            assertThat(coordinator.getPendingOrder("o-2").orElseThrow().getGatewayOrderId())
                    .isEqualTo("GW-2");
        }
    }
}
