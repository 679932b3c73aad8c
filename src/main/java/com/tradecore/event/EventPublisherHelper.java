package com.tradecore.event;

import com.tradecore.domain.model.Order;
import com.tradecore.domain.model.TradingSignal;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Convenience wrapper around Spring's {@link ApplicationEventPublisher} with typed
 * factory methods for the engine's events.
 *
 * <p>All methods are non-blocking from the caller's point of view as long as listeners
 * stay cheap; listeners run synchronously on the publishing loop's thread.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Signal ----

    public void publishSignal(Object source, TradingSignal signal, String strategyName) {
        applicationEventPublisher.publishEvent(new SignalEvent(source, signal, strategyName));
    }

    // ---- Order ----

    public void publishOrderSubmitted(Object source, Order order) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.SUBMITTED));
    }

    public void publishOrderRiskRejected(Object source, Order order, String reason) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.RISK_REJECTED, reason));
    }

    public void publishOrderFailed(Object source, Order order, String reason) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.FAILED, reason));
    }

    public void publishOrderCancelled(Object source, Order order) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.CANCELLED));
    }

    public void publishOrderFilled(Object source, Order order) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.FILLED));
    }

    public void publishOrderRejected(Object source, Order order, String reason) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.REJECTED, reason));
    }

    // ---- Engine ----

    public void publishEngineEvent(Object source, EngineEventType eventType, String message) {
        publishEngineEvent(source, eventType, message, Map.of());
    }

    public void publishEngineEvent(
            Object source, EngineEventType eventType, String message, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new EngineEvent(source, eventType, message, details));
    }
}
