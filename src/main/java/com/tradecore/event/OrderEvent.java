package com.tradecore.event;

import com.tradecore.domain.model.Order;
import org.springframework.context.ApplicationEvent;

/**
 * Published whenever an order changes state inside the engine.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>EngineMetricsService: submission / rejection / failure counters</li>
 * </ul>
 */
public class OrderEvent extends ApplicationEvent {

    private final Order order;
    private final OrderEventType eventType;
    private final String reason;

    public OrderEvent(Object source, Order order, OrderEventType eventType, String reason) {
        super(source);
        this.order = order;
        this.eventType = eventType;
        this.reason = reason;
    }

    public OrderEvent(Object source, Order order, OrderEventType eventType) {
        this(source, order, eventType, null);
    }

    public Order getOrder() {
        return order;
    }

    public OrderEventType getEventType() {
        return eventType;
    }

    /** Rejection or failure reason. Null for SUBMITTED, CANCELLED and FILLED events. */
    public String getReason() {
        return reason;
    }
}
