package com.tradecore.domain.model;

import com.tradecore.domain.enums.OrderSide;
import com.tradecore.domain.enums.OrderStatus;
import com.tradecore.domain.enums.OrderType;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * A trading order created by the decision loop and tracked by the OrderCoordinator.
 *
 * <p>Lifecycle: CREATED -> SUBMITTED -> (FILLED | CANCELLED | REJECTED). The local
 * {@code id} identifies the order inside the engine; {@code gatewayOrderId} is whatever
 * the external gateway returned on acceptance and is used for cancellation.
 */
@Data
@Builder(toBuilder = true)
public class Order {

    private String id;

    /** Gateway-assigned order ID. Null until the gateway accepts the order. */
    private String gatewayOrderId;

    private String symbol;
    private OrderSide side;
    private OrderType type;

    /** Unsigned order quantity. Must be positive. */
    private double quantity;

    /** Limit price. Required for LIMIT orders, null for MARKET orders. */
    private Double limitPrice;

    @Builder.Default
    private OrderStatus status = OrderStatus.CREATED;

    /** Name of the strategy whose signal produced this order. Null for manual orders. */
    private String strategyName;

    private String rejectionReason;

    private Instant createdAt;
    private Instant submittedAt;
    private Instant updatedAt;

    /** Quantity signed by side: BUY positive, SELL negative. */
    public double signedQuantity() {
        return side.signed(quantity);
    }
}
