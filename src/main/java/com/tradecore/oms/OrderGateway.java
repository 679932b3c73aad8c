package com.tradecore.oms;

import com.tradecore.domain.model.Order;

/**
 * Abstraction for order routing to the venue. Every component that submits or cancels
 * orders goes through the {@link OrderCoordinator}, which is the only caller of this
 * interface.
 *
 * <p>Calls may be slow; the coordinator bounds each one with a timeout and treats a
 * timeout as a failure. Implementations signal rejection by throwing
 * {@link com.tradecore.exception.GatewayException}.
 *
 * <p>The paper-trading implementation is {@link com.tradecore.simulator.SimulatedOrderGateway}.
 */
public interface OrderGateway {

    /**
     * Submits an order to the venue.
     *
     * @param order the order to place (symbol, side, type, quantity and, for LIMIT, price)
     * @return the gateway-assigned order ID
     * @throws com.tradecore.exception.GatewayException if the venue rejects the order or is unavailable
     */
    String submitOrder(Order order);

    /**
     * Cancels an open order.
     *
     * @param gatewayOrderId the gateway-assigned order ID
     * @throws com.tradecore.exception.GatewayException if the cancel fails
     */
    void cancelOrder(String gatewayOrderId);
}
