package com.tradecore.domain.enums;

/**
 * Lifecycle status of an order.
 *
 * <p>CREATED is the local pre-submission state. SUBMITTED means the gateway accepted
 * the order; it stays pending until FILLED, CANCELLED or REJECTED feedback arrives.
 * A gateway failure during submission moves the order straight from CREATED to REJECTED.
 */
public enum OrderStatus {
    CREATED,
    SUBMITTED,
    FILLED,
    CANCELLED,
    REJECTED
}
