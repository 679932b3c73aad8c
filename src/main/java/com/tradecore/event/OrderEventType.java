package com.tradecore.event;

/**
 * Classifies the order state change carried by an {@link OrderEvent}.
 *
 * <p>RISK_REJECTED and FAILED both mean the order never reached the venue's book:
 * the first was stopped by a pre-trade risk check, the second by the gateway.
 */
public enum OrderEventType {

    /** Gateway accepted the order; it is now pending. */
    SUBMITTED,

    /** Pre-trade risk validation rejected the order. It was never submitted. */
    RISK_REJECTED,

    /** Gateway submission failed or timed out. */
    FAILED,

    /** Pending order cancelled. */
    CANCELLED,

    /** Fill feedback received for a pending order. */
    FILLED,

    /** Venue rejected a previously submitted order. */
    REJECTED
}
