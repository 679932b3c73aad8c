package com.tradecore.oms;

/** Outcome of {@link OrderCoordinator#cancel(String)}. */
public enum CancelResult {

    /** Order was pending and the gateway confirmed the cancel. */
    REMOVED,

    /** No pending order with that id; nothing changed. */
    NOT_FOUND,

    /** Gateway cancel failed or timed out; the order is still pending. */
    FAILED
}
