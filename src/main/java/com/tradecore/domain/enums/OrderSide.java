package com.tradecore.domain.enums;

/** Buy or sell side of an order or signal. */
public enum OrderSide {
    BUY,
    SELL;

    /** Applies the side's sign to an unsigned quantity: BUY keeps it positive, SELL negates it. */
    public double signed(double quantity) {
        return this == BUY ? quantity : -quantity;
    }
}
