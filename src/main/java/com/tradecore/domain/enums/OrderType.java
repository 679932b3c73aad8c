package com.tradecore.domain.enums;

/**
 * Order execution type.
 * LIMIT orders require a limit price; MARKET orders must not carry one.
 */
public enum OrderType {
    MARKET,
    LIMIT
}
