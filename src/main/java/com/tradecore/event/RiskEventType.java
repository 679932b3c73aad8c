package com.tradecore.event;

/** Types of risk conditions reported through {@link RiskEvent}. */
public enum RiskEventType {

    /** Daily P&L fell below the configured daily loss limit. */
    DAILY_LOSS_LIMIT_BREACH,

    /** Resulting position would exceed the configured maximum size. */
    POSITION_LIMIT_BREACH,

    /** Potential loss of a single trade exceeds the per-trade limit. */
    TRADE_LOSS_LIMIT_BREACH,

    /** Order could not be classified (bad quantity, price or symbol). */
    INVALID_ORDER,

    /** Daily P&L accumulator reset by the rollover trigger. */
    DAILY_RESET
}
