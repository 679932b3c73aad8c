package com.tradecore.event;

/** Severity of a {@link RiskEvent}. */
public enum RiskLevel {
    INFO,
    WARNING,
    CRITICAL
}
