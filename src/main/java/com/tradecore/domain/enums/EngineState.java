package com.tradecore.domain.enums;

/** Lifecycle state of the trading orchestrator. STOPPED -> RUNNING -> STOPPED. */
public enum EngineState {
    STOPPED,
    RUNNING
}
