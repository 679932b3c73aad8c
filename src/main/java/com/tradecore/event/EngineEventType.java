package com.tradecore.event;

/** Orchestrator lifecycle notifications. */
public enum EngineEventType {
    STARTED,
    STOPPED,

    /** A polling loop ended abnormally while the engine was running. */
    LOOP_TERMINATED
}
