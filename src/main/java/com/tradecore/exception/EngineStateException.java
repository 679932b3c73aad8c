package com.tradecore.exception;

import java.util.Map;

/** Thrown when a lifecycle operation is invalid for the orchestrator's current state. */
public class EngineStateException extends BaseException {

    public EngineStateException(String message) {
        super(ErrorCode.ILLEGAL_STATE, message);
    }

    public EngineStateException(String message, Map<String, Object> details) {
        super(ErrorCode.ILLEGAL_STATE, message, details);
    }
}
