package com.tradecore.event;

import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/** Published by the TradingOrchestrator on start, stop and abnormal loop termination. */
public class EngineEvent extends ApplicationEvent {

    private final EngineEventType eventType;
    private final String message;
    private final Map<String, Object> details;

    public EngineEvent(Object source, EngineEventType eventType, String message, Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public EngineEventType getEventType() {
        return eventType;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
