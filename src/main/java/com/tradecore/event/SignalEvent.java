package com.tradecore.event;

import com.tradecore.domain.model.TradingSignal;
import org.springframework.context.ApplicationEvent;

/** Published by the decision loop for every signal a strategy produces. */
public class SignalEvent extends ApplicationEvent {

    private final TradingSignal signal;
    private final String strategyName;

    public SignalEvent(Object source, TradingSignal signal, String strategyName) {
        super(source);
        this.signal = signal;
        this.strategyName = strategyName;
    }

    public TradingSignal getSignal() {
        return signal;
    }

    public String getStrategyName() {
        return strategyName;
    }
}
