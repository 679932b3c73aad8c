package com.tradecore.observability;

import com.tradecore.event.EngineEvent;
import com.tradecore.event.EngineEventType;
import com.tradecore.event.OrderEvent;
import com.tradecore.event.SignalEvent;
import com.tradecore.oms.OrderCoordinator;
import com.tradecore.risk.RiskManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the engine's Micrometer metrics.
 *
 * <ul>
 *   <li><b>signals.generated</b> (counter): every SignalEvent</li>
 *   <li><b>orders.submitted</b> (counter): SUBMITTED OrderEvents</li>
 *   <li><b>orders.risk_rejected</b> (counter): RISK_REJECTED OrderEvents</li>
 *   <li><b>orders.failed</b> (counter): FAILED and REJECTED OrderEvents</li>
 *   <li><b>loops.terminated</b> (counter): LOOP_TERMINATED EngineEvents</li>
 *   <li><b>risk.daily.pnl</b> (gauge): current daily P&L from the RiskManager</li>
 *   <li><b>orders.pending</b> (gauge): pending orders in the OrderCoordinator</li>
 * </ul>
 *
 * <p>Gauges are polled by Micrometer when read; counters are driven by application
 * events.
 */
@Service
public class EngineMetricsService {

    private final Counter signalsGeneratedCounter;
    private final Counter ordersSubmittedCounter;
    private final Counter ordersRiskRejectedCounter;
    private final Counter ordersFailedCounter;
    private final Counter loopsTerminatedCounter;

    public EngineMetricsService(
            MeterRegistry meterRegistry, RiskManager riskManager, OrderCoordinator orderCoordinator) {
        this.signalsGeneratedCounter = Counter.builder("signals.generated")
                .description("Signals produced by strategies")
                .register(meterRegistry);

        this.ordersSubmittedCounter = Counter.builder("orders.submitted")
                .description("Orders accepted by the gateway")
                .register(meterRegistry);

        this.ordersRiskRejectedCounter = Counter.builder("orders.risk_rejected")
                .description("Orders refused by pre-trade risk checks")
                .register(meterRegistry);

        this.ordersFailedCounter = Counter.builder("orders.failed")
                .description("Orders that failed at or were rejected by the gateway")
                .register(meterRegistry);

        this.loopsTerminatedCounter = Counter.builder("loops.terminated")
                .description("Engine loops that ended abnormally")
                .register(meterRegistry);

        meterRegistry.gauge("risk.daily.pnl", riskManager, RiskManager::getDailyPnl);
        meterRegistry.gauge("orders.pending", orderCoordinator, OrderCoordinator::getPendingCount);
    }

    @EventListener
    @Order(20)
    public void onSignalEvent(SignalEvent event) {
        signalsGeneratedCounter.increment();
    }

    @EventListener
    @Order(20)
    public void onOrderEvent(OrderEvent event) {
        switch (event.getEventType()) {
            case SUBMITTED:
                ordersSubmittedCounter.increment();
                break;
            case RISK_REJECTED:
                ordersRiskRejectedCounter.increment();
                break;
            case FAILED:
            case REJECTED:
                ordersFailedCounter.increment();
                break;
            default:
                break;
        }
    }

    @EventListener
    @Order(20)
    public void onEngineEvent(EngineEvent event) {
        if (event.getEventType() == EngineEventType.LOOP_TERMINATED) {
            loopsTerminatedCounter.increment();
        }
    }
}
