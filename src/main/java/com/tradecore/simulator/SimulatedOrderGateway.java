package com.tradecore.simulator;

import com.tradecore.domain.model.Order;
import com.tradecore.exception.GatewayException;
import com.tradecore.oms.OrderGateway;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Paper trading implementation of {@link OrderGateway}.
 *
 * <p>Every call waits for the configured latency, then accepts the order and returns a
 * generated id of the form {@code SIM-<n>}. Orders with a non-positive quantity are
 * rejected. Cancelling an id that was never accepted, or was already cancelled, fails.
 */
@Service
@ConditionalOnProperty(name = "tradecore.trading-mode", havingValue = "PAPER", matchIfMissing = true)
public class SimulatedOrderGateway implements OrderGateway {

    private static final Logger log = LoggerFactory.getLogger(SimulatedOrderGateway.class);

    private final long latencyMs;
    private final AtomicLong sequence = new AtomicLong();
    private final Set<String> openOrderIds = ConcurrentHashMap.newKeySet();
    private final Set<String> cancelledOrderIds = ConcurrentHashMap.newKeySet();

    public SimulatedOrderGateway(@Value("${tradecore.simulator.latency-ms:10}") long latencyMs) {
        this.latencyMs = latencyMs;
    }

    @Override
    public String submitOrder(Order order) {
        simulateLatency();
        if (!(order.getQuantity() > 0)) {
            throw new GatewayException("Rejected: quantity must be positive, got " + order.getQuantity());
        }

        String gatewayOrderId = "SIM-" + sequence.incrementAndGet();
        openOrderIds.add(gatewayOrderId);
        log.debug(
                "Simulator submitOrder: {} {} {} qty={} -> {}",
                order.getSide(),
                order.getType(),
                order.getSymbol(),
                order.getQuantity(),
                gatewayOrderId);
        return gatewayOrderId;
    }

    @Override
    public void cancelOrder(String gatewayOrderId) {
        simulateLatency();
        if (!openOrderIds.remove(gatewayOrderId)) {
            throw new GatewayException("Unknown or closed order: " + gatewayOrderId);
        }
        cancelledOrderIds.add(gatewayOrderId);
        log.debug("Simulator cancelOrder: {}", gatewayOrderId);
    }

    public Set<String> getOpenOrderIds() {
        return Set.copyOf(openOrderIds);
    }

    public Set<String> getCancelledOrderIds() {
        return Set.copyOf(cancelledOrderIds);
    }

    private void simulateLatency() {
        if (latencyMs <= 0) {
            return;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(latencyMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException("Interrupted while simulating gateway latency", e);
        }
    }
}
