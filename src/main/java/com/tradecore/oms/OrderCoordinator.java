package com.tradecore.oms;

import com.tradecore.domain.enums.OrderStatus;
import com.tradecore.domain.model.Order;
import com.tradecore.event.EventPublisherHelper;
import io.github.resilience4j.timelimiter.TimeLimiter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Single entry point between the engine and the {@link OrderGateway}. Owns the set of
 * pending orders.
 *
 * <p>Submission flow:
 * <ol>
 *   <li>Reject a duplicate order id without touching the existing entry</li>
 *   <li>Add the order to the pending set with status CREATED</li>
 *   <li>Call the gateway on the gateway executor, bounded by the {@link TimeLimiter}</li>
 *   <li>On success mark it SUBMITTED and keep it pending until fill/cancel feedback</li>
 *   <li>On failure, exception or timeout remove it and mark it REJECTED</li>
 * </ol>
 *
 * <p>A call that times out is cancelled with an interrupt. A call the saturated executor
 * refuses fails immediately; gateway calls never run on the submitting thread.
 *
 * <p>The pending-set lock is never held across a gateway call, so a slow venue cannot
 * block feedback or queries.
 */
@Service
public class OrderCoordinator {

    private static final Logger log = LoggerFactory.getLogger(OrderCoordinator.class);

    private final OrderGateway orderGateway;
    private final TimeLimiter timeLimiter;
    private final Executor gatewayExecutor;
    private final EventPublisherHelper eventPublisherHelper;

    private final ReentrantLock lock = new ReentrantLock();

    /** Guarded by {@link #lock}. Insertion ordered. */
    private final Map<String, Order> pendingOrders = new LinkedHashMap<>();

    public OrderCoordinator(
            OrderGateway orderGateway,
            TimeLimiter timeLimiter,
            @Qualifier("gatewayExecutor") Executor gatewayExecutor,
            EventPublisherHelper eventPublisherHelper) {
        this.orderGateway = orderGateway;
        this.timeLimiter = timeLimiter;
        this.gatewayExecutor = gatewayExecutor;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /**
     * Submits an order through the gateway.
     *
     * @param order order with a unique id
     * @return SUBMITTED with the engine order id, or GATEWAY_FAILED with the reason
     * @throws IllegalArgumentException if the order or its id is missing
     */
    public OrderSubmissionResult submit(Order order) {
        if (order == null || order.getId() == null) {
            throw new IllegalArgumentException("Order and order id are required");
        }
        String orderId = order.getId();

        lock.lock();
        try {
            if (pendingOrders.containsKey(orderId)) {
                log.warn("Duplicate order id {}, submission refused", orderId);
                return OrderSubmissionResult.gatewayFailed("Duplicate order id: " + orderId);
            }
            Instant now = Instant.now();
            order.setStatus(OrderStatus.CREATED);
            if (order.getCreatedAt() == null) {
                order.setCreatedAt(now);
            }
            order.setUpdatedAt(now);
            pendingOrders.put(orderId, order);
        } finally {
            lock.unlock();
        }

        String failureReason;
        try {
            String gatewayOrderId = callGateway(() -> orderGateway.submitOrder(order));
            markSubmitted(order, gatewayOrderId);
            log.info(
                    "Order submitted: id={}, gatewayId={}, {} {} {}",
                    orderId,
                    gatewayOrderId,
                    order.getSide(),
                    order.getQuantity(),
                    order.getSymbol());
            eventPublisherHelper.publishOrderSubmitted(this, order);
            return OrderSubmissionResult.submitted(orderId);
        } catch (TimeoutException e) {
            failureReason = "Gateway timed out after " + timeLimiter.getTimeLimiterConfig().getTimeoutDuration();
            log.error(
                    "Order {} abandoned after gateway timeout, it may still be live at the venue: "
                            + "symbol={}, side={}, qty={}",
                    orderId,
                    order.getSymbol(),
                    order.getSide(),
                    order.getQuantity());
        } catch (RejectedExecutionException e) {
            failureReason = "Gateway executor saturated, submission refused";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failureReason = "Interrupted while waiting for gateway";
        } catch (Exception e) {
            failureReason = "Gateway error: " + e.getMessage();
        }

        markFailed(order, failureReason);
        log.error("Order submission failed: id={}, symbol={}, reason={}", orderId, order.getSymbol(), failureReason);
        eventPublisherHelper.publishOrderFailed(this, order, failureReason);
        return OrderSubmissionResult.gatewayFailed(failureReason);
    }

    /**
     * Cancels a pending order at the gateway.
     *
     * <p>Unknown or already removed ids return NOT_FOUND without any mutation or gateway
     * call, so a repeated cancel is a no-op. A failed gateway cancel puts the order back.
     */
    public CancelResult cancel(String orderId) {
        Order order;
        lock.lock();
        try {
            order = pendingOrders.get(orderId);
            if (order == null) {
                log.debug("Cancel ignored, order {} is not pending", orderId);
                return CancelResult.NOT_FOUND;
            }
            if (order.getGatewayOrderId() == null) {
                log.warn("Cancel refused, order {} is still being submitted", orderId);
                return CancelResult.FAILED;
            }
            pendingOrders.remove(orderId);
        } finally {
            lock.unlock();
        }

        try {
            callGateway(() -> {
                orderGateway.cancelOrder(order.getGatewayOrderId());
                return null;
            });
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            restore(order);
            log.warn("Cancel of order {} interrupted, order kept pending", orderId);
            return CancelResult.FAILED;
        } catch (Exception e) {
            restore(order);
            log.warn("Cancel of order {} failed, order kept pending: {}", orderId, e.toString());
            return CancelResult.FAILED;
        }

        lock.lock();
        try {
            order.setStatus(OrderStatus.CANCELLED);
            order.setUpdatedAt(Instant.now());
        } finally {
            lock.unlock();
        }
        log.info("Order cancelled: id={}, gatewayId={}", orderId, order.getGatewayOrderId());
        eventPublisherHelper.publishOrderCancelled(this, order);
        return CancelResult.REMOVED;
    }

    // ---- Execution feedback ----

    /**
     * Consumes a fill confirmation for a pending order.
     *
     * @return true if the order was pending and is now FILLED
     */
    public boolean onOrderFilled(String orderId) {
        Order order = removeWithStatus(orderId, OrderStatus.FILLED, null);
        if (order == null) {
            log.debug("Fill for unknown order {} ignored", orderId);
            return false;
        }
        log.info("Order filled: id={}, symbol={}", orderId, order.getSymbol());
        eventPublisherHelper.publishOrderFilled(this, order);
        return true;
    }

    /**
     * Consumes a venue rejection for a pending order.
     *
     * @return true if the order was pending and is now REJECTED
     */
    public boolean onOrderRejected(String orderId, String reason) {
        Order order = removeWithStatus(orderId, OrderStatus.REJECTED, reason);
        if (order == null) {
            log.debug("Rejection for unknown order {} ignored", orderId);
            return false;
        }
        log.warn("Order rejected by venue: id={}, reason={}", orderId, reason);
        eventPublisherHelper.publishOrderRejected(this, order, reason);
        return true;
    }

    // ---- Queries ----

    /** Copy of a pending order. */
    public Optional<Order> getPendingOrder(String orderId) {
        lock.lock();
        try {
            return Optional.ofNullable(pendingOrders.get(orderId)).map(o -> o.toBuilder().build());
        } finally {
            lock.unlock();
        }
    }

    /** Copies of all pending orders in submission order. */
    public List<Order> getPendingOrders() {
        lock.lock();
        try {
            List<Order> copies = new ArrayList<>(pendingOrders.size());
            pendingOrders.values().forEach(o -> copies.add(o.toBuilder().build()));
            return copies;
        } finally {
            lock.unlock();
        }
    }

    public int getPendingCount() {
        lock.lock();
        try {
            return pendingOrders.size();
        } finally {
            lock.unlock();
        }
    }

    // ---- Internals ----

    /**
     * Runs a gateway call on the gateway executor, bounded by the time limiter. A
     * {@link FutureTask} is used so that cancelling a timed-out call interrupts its worker.
     *
     * @throws RejectedExecutionException if the executor is saturated
     */
    private <T> T callGateway(Supplier<T> call) throws Exception {
        return timeLimiter.executeFutureSupplier(() -> {
            FutureTask<T> task = new FutureTask<>(call::get);
            gatewayExecutor.execute(task);
            return task;
        });
    }

    private void markSubmitted(Order order, String gatewayOrderId) {
        lock.lock();
        try {
            Instant now = Instant.now();
            order.setGatewayOrderId(gatewayOrderId);
            order.setStatus(OrderStatus.SUBMITTED);
            order.setSubmittedAt(now);
            order.setUpdatedAt(now);
        } finally {
            lock.unlock();
        }
    }

    private void markFailed(Order order, String reason) {
        lock.lock();
        try {
            pendingOrders.remove(order.getId());
            order.setStatus(OrderStatus.REJECTED);
            order.setRejectionReason(reason);
            order.setUpdatedAt(Instant.now());
        } finally {
            lock.unlock();
        }
    }

    private void restore(Order order) {
        lock.lock();
        try {
            pendingOrders.putIfAbsent(order.getId(), order);
        } finally {
            lock.unlock();
        }
    }

    private Order removeWithStatus(String orderId, OrderStatus status, String reason) {
        lock.lock();
        try {
            Order order = pendingOrders.remove(orderId);
            if (order != null) {
                order.setStatus(status);
                order.setUpdatedAt(Instant.now());
                if (reason != null) {
                    order.setRejectionReason(reason);
                }
            }
            return order;
        } finally {
            lock.unlock();
        }
    }
}
