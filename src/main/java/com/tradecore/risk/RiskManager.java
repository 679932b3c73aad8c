package com.tradecore.risk;

import com.tradecore.domain.enums.OrderSide;
import com.tradecore.domain.enums.OrderType;
import com.tradecore.domain.model.Order;
import com.tradecore.domain.model.Position;
import com.tradecore.event.RiskEvent;
import com.tradecore.event.RiskEventType;
import com.tradecore.event.RiskLevel;
import com.tradecore.oms.OrderSubmissionResult;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Owns the position ledger and the daily P&L accumulator, and gates every order
 * against the configured {@link RiskParams}.
 *
 * <p>Pre-trade checks, in order, stopping at the first failure:
 * <ol>
 *   <li>Daily loss: reject while daily P&L &lt; -maxDailyLoss</li>
 *   <li>Input sanity: symbol, side, quantity, limit price and reference price must be
 *       usable. Malformed input is reported as a violation, never thrown.</li>
 *   <li>Position size: |current signed qty + signed order qty| must not exceed
 *       maxPositionSize. Only applies once the symbol has a position (flat included).</li>
 *   <li>Loss exposure: quantity * referencePrice * stopLossPct must not exceed
 *       maxLossPerTrade</li>
 * </ol>
 *
 * <p><b>Thread safety:</b> one {@link ReentrantLock} covers validation, position updates
 * and P&L changes, so every check reads the latest committed state.
 * {@link #executeWithinLimits} holds the lock across validate, submit and commit: two
 * signals for the same symbol can never both pass validation against the same
 * pre-update position. The submitter is expected to be time-bounded (the
 * OrderCoordinator enforces a gateway timeout).
 */
@Service
public class RiskManager {

    private static final Logger log = LoggerFactory.getLogger(RiskManager.class);

    private final RiskParams riskParams;
    private final ApplicationEventPublisher applicationEventPublisher;

    private final ReentrantLock lock = new ReentrantLock();

    /** Guarded by {@link #lock}. */
    private final Map<String, Position> positions = new HashMap<>();

    /** Realized-plus-marked P&L for the current trading day. Guarded by {@link #lock}. */
    private double dailyPnl;

    public RiskManager(RiskParams riskParams, ApplicationEventPublisher applicationEventPublisher) {
        this.riskParams = riskParams;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ========================
    // PRE-TRADE VALIDATION
    // ========================

    /**
     * Validates an order against the committed ledger and daily P&L.
     *
     * @param order          the candidate order
     * @param referencePrice price used for the loss-exposure check
     * @return approved, or rejected with the first violation
     */
    public RiskValidationResult validateOrder(Order order, double referencePrice) {
        RiskValidationResult result;
        lock.lock();
        try {
            result = evaluate(order, referencePrice);
        } finally {
            lock.unlock();
        }

        if (result.isRejected()) {
            reportRejection(order, result.getViolation());
        }
        return result;
    }

    /**
     * Validates, submits and commits an order as one critical section.
     *
     * <p>The submitter runs only for approved orders. The position is updated exactly
     * once, and only when the submitter reports a confirmed submission; a gateway
     * failure leaves the ledger untouched.
     *
     * @param order          the candidate order
     * @param referencePrice price used for validation and for the position update
     * @param submitter      submits the order, typically {@code orderCoordinator::submit}
     * @return the submitter's result, or a RISK_REJECTED result
     */
    public OrderSubmissionResult executeWithinLimits(
            Order order, double referencePrice, Function<Order, OrderSubmissionResult> submitter) {
        RiskValidationResult validation;
        OrderSubmissionResult result = null;
        double pnlBefore = 0.0;
        double pnlAfter = 0.0;
        lock.lock();
        try {
            validation = evaluate(order, referencePrice);
            if (validation.isApproved()) {
                result = submitter.apply(order);
                if (result.isAccepted()) {
                    pnlBefore = dailyPnl;
                    applyDelta(order.getSymbol(), order.signedQuantity(), referencePrice);
                    pnlAfter = dailyPnl;
                }
            }
        } finally {
            lock.unlock();
        }

        if (result != null) {
            checkDailyLossCrossing(pnlBefore, pnlAfter);
            return result;
        }

        reportRejection(order, validation.getViolation());
        return OrderSubmissionResult.riskRejected(validation.getViolation().toString());
    }

    // ========================
    // POSITION LEDGER
    // ========================

    /**
     * Applies a signed quantity change to a symbol's position.
     *
     * <p>Average price follows {@code (oldQty*oldAvg + delta*price) / (oldQty + delta)}.
     * When the position goes flat the average resets to zero; when it crosses through
     * zero the average resets first, so the residual quantity carries the new price.
     *
     * <p>The closed part of a reduced, flattened or reversed position is realized at
     * {@code price} against the previous average and added to the daily P&L.
     *
     * <p>Not idempotent: call it exactly once per accepted, submitted order.
     *
     * @return a copy of the updated position
     * @throws IllegalArgumentException if symbol is blank or delta/price are not finite
     */
    public Position updatePosition(String symbol, double signedDelta, double price) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Position symbol must not be blank");
        }
        if (!Double.isFinite(signedDelta) || !Double.isFinite(price)) {
            throw new IllegalArgumentException(
                    "Position delta and price must be finite: delta=" + signedDelta + ", price=" + price);
        }

        Position updated;
        double pnlBefore;
        double pnlAfter;
        lock.lock();
        try {
            pnlBefore = dailyPnl;
            updated = applyDelta(symbol, signedDelta, price);
            pnlAfter = dailyPnl;
        } finally {
            lock.unlock();
        }
        checkDailyLossCrossing(pnlBefore, pnlAfter);
        return updated;
    }

    /** Returns a copy of the symbol's position, or empty if it never traded. */
    public Optional<Position> getPosition(String symbol) {
        lock.lock();
        try {
            return Optional.ofNullable(positions.get(symbol)).map(p -> p.toBuilder().build());
        } finally {
            lock.unlock();
        }
    }

    /** Copies of all positions keyed by symbol, including flat ones. */
    public Map<String, Position> getPositions() {
        lock.lock();
        try {
            Map<String, Position> copy = new LinkedHashMap<>();
            positions.forEach((symbol, position) -> copy.put(symbol, position.toBuilder().build()));
            return copy;
        } finally {
            lock.unlock();
        }
    }

    /** Unrealized P&L of a symbol's position at the given price; zero without a position. */
    public double getUnrealizedPnl(String symbol, double currentPrice) {
        return getPosition(symbol).map(p -> p.unrealizedPnl(currentPrice)).orElse(0.0);
    }

    // ========================
    // DAILY P&L
    // ========================

    /**
     * Adds P&L reported outside the position ledger (fees, venue fill adjustments) to
     * the daily total. Closing trades booked through the ledger are accrued already.
     *
     * @param amount the P&L to add (negative for losses)
     */
    public void recordRealizedPnl(double amount) {
        double before;
        double after;
        lock.lock();
        try {
            before = dailyPnl;
            dailyPnl += amount;
            after = dailyPnl;
        } finally {
            lock.unlock();
        }
        log.debug("Recorded P&L: {}, daily total: {}", amount, after);
        checkDailyLossCrossing(before, after);
    }

    /** Resets the daily P&L accumulator. Invoked by the daily rollover trigger. */
    public void resetDailyPnl() {
        double previous;
        lock.lock();
        try {
            previous = dailyPnl;
            dailyPnl = 0.0;
        } finally {
            lock.unlock();
        }
        log.info("Daily P&L reset (previous value {})", previous);
        publishRiskEvent(
                RiskEventType.DAILY_RESET, RiskLevel.INFO, "Daily P&L reset", Map.of("previousDailyPnl", previous));
    }

    public double getDailyPnl() {
        lock.lock();
        try {
            return dailyPnl;
        } finally {
            lock.unlock();
        }
    }

    // ========================
    // QUERIES
    // ========================

    /**
     * Stop-loss and take-profit prices for a fresh entry at {@code entryPrice}.
     * For BUY the stop sits below the entry; for SELL above it.
     */
    public ProtectiveLevels protectiveLevels(OrderSide side, double entryPrice) {
        double stopDistance = entryPrice * riskParams.getStopLossPct();
        double profitDistance = entryPrice * riskParams.getTakeProfitPct();
        if (side == OrderSide.BUY) {
            return new ProtectiveLevels(entryPrice - stopDistance, entryPrice + profitDistance);
        }
        return new ProtectiveLevels(entryPrice + stopDistance, entryPrice - profitDistance);
    }

    // ========================
    // INTERNALS
    // ========================

    /** Runs the ordered checks. Caller holds the lock. */
    private RiskValidationResult evaluate(Order order, double referencePrice) {
        if (dailyPnl < -riskParams.getMaxDailyLoss()) {
            return RiskValidationResult.rejected(RiskViolation.of(
                    "DAILY_LOSS_LIMIT_BREACHED",
                    "Daily loss limit exceeded: dailyPnl=" + dailyPnl + ", limit=" + riskParams.getMaxDailyLoss()));
        }

        RiskViolation inputViolation = checkInput(order, referencePrice);
        if (inputViolation != null) {
            return RiskValidationResult.rejected(inputViolation);
        }

        // Size is only checked against an existing position; a first order is bounded by loss exposure
        Position position = positions.get(order.getSymbol());
        if (position != null) {
            double resultingQuantity = position.getQuantity() + order.signedQuantity();
            if (Math.abs(resultingQuantity) > riskParams.getMaxPositionSize()) {
                return RiskValidationResult.rejected(RiskViolation.of(
                        "POSITION_SIZE_EXCEEDED",
                        "Position for " + order.getSymbol() + " would be " + resultingQuantity + ", limit "
                                + riskParams.getMaxPositionSize()));
            }
        }

        double potentialLoss = order.getQuantity() * referencePrice * riskParams.getStopLossPct();
        if (potentialLoss > riskParams.getMaxLossPerTrade()) {
            return RiskValidationResult.rejected(RiskViolation.of(
                    "LOSS_EXPOSURE_EXCEEDED",
                    "Potential loss " + potentialLoss + " exceeds per-trade limit " + riskParams.getMaxLossPerTrade()));
        }

        return RiskValidationResult.approved();
    }

    private RiskViolation checkInput(Order order, double referencePrice) {
        if (order == null) {
            return RiskViolation.of("INVALID_ORDER", "Order is missing");
        }
        if (order.getSymbol() == null || order.getSymbol().isBlank()) {
            return RiskViolation.of("INVALID_ORDER", "Order has no symbol");
        }
        if (order.getSide() == null) {
            return RiskViolation.of("INVALID_ORDER", "Order has no side");
        }
        if (!Double.isFinite(order.getQuantity()) || order.getQuantity() <= 0) {
            return RiskViolation.of("INVALID_QUANTITY", "Order quantity must be positive: " + order.getQuantity());
        }
        if (order.getType() == OrderType.LIMIT && (order.getLimitPrice() == null || order.getLimitPrice() <= 0)) {
            return RiskViolation.of("INVALID_ORDER", "LIMIT order requires a positive limit price");
        }
        if (!Double.isFinite(referencePrice) || referencePrice <= 0) {
            return RiskViolation.of("INVALID_PRICE", "Reference price must be positive: " + referencePrice);
        }
        return null;
    }

    /** Caller holds the lock. */
    private Position applyDelta(String symbol, double signedDelta, double price) {
        Position position = positions.computeIfAbsent(
                symbol, s -> Position.builder().symbol(s).build());

        double previousQuantity = position.getQuantity();
        double newQuantity = previousQuantity + signedDelta;

        if (previousQuantity != 0 && Math.signum(signedDelta) == -Math.signum(previousQuantity)) {
            double closedQuantity = Math.min(Math.abs(previousQuantity), Math.abs(signedDelta));
            double closingPnl =
                    (price - position.getAveragePrice()) * closedQuantity * Math.signum(previousQuantity);
            dailyPnl += closingPnl;
            log.debug(
                    "Realized P&L on {}: {} for {} closed, daily total {}",
                    symbol,
                    closingPnl,
                    closedQuantity,
                    dailyPnl);
        }

        if (newQuantity == 0) {
            position.setAveragePrice(0.0);
        } else if (previousQuantity != 0 && Math.signum(newQuantity) != Math.signum(previousQuantity)) {
            // Crossed through zero: only the residual remains, opened at this price
            position.setAveragePrice(price);
        } else {
            double totalCost = previousQuantity * position.getAveragePrice() + signedDelta * price;
            position.setAveragePrice(totalCost / newQuantity);
        }
        position.setQuantity(newQuantity);
        position.setLastUpdated(Instant.now());

        log.debug(
                "Position updated: symbol={}, qty {} -> {}, avgPrice={}",
                symbol,
                previousQuantity,
                newQuantity,
                position.getAveragePrice());
        return position.toBuilder().build();
    }

    /** Publishes the breach event when the daily P&L drops through the limit. Called outside the lock. */
    private void checkDailyLossCrossing(double before, double after) {
        double floor = -riskParams.getMaxDailyLoss();
        if (before >= floor && after < floor) {
            log.error("Daily loss limit breached: dailyPnl={}, limit={}", after, riskParams.getMaxDailyLoss());
            publishRiskEvent(
                    RiskEventType.DAILY_LOSS_LIMIT_BREACH,
                    RiskLevel.CRITICAL,
                    "Daily loss limit breached: " + after,
                    Map.of("dailyPnl", after, "maxDailyLoss", riskParams.getMaxDailyLoss()));
        }
    }

    private void reportRejection(Order order, RiskViolation violation) {
        log.warn(
                "Order rejected by risk check: {} [orderId={}, symbol={}]",
                violation,
                order != null ? order.getId() : null,
                order != null ? order.getSymbol() : null);

        Map<String, Object> details = new HashMap<>();
        details.put("code", violation.getCode());
        if (order != null && order.getId() != null) {
            details.put("orderId", order.getId());
        }
        if (order != null && order.getSymbol() != null) {
            details.put("symbol", order.getSymbol());
        }
        publishRiskEvent(eventTypeFor(violation.getCode()), RiskLevel.WARNING, "Order rejected: " + violation, details);
    }

    private RiskEventType eventTypeFor(String code) {
        switch (code) {
            case "DAILY_LOSS_LIMIT_BREACHED":
                return RiskEventType.DAILY_LOSS_LIMIT_BREACH;
            case "POSITION_SIZE_EXCEEDED":
                return RiskEventType.POSITION_LIMIT_BREACH;
            case "LOSS_EXPOSURE_EXCEEDED":
                return RiskEventType.TRADE_LOSS_LIMIT_BREACH;
            default:
                return RiskEventType.INVALID_ORDER;
        }
    }

    private void publishRiskEvent(
            RiskEventType eventType, RiskLevel level, String message, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new RiskEvent(this, eventType, level, message, details));
    }
}
