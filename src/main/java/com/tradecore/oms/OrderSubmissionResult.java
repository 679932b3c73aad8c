package com.tradecore.oms;

import lombok.Builder;
import lombok.Data;

/**
 * Result of pushing an order through risk validation and gateway submission.
 *
 * <p>If accepted, {@code orderId} is the engine's order id and the order is pending.
 * Otherwise {@code outcome} says which stage stopped it and {@code rejectionReason}
 * explains why.
 */
@Data
@Builder
public class OrderSubmissionResult {

    public enum Outcome {
        SUBMITTED,
        RISK_REJECTED,
        GATEWAY_FAILED
    }

    private Outcome outcome;

    /** Engine order id. Null unless SUBMITTED. */
    private String orderId;

    /** Human-readable reason for rejection. Null if accepted. */
    private String rejectionReason;

    public boolean isAccepted() {
        return outcome == Outcome.SUBMITTED;
    }

    public static OrderSubmissionResult submitted(String orderId) {
        return OrderSubmissionResult.builder()
                .outcome(Outcome.SUBMITTED)
                .orderId(orderId)
                .build();
    }

    public static OrderSubmissionResult riskRejected(String reason) {
        return OrderSubmissionResult.builder()
                .outcome(Outcome.RISK_REJECTED)
                .rejectionReason(reason)
                .build();
    }

    public static OrderSubmissionResult gatewayFailed(String reason) {
        return OrderSubmissionResult.builder()
                .outcome(Outcome.GATEWAY_FAILED)
                .rejectionReason(reason)
                .build();
    }
}
