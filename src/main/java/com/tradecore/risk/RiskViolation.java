package com.tradecore.risk;

import lombok.Builder;
import lombok.Getter;

/**
 * A single failed pre-trade check.
 *
 * <p>The code is machine-readable (DAILY_LOSS_LIMIT_BREACHED, POSITION_SIZE_EXCEEDED,
 * LOSS_EXPOSURE_EXCEEDED, INVALID_ORDER, INVALID_QUANTITY, INVALID_PRICE); the message is
 * for logs.
 */
@Getter
@Builder
public class RiskViolation {

    private final String code;

    private final String message;

    public static RiskViolation of(String code, String message) {
        return RiskViolation.builder().code(code).message(message).build();
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
