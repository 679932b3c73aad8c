package com.tradecore.risk;

import java.util.Optional;
import lombok.Getter;

/**
 * Outcome of pre-trade validation: approved, or rejected with the first violation found.
 *
 * <p>Checks short-circuit, so a rejected result carries exactly one violation.
 */
@Getter
public class RiskValidationResult {

    private static final RiskValidationResult APPROVED = new RiskValidationResult(true, null);

    private final boolean approved;
    private final RiskViolation violation;

    private RiskValidationResult(boolean approved, RiskViolation violation) {
        this.approved = approved;
        this.violation = violation;
    }

    public static RiskValidationResult approved() {
        return APPROVED;
    }

    public static RiskValidationResult rejected(RiskViolation violation) {
        return new RiskValidationResult(false, violation);
    }

    public boolean isRejected() {
        return !approved;
    }

    /** Violation code, empty when approved. */
    public Optional<String> getReasonCode() {
        return Optional.ofNullable(violation).map(RiskViolation::getCode);
    }

    @Override
    public String toString() {
        return approved ? "APPROVED" : "REJECTED(" + violation + ")";
    }
}
