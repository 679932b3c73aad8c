package com.tradecore.risk;

import lombok.Builder;
import lombok.Data;

/**
 * Risk limits consumed by the {@link RiskManager}.
 *
 * <p>All values are positive. Percentages are fractions: 0.02 means 2%.
 * Loaded from application.properties ({@code tradecore.risk.*}) by
 * {@link com.tradecore.config.RiskConfig}; the builder defaults match the shipped
 * configuration.
 */
@Data
@Builder
public class RiskParams {

    /** Maximum absolute signed quantity allowed per symbol after an order. */
    @Builder.Default
    private double maxPositionSize = 1000.0;

    /** Maximum potential loss of a single order: quantity * price * stopLossPct. */
    @Builder.Default
    private double maxLossPerTrade = 100.0;

    /** New orders are refused once the daily P&L falls below -maxDailyLoss. */
    @Builder.Default
    private double maxDailyLoss = 500.0;

    /** Stop-loss distance as a fraction of the entry price. */
    @Builder.Default
    private double stopLossPct = 0.02;

    /** Take-profit distance as a fraction of the entry price. */
    @Builder.Default
    private double takeProfitPct = 0.04;

    public static RiskParams defaults() {
        return RiskParams.builder().build();
    }
}
