package com.tradecore.domain.model;

import com.tradecore.domain.enums.PositionType;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Net holding in a symbol with a volume-weighted average cost basis.
 *
 * <p>Quantity is signed: positive = LONG, negative = SHORT. The average price is only
 * meaningful while the quantity is non-zero; the RiskManager resets it to zero when the
 * position goes flat. Unrealized P&L is not stored, it is derived from a current price.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String symbol;

    /** Signed quantity: positive = long, negative = short. */
    private double quantity;

    private double averagePrice;

    private Instant lastUpdated;

    public PositionType getType() {
        if (quantity > 0) {
            return PositionType.LONG;
        }
        return quantity < 0 ? PositionType.SHORT : PositionType.FLAT;
    }

    public boolean isFlat() {
        return quantity == 0;
    }

    /** Mark-to-market P&L at the given price: (current - average) * signed quantity. */
    public double unrealizedPnl(double currentPrice) {
        if (isFlat()) {
            return 0.0;
        }
        return (currentPrice - averagePrice) * quantity;
    }
}
