package com.tradecore.risk;

import lombok.Value;

/** Stop-loss and take-profit prices derived from an entry price and the risk percentages. */
@Value
public class ProtectiveLevels {

    double stopLossPrice;

    double takeProfitPrice;
}
