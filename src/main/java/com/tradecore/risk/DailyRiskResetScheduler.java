package com.tradecore.risk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Daily rollover: clears the RiskManager's daily P&L on a cron schedule. */
@Component
public class DailyRiskResetScheduler {

    private static final Logger log = LoggerFactory.getLogger(DailyRiskResetScheduler.class);

    private final RiskManager riskManager;

    public DailyRiskResetScheduler(RiskManager riskManager) {
        this.riskManager = riskManager;
    }

    @Scheduled(cron = "${tradecore.risk.daily-reset-cron:0 0 0 * * *}")
    public void resetDailyPnl() {
        log.info("Daily risk rollover triggered");
        riskManager.resetDailyPnl();
    }
}
