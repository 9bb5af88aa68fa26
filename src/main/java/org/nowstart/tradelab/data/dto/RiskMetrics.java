package org.nowstart.tradelab.data.dto;

import org.nowstart.tradelab.data.type.RiskLevel;

public record RiskMetrics(
        double maxPositionRatio,
        double maxSingleStockRatio,
        double maxDailyLossRatio,
        double maxDrawdownRatio,
        double currentPositionRatio,
        double currentDailyPnlRatio,
        double currentDrawdownRatio,
        int riskScore,
        RiskLevel riskLevel
) {
}
