package org.nowstart.tradelab.data.dto;

import java.time.LocalDate;

public record PerformanceReport(
        double totalReturn,
        double annualizedReturn,
        double volatility,
        double sharpeRatio,
        double sortinoRatio,
        double calmarRatio,
        double maxDrawdown,
        double valueAtRisk,
        double conditionalValueAtRisk,
        int tradingDays,
        LocalDate startDate,
        LocalDate endDate,
        TradeStatistics tradeStatistics
) {
}
