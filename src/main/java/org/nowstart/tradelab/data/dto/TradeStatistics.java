package org.nowstart.tradelab.data.dto;

public record TradeStatistics(
        int totalTrades,
        int winningTrades,
        int losingTrades,
        double winRate,
        double profitFactor,
        double averageProfit,
        double averageLoss,
        double totalProfit,
        double totalLoss,
        int maxConsecutiveWins,
        int maxConsecutiveLosses
) {

    public static TradeStatistics empty() {
        return new TradeStatistics(0, 0, 0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0, 0);
    }
}
