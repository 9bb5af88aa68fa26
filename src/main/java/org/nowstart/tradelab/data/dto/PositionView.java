package org.nowstart.tradelab.data.dto;

public record PositionView(
        String symbol,
        long quantity,
        double averageCost,
        double currentPrice,
        double marketValue,
        double profitLoss,
        double profitLossRatio
) {
}
