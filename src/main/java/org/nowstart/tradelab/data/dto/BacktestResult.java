package org.nowstart.tradelab.data.dto;

import java.util.List;

public record BacktestResult(
        String strategyName,
        List<String> symbols,
        double initialCapital,
        double finalValue,
        List<TradeRecord> trades,
        List<DailySnapshot> snapshots,
        PerformanceReport performance
) {

    public BacktestResult {
        symbols = List.copyOf(symbols);
        trades = List.copyOf(trades);
        snapshots = List.copyOf(snapshots);
    }

    public int tradeCount() {
        return trades.size();
    }
}
