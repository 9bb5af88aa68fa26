package org.nowstart.tradelab.data.property;

import org.springframework.boot.context.properties.ConfigurationProperties;

@SuppressWarnings("ConfigurationProperties")
@ConfigurationProperties(prefix = "tradelab.backtest")
public record BacktestProperties(
        Boolean enabled,
        String barsCsv,
        String symbol,
        String strategy,
        String benchmarkCsv,
        String outputJson,
        Integer tailTrades
) {
    private static final String DEFAULT_STRATEGY = "ma-cross";
    private static final int DEFAULT_TAIL_TRADES = 10;

    public BacktestProperties {
        enabled = enabled != null ? enabled : false;
        barsCsv = normalize(barsCsv);
        symbol = normalize(symbol);
        strategy = strategy == null || strategy.isBlank() ? DEFAULT_STRATEGY : strategy.trim();
        benchmarkCsv = normalize(benchmarkCsv);
        outputJson = normalize(outputJson);
        tailTrades = tailTrades != null ? tailTrades : DEFAULT_TAIL_TRADES;

        if (enabled && barsCsv.isBlank()) {
            throw new IllegalArgumentException("bars-csv must not be blank when the backtest is enabled");
        }
        if (enabled && symbol.isBlank()) {
            throw new IllegalArgumentException("symbol must not be blank when the backtest is enabled");
        }
        if (tailTrades < 0) {
            throw new IllegalArgumentException("tail-trades must be >= 0");
        }
    }

    public boolean hasBenchmark() {
        return !benchmarkCsv.isBlank();
    }

    public boolean hasOutput() {
        return !outputJson.isBlank();
    }

    private static String normalize(String raw) {
        return raw == null ? "" : raw.trim();
    }
}
