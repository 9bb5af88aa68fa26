package org.nowstart.tradelab.runner;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tradelab.data.dto.BacktestResult;
import org.nowstart.tradelab.data.dto.Bar;
import org.nowstart.tradelab.data.dto.BenchmarkComparison;
import org.nowstart.tradelab.data.dto.PerformanceReport;
import org.nowstart.tradelab.data.dto.TradeRecord;
import org.nowstart.tradelab.data.dto.TradeStatistics;
import org.nowstart.tradelab.data.property.BacktestProperties;
import org.nowstart.tradelab.service.backtest.BacktestEngine;
import org.nowstart.tradelab.service.performance.PerformanceAnalyzer;
import org.nowstart.tradelab.strategy.StrategyRegistry;
import org.nowstart.tradelab.strategy.core.StrategyParams;
import org.nowstart.tradelab.strategy.core.TradingStrategy;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Runs one configured backtest over a CSV file at startup when {@code tradelab.backtest.enabled=true}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BacktestRunner implements ApplicationRunner {

    private final BacktestProperties properties;
    private final CsvBarReader csvBarReader;
    private final StrategyRegistry strategyRegistry;
    private final List<StrategyParams> strategyParams;
    private final BacktestEngine backtestEngine;
    private final PerformanceAnalyzer performanceAnalyzer;
    private final BacktestReportWriter reportWriter;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.enabled()) {
            log.info("tradelab.backtest.enabled=false; pass --tradelab.backtest.enabled=true to run");
            return;
        }

        logSection("BACKTEST START");
        log.info("[Overview] symbol={} strategy={} csv={}", properties.symbol(), properties.strategy(), properties.barsCsv());

        List<Bar> bars = csvBarReader.read(Path.of(properties.barsCsv()));
        log.info("[Overview] loaded bars={} range={} -> {}", bars.size(), bars.get(0).date(), bars.get(bars.size() - 1).date());

        TradingStrategy strategy = strategyRegistry.bindConfigured(properties.strategy(), strategyParams);
        BacktestResult result = backtestEngine.run(strategy, bars, properties.symbol());

        logSection("SUMMARY");
        logSummary(result);

        logSection("TRADES");
        logTradeStatistics(result.performance().tradeStatistics());

        if (properties.hasBenchmark()) {
            logSection("BENCHMARK");
            List<Bar> benchmarkBars = csvBarReader.read(Path.of(properties.benchmarkCsv()));
            BenchmarkComparison comparison = performanceAnalyzer.compareToBenchmark(
                    result.snapshots(),
                    result.initialCapital(),
                    PerformanceAnalyzer.returnsOf(benchmarkBars)
            );
            log.info("[Benchmark] overlap={} beta={} alpha={} infoRatio={}",
                    comparison.overlappingDays(),
                    format(comparison.beta()),
                    formatPercent(comparison.alpha()),
                    format(comparison.informationRatio()));
        }

        logSection("TRADE TAIL");
        logTailTrades(result.trades());

        if (properties.hasOutput()) {
            Path output = Path.of(properties.outputJson());
            reportWriter.write(result, output);
            log.info("[Output] report written to {}", output.toAbsolutePath());
        }
        logSection("BACKTEST END");
    }

    private void logSummary(BacktestResult result) {
        PerformanceReport performance = result.performance();
        log.info("[Summary] range={} -> {} days={} initial={} final={}",
                performance.startDate(),
                performance.endDate(),
                performance.tradingDays(),
                format(result.initialCapital()),
                format(result.finalValue()));
        log.info("[Summary] total={} annualized={} volatility={} mdd={}",
                formatPercent(performance.totalReturn()),
                formatPercent(performance.annualizedReturn()),
                formatPercent(performance.volatility()),
                formatPercent(performance.maxDrawdown()));
        log.info("[Summary] sharpe={} sortino={} calmar={} var={} cvar={}",
                format(performance.sharpeRatio()),
                format(performance.sortinoRatio()),
                format(performance.calmarRatio()),
                formatPercent(performance.valueAtRisk()),
                formatPercent(performance.conditionalValueAtRisk()));
    }

    private void logTradeStatistics(TradeStatistics stats) {
        log.info("[Trades] closed={} wins={} losses={} winRate={} profitFactor={} maxWinStreak={} maxLossStreak={}",
                stats.totalTrades(),
                stats.winningTrades(),
                stats.losingTrades(),
                formatPercent(stats.winRate()),
                format(stats.profitFactor()),
                stats.maxConsecutiveWins(),
                stats.maxConsecutiveLosses());
    }

    private void logTailTrades(List<TradeRecord> trades) {
        int start = Math.max(0, trades.size() - properties.tailTrades());
        for (int i = start; i < trades.size(); i++) {
            TradeRecord trade = trades.get(i);
            log.info("[Trade][TAIL] date={} side={} qty={} price={} fees={} cash={} profit={}",
                    trade.date(),
                    trade.direction(),
                    trade.quantity(),
                    format(trade.executedPrice()),
                    format(trade.fees()),
                    format(trade.resultingCash()),
                    trade.profit() == null ? "-" : format(trade.profit()));
        }
    }

    private void logSection(String title) {
        log.info("========== {} ==========", title);
    }

    private String format(double value) {
        if (!Double.isFinite(value)) {
            return Double.isNaN(value) ? "NaN" : (value > 0 ? "inf" : "-inf");
        }
        return String.format(Locale.US, "%.4f", value);
    }

    private String formatPercent(double value) {
        if (!Double.isFinite(value)) {
            return "NaN";
        }
        return String.format(Locale.US, "%.2f%%", value * 100.0);
    }
}
