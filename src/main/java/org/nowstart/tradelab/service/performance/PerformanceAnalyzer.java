package org.nowstart.tradelab.service.performance;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.tradelab.data.dto.Bar;
import org.nowstart.tradelab.data.dto.BenchmarkComparison;
import org.nowstart.tradelab.data.dto.DailySnapshot;
import org.nowstart.tradelab.data.dto.PerformanceReport;
import org.nowstart.tradelab.data.dto.TradeRecord;
import org.nowstart.tradelab.data.dto.TradeStatistics;
import org.nowstart.tradelab.data.property.AnalysisProperties;
import org.springframework.stereotype.Service;

/**
 * Return, risk and trade statistics over a snapshot series.
 *
 * <p>None of the calculators throw on empty, single-point or flat input. Degenerate cases resolve to the
 * documented sentinels: 0 for undefined ratios, {@code +Infinity} for Sortino without negative returns,
 * Calmar without drawdown and profit factor without losing trades.
 */
@Service
@RequiredArgsConstructor
public class PerformanceAnalyzer {

    private final AnalysisProperties properties;

    public PerformanceReport analyze(List<DailySnapshot> snapshots, List<TradeRecord> trades, double initialCapital) {
        TradeStatistics tradeStatistics = analyzeTrades(trades);
        if (snapshots == null || snapshots.isEmpty()) {
            return new PerformanceReport(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, null, null, tradeStatistics);
        }

        double[] returns = dailyReturns(snapshots);
        double annualizedReturn = annualizedReturn(snapshots, initialCapital);
        double volatility = volatility(returns);
        double maxDrawdown = maxDrawdown(snapshots);

        return new PerformanceReport(
                totalReturn(snapshots, initialCapital),
                annualizedReturn,
                volatility,
                sharpeRatio(annualizedReturn, volatility),
                sortinoRatio(annualizedReturn, returns),
                calmarRatio(annualizedReturn, maxDrawdown),
                maxDrawdown,
                valueAtRisk(returns),
                conditionalValueAtRisk(returns),
                snapshots.size(),
                snapshots.get(0).date(),
                snapshots.get(snapshots.size() - 1).date(),
                tradeStatistics
        );
    }

    public double[] dailyReturns(List<DailySnapshot> snapshots) {
        if (snapshots == null || snapshots.size() < 2) {
            return new double[0];
        }
        double[] returns = new double[snapshots.size() - 1];
        for (int i = 1; i < snapshots.size(); i++) {
            returns[i - 1] = simpleReturn(snapshots.get(i - 1).totalValue(), snapshots.get(i).totalValue());
        }
        return returns;
    }

    public double totalReturn(List<DailySnapshot> snapshots, double initialCapital) {
        if (snapshots == null || snapshots.isEmpty() || initialCapital <= 0.0) {
            return 0.0;
        }
        return (snapshots.get(snapshots.size() - 1).totalValue() - initialCapital) / initialCapital;
    }

    public double annualizedReturn(List<DailySnapshot> snapshots, double initialCapital) {
        if (snapshots == null || snapshots.size() < 2) {
            return 0.0;
        }
        double growth = 1.0 + totalReturn(snapshots, initialCapital);
        if (growth <= 0.0) {
            return -1.0;
        }
        return Math.pow(growth, (double) properties.tradingDaysPerYear() / snapshots.size()) - 1.0;
    }

    public double volatility(double[] returns) {
        return sampleStandardDeviation(returns) * Math.sqrt(properties.tradingDaysPerYear());
    }

    public double sharpeRatio(double annualizedReturn, double volatility) {
        if (volatility == 0.0) {
            return 0.0;
        }
        return (annualizedReturn - properties.riskFreeRate()) / volatility;
    }

    public double sortinoRatio(double annualizedReturn, double[] returns) {
        double[] negative = Arrays.stream(returns).filter(value -> value < 0.0).toArray();
        if (negative.length == 0) {
            return Double.POSITIVE_INFINITY;
        }
        double downside = sampleStandardDeviation(negative) * Math.sqrt(properties.tradingDaysPerYear());
        if (downside == 0.0) {
            return 0.0;
        }
        return (annualizedReturn - properties.riskFreeRate()) / downside;
    }

    public double calmarRatio(double annualizedReturn, double maxDrawdown) {
        double depth = Math.abs(maxDrawdown);
        if (depth == 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        return annualizedReturn / depth;
    }

    /**
     * Deepest peak-to-trough decline of total value, as a ratio {@code <= 0}.
     */
    public double maxDrawdown(List<DailySnapshot> snapshots) {
        if (snapshots == null || snapshots.isEmpty()) {
            return 0.0;
        }
        double peak = Double.NEGATIVE_INFINITY;
        double worst = 0.0;
        for (DailySnapshot snapshot : snapshots) {
            peak = Math.max(peak, snapshot.totalValue());
            if (peak <= 0.0) {
                continue;
            }
            worst = Math.min(worst, (snapshot.totalValue() - peak) / peak);
        }
        return worst;
    }

    /**
     * Historical VaR: the {@code 1 - confidence} percentile of daily returns, linearly interpolated.
     */
    public double valueAtRisk(double[] returns) {
        if (returns.length == 0) {
            return 0.0;
        }
        return percentile(returns, 1.0 - properties.varConfidence());
    }

    public double conditionalValueAtRisk(double[] returns) {
        if (returns.length == 0) {
            return 0.0;
        }
        double var = valueAtRisk(returns);
        double sum = 0.0;
        int count = 0;
        for (double value : returns) {
            if (value <= var) {
                sum += value;
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }

    /**
     * Win/loss statistics over sell trades. A zero-profit sell counts toward the total but is neither a win
     * nor a loss and breaks both streaks.
     */
    public TradeStatistics analyzeTrades(List<TradeRecord> trades) {
        if (trades == null || trades.isEmpty()) {
            return TradeStatistics.empty();
        }
        List<Double> profits = new ArrayList<>();
        for (TradeRecord trade : trades) {
            if (trade.isSell()) {
                profits.add(trade.profit() == null ? 0.0 : trade.profit());
            }
        }
        if (profits.isEmpty()) {
            return TradeStatistics.empty();
        }

        int wins = 0;
        int losses = 0;
        double totalProfit = 0.0;
        double lossSum = 0.0;
        int winStreak = 0;
        int lossStreak = 0;
        int maxWinStreak = 0;
        int maxLossStreak = 0;
        for (double profit : profits) {
            if (profit > 0.0) {
                wins++;
                totalProfit += profit;
                winStreak++;
                lossStreak = 0;
            } else if (profit < 0.0) {
                losses++;
                lossSum += profit;
                lossStreak++;
                winStreak = 0;
            } else {
                winStreak = 0;
                lossStreak = 0;
            }
            maxWinStreak = Math.max(maxWinStreak, winStreak);
            maxLossStreak = Math.max(maxLossStreak, lossStreak);
        }

        double totalLoss = Math.abs(lossSum);
        return new TradeStatistics(
                profits.size(),
                wins,
                losses,
                (double) wins / profits.size(),
                totalLoss > 0.0 ? totalProfit / totalLoss : Double.POSITIVE_INFINITY,
                wins == 0 ? 0.0 : totalProfit / wins,
                losses == 0 ? 0.0 : lossSum / losses,
                totalProfit,
                totalLoss,
                maxWinStreak,
                maxLossStreak
        );
    }

    /**
     * Beta, alpha and information ratio against benchmark daily returns keyed by date. Only dates present in
     * both series are used; with fewer than two of them every figure is 0.
     */
    public BenchmarkComparison compareToBenchmark(
            List<DailySnapshot> snapshots,
            double initialCapital,
            Map<LocalDate, Double> benchmarkReturns
    ) {
        if (snapshots == null || snapshots.size() < 2 || benchmarkReturns == null || benchmarkReturns.isEmpty()) {
            return new BenchmarkComparison(0.0, 0.0, 0.0, 0);
        }

        List<Double> strategy = new ArrayList<>();
        List<Double> benchmark = new ArrayList<>();
        for (int i = 1; i < snapshots.size(); i++) {
            Double benchmarkReturn = benchmarkReturns.get(snapshots.get(i).date());
            if (benchmarkReturn == null || !Double.isFinite(benchmarkReturn)) {
                continue;
            }
            strategy.add(simpleReturn(snapshots.get(i - 1).totalValue(), snapshots.get(i).totalValue()));
            benchmark.add(benchmarkReturn);
        }
        int overlapping = strategy.size();
        if (overlapping < 2) {
            return new BenchmarkComparison(0.0, 0.0, 0.0, overlapping);
        }

        double[] s = toArray(strategy);
        double[] b = toArray(benchmark);
        double benchmarkVariance = sampleVariance(b);
        double beta = benchmarkVariance == 0.0 ? 0.0 : sampleCovariance(s, b) / benchmarkVariance;

        int days = properties.tradingDaysPerYear();
        double riskFree = properties.riskFreeRate();
        double benchmarkAnnualized = Math.pow(1.0 + mean(b), days) - 1.0;
        double alpha = annualizedReturn(snapshots, initialCapital) - (riskFree + beta * (benchmarkAnnualized - riskFree));

        double[] excess = new double[overlapping];
        for (int i = 0; i < overlapping; i++) {
            excess[i] = s[i] - b[i];
        }
        double trackingError = sampleStandardDeviation(excess) * Math.sqrt(days);
        double informationRatio = trackingError == 0.0
                ? 0.0
                : (Math.pow(1.0 + mean(excess), days) - 1.0) / trackingError;

        return new BenchmarkComparison(beta, alpha, informationRatio, overlapping);
    }

    /**
     * Close-to-close returns keyed by the later bar's date.
     */
    public static Map<LocalDate, Double> returnsOf(List<Bar> bars) {
        Map<LocalDate, Double> returns = new LinkedHashMap<>();
        if (bars == null) {
            return returns;
        }
        for (int i = 1; i < bars.size(); i++) {
            returns.put(bars.get(i).date(), simpleReturn(bars.get(i - 1).close(), bars.get(i).close()));
        }
        return returns;
    }

    private static double simpleReturn(double previous, double current) {
        if (previous == 0.0) {
            return 0.0;
        }
        return current / previous - 1.0;
    }

    private static double percentile(double[] values, double fraction) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double rank = fraction * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
    }

    private static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    private static double sampleVariance(double[] values) {
        return sampleCovariance(values, values);
    }

    private static double sampleCovariance(double[] a, double[] b) {
        if (a.length < 2) {
            return 0.0;
        }
        double meanA = mean(a);
        double meanB = mean(b);
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += (a[i] - meanA) * (b[i] - meanB);
        }
        return sum / (a.length - 1);
    }

    private static double sampleStandardDeviation(double[] values) {
        return Math.sqrt(Math.max(sampleVariance(values), 0.0));
    }

    private static double[] toArray(List<Double> values) {
        double[] out = new double[values.size()];
        for (int i = 0; i < values.size(); i++) {
            out[i] = values.get(i);
        }
        return out;
    }
}
