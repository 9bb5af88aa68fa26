package org.nowstart.tradelab.service.risk;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tradelab.data.dto.PositionSummary;
import org.nowstart.tradelab.data.dto.PositionView;
import org.nowstart.tradelab.data.dto.RiskMetrics;
import org.nowstart.tradelab.data.dto.RiskReport;
import org.nowstart.tradelab.data.property.RiskProperties;
import org.nowstart.tradelab.data.type.RiskLevel;
import org.nowstart.tradelab.service.execution.FrictionModel;
import org.springframework.stereotype.Service;

/**
 * Threshold checks and a composite risk score over account values.
 *
 * <p>Holds two pieces of running state: the peak total value seen so far and the value at the start of the
 * current day. Both start at the initial capital.
 */
@Slf4j
@Service
public class RiskManager {

    private static final double POSITION_WARNING_FRACTION = 0.8;
    private static final double LOSS_WARNING_FRACTION = 0.5;

    private final RiskProperties properties;
    private final FrictionModel frictionModel;

    private double peakValue;
    private double dailyStartValue;
    private LocalDate currentDay;

    public RiskManager(RiskProperties properties, FrictionModel frictionModel) {
        this.properties = properties;
        this.frictionModel = frictionModel;
        initialize(frictionModel.initialCapital());
    }

    public synchronized void initialize(double initialCapital) {
        peakValue = initialCapital;
        dailyStartValue = initialCapital;
        currentDay = null;
    }

    /**
     * Starts a new trading day at {@code currentValue} the first time a date is seen; later calls for the same
     * date only move the peak.
     */
    public synchronized void onNewDay(LocalDate date, double currentValue) {
        if (date != null && !date.equals(currentDay)) {
            currentDay = date;
            dailyStartValue = currentValue;
            log.debug("event=risk_day_started date={} start_value={}", date, currentValue);
        }
        updateValue(currentValue);
    }

    public synchronized void updateDailyStart(double currentValue) {
        dailyStartValue = currentValue;
    }

    public synchronized void updateValue(double currentValue) {
        if (currentValue > peakValue) {
            peakValue = currentValue;
        }
    }

    public synchronized double getPeakValue() {
        return peakValue;
    }

    public synchronized double getDailyStartValue() {
        return dailyStartValue;
    }

    public double calculatePositionRatio(double positionValue, double totalValue) {
        return totalValue == 0.0 ? 0.0 : positionValue / totalValue;
    }

    public double calculateSingleStockRatio(double stockValue, double totalValue) {
        return totalValue == 0.0 ? 0.0 : stockValue / totalValue;
    }

    public synchronized double calculateDailyPnlRatio(double currentValue) {
        return dailyStartValue == 0.0 ? 0.0 : (currentValue - dailyStartValue) / dailyStartValue;
    }

    /**
     * Decline from the running peak as a positive fraction.
     */
    public synchronized double calculateDrawdownRatio(double currentValue) {
        return peakValue == 0.0 ? 0.0 : (peakValue - currentValue) / peakValue;
    }

    public boolean checkPositionLimit(double positionValue, double totalValue) {
        return calculatePositionRatio(positionValue, totalValue) <= properties.maxPositionRatio();
    }

    public boolean checkSingleStockLimit(double stockValue, double totalValue) {
        return calculateSingleStockRatio(stockValue, totalValue) <= properties.maxSingleStockRatio();
    }

    public boolean checkDailyLossLimit(double currentValue) {
        return calculateDailyPnlRatio(currentValue) >= -properties.maxDailyLossRatio();
    }

    public boolean checkDrawdownLimit(double currentValue) {
        return calculateDrawdownRatio(currentValue) <= properties.maxDrawdownRatio();
    }

    public boolean checkStopLoss(double averageCost, double currentPrice) {
        if (averageCost == 0.0) {
            return false;
        }
        return (currentPrice - averageCost) / averageCost <= -properties.stopLossRatio();
    }

    public boolean checkTakeProfit(double averageCost, double currentPrice) {
        if (averageCost == 0.0) {
            return false;
        }
        return (currentPrice - averageCost) / averageCost >= properties.takeProfitRatio();
    }

    public RiskMetrics getRiskMetrics(double positionValue, double totalValue, Map<String, Double> stockValues) {
        double positionRatio = calculatePositionRatio(positionValue, totalValue);
        double dailyPnlRatio = calculateDailyPnlRatio(totalValue);
        double drawdownRatio = calculateDrawdownRatio(totalValue);

        int score = 0;
        if (positionRatio > properties.maxPositionRatio()) {
            score += 2;
        } else if (positionRatio > 0.0 && positionRatio >= properties.maxPositionRatio() * POSITION_WARNING_FRACTION) {
            score += 1;
        }

        double dailyLoss = -dailyPnlRatio;
        if (dailyLoss > properties.maxDailyLossRatio()) {
            score += 3;
        } else if (dailyLoss > 0.0 && dailyLoss >= properties.maxDailyLossRatio() * LOSS_WARNING_FRACTION) {
            score += 1;
        }

        if (drawdownRatio > properties.maxDrawdownRatio()) {
            score += 3;
        } else if (drawdownRatio > 0.0 && drawdownRatio >= properties.maxDrawdownRatio() * LOSS_WARNING_FRACTION) {
            score += 1;
        }

        if (stockValues != null) {
            for (double stockValue : stockValues.values()) {
                if (calculateSingleStockRatio(stockValue, totalValue) > properties.maxSingleStockRatio()) {
                    score += 1;
                }
            }
        }

        return new RiskMetrics(
                properties.maxPositionRatio(),
                properties.maxSingleStockRatio(),
                properties.maxDailyLossRatio(),
                properties.maxDrawdownRatio(),
                positionRatio,
                dailyPnlRatio,
                drawdownRatio,
                score,
                RiskLevel.fromScore(score)
        );
    }

    public boolean shouldReducePosition(double currentValue, double positionValue) {
        return !checkDailyLossLimit(currentValue)
                || !checkDrawdownLimit(currentValue)
                || !checkPositionLimit(positionValue, currentValue);
    }

    /**
     * Largest lot-rounded quantity that keeps one stock within the single-stock ratio.
     */
    public long calculateMaxPositionSize(double totalValue, double price) {
        if (!Double.isFinite(price) || price <= 0.0 || totalValue <= 0.0) {
            return 0L;
        }
        double maxValue = totalValue * properties.maxSingleStockRatio();
        return frictionModel.roundToLot((long) Math.floor(maxValue / price));
    }

    public RiskReport getRiskReport(double totalValue, double positionValue, Map<String, Double> stockValues) {
        RiskMetrics metrics = getRiskMetrics(positionValue, totalValue, stockValues);

        List<String> warnings = new ArrayList<>();
        if (metrics.currentPositionRatio() > properties.maxPositionRatio()) {
            warnings.add("position ratio " + percent(metrics.currentPositionRatio())
                    + " exceeds limit " + percent(properties.maxPositionRatio()));
        }
        if (metrics.currentDailyPnlRatio() < -properties.maxDailyLossRatio()) {
            warnings.add("daily loss " + percent(metrics.currentDailyPnlRatio())
                    + " exceeds limit " + percent(properties.maxDailyLossRatio()));
        }
        if (metrics.currentDrawdownRatio() > properties.maxDrawdownRatio()) {
            warnings.add("drawdown " + percent(metrics.currentDrawdownRatio())
                    + " exceeds limit " + percent(properties.maxDrawdownRatio()));
        }
        if (stockValues != null) {
            for (Map.Entry<String, Double> entry : stockValues.entrySet()) {
                double ratio = calculateSingleStockRatio(entry.getValue(), totalValue);
                if (ratio > properties.maxSingleStockRatio()) {
                    warnings.add(entry.getKey() + " weight " + percent(ratio)
                            + " exceeds limit " + percent(properties.maxSingleStockRatio()));
                }
            }
        }

        boolean shouldReduce = shouldReducePosition(totalValue, positionValue);
        if (!warnings.isEmpty()) {
            log.warn("event=risk_warning level={} score={} warnings={}", metrics.riskLevel(), metrics.riskScore(), warnings.size());
        }
        return new RiskReport(
                metrics.riskLevel(),
                metrics.currentPositionRatio(),
                metrics.currentDailyPnlRatio(),
                metrics.currentDrawdownRatio(),
                List.copyOf(warnings),
                shouldReduce
        );
    }

    public RiskReport getRiskReport(PositionSummary summary) {
        Map<String, Double> stockValues = new LinkedHashMap<>();
        for (PositionView view : summary.positions()) {
            stockValues.put(view.symbol(), view.marketValue());
        }
        return getRiskReport(summary.totalValue(), summary.positionValue(), stockValues);
    }

    private static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.2f%%", ratio * 100.0);
    }
}
