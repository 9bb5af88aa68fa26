package org.nowstart.tradelab.service.backtest;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tradelab.data.dto.BacktestResult;
import org.nowstart.tradelab.data.dto.Bar;
import org.nowstart.tradelab.data.dto.DailySnapshot;
import org.nowstart.tradelab.data.dto.PerformanceReport;
import org.nowstart.tradelab.data.dto.Signal;
import org.nowstart.tradelab.data.dto.TradeRecord;
import org.nowstart.tradelab.data.exception.ErrorCode;
import org.nowstart.tradelab.data.exception.TradingException;
import org.nowstart.tradelab.data.property.ExecutionProperties;
import org.nowstart.tradelab.data.type.OrderSide;
import org.nowstart.tradelab.service.execution.ExecutionFill;
import org.nowstart.tradelab.service.execution.FrictionModel;
import org.nowstart.tradelab.service.execution.Ledger;
import org.nowstart.tradelab.service.performance.PerformanceAnalyzer;
import org.nowstart.tradelab.strategy.core.TradingStrategy;
import org.springframework.stereotype.Service;

/**
 * Replays daily bars through a strategy and simulates fills at each bar's close.
 *
 * <p>Every run owns a fresh {@link Ledger}, trade log and snapshot list, so the engine itself holds no run
 * state and repeated runs over the same input produce identical results. Signals that cannot be filled
 * (not enough cash for one lot, nothing to sell) are dropped and logged at debug level.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestEngine {

    private final ExecutionProperties executionProperties;
    private final FrictionModel frictionModel;
    private final PerformanceAnalyzer performanceAnalyzer;

    public BacktestResult run(TradingStrategy strategy, List<Bar> bars, String symbol) {
        requireStrategy(strategy);
        String runSymbol = requireSymbol(symbol);
        validateBars(runSymbol, bars);

        Map<LocalDate, List<Signal>> signalsByDate = groupByDate(strategy.generateSignals(List.copyOf(bars)), runSymbol);
        Run run = new Run(new Ledger(executionProperties.initialCapital()));

        for (Bar bar : bars) {
            for (Signal signal : signalsByDate.getOrDefault(bar.date(), List.of())) {
                execute(run, signal, bar.date(), bar.close());
            }
            run.snapshot(bar.date(), Map.of(runSymbol, bar.close()));
        }

        BacktestResult result = finish(strategy.name(), List.of(runSymbol), run);
        log.info(
                "event=backtest_completed strategy={} symbol={} bars={} trades={} final_value={}",
                strategy.name(),
                runSymbol,
                bars.size(),
                result.tradeCount(),
                result.finalValue()
        );
        return result;
    }

    /**
     * Runs one strategy over several symbols sharing one ledger. Only dates present in every series are
     * simulated; each symbol's signals fill at that symbol's own close.
     */
    public BacktestResult runMultiple(TradingStrategy strategy, Map<String, List<Bar>> barsBySymbol) {
        requireStrategy(strategy);
        if (barsBySymbol == null || barsBySymbol.isEmpty()) {
            throw new TradingException(ErrorCode.EMPTY_DATA, "no symbols to backtest");
        }

        Map<String, Map<LocalDate, List<Signal>>> signals = new LinkedHashMap<>();
        Map<String, Map<LocalDate, Double>> closes = new LinkedHashMap<>();
        Set<LocalDate> commonDates = null;
        for (Map.Entry<String, List<Bar>> entry : barsBySymbol.entrySet()) {
            String symbol = requireSymbol(entry.getKey());
            List<Bar> bars = entry.getValue();
            validateBars(symbol, bars);

            signals.put(symbol, groupByDate(strategy.generateSignals(List.copyOf(bars)), symbol));
            Map<LocalDate, Double> closeByDate = new HashMap<>();
            for (Bar bar : bars) {
                closeByDate.put(bar.date(), bar.close());
            }
            closes.put(symbol, closeByDate);

            if (commonDates == null) {
                commonDates = new TreeSet<>(closeByDate.keySet());
            } else {
                commonDates.retainAll(closeByDate.keySet());
            }
        }
        if (commonDates == null || commonDates.isEmpty()) {
            throw new TradingException(ErrorCode.EMPTY_DATA, "symbols share no trading dates");
        }

        Run run = new Run(new Ledger(executionProperties.initialCapital()));
        for (LocalDate date : commonDates) {
            Map<String, Double> pricesToday = new HashMap<>();
            for (String symbol : signals.keySet()) {
                double close = closes.get(symbol).get(date);
                pricesToday.put(symbol, close);
                for (Signal signal : signals.get(symbol).getOrDefault(date, List.of())) {
                    execute(run, signal, date, close);
                }
            }
            run.snapshot(date, pricesToday);
        }

        BacktestResult result = finish(strategy.name(), List.copyOf(signals.keySet()), run);
        log.info(
                "event=backtest_completed strategy={} symbols={} dates={} trades={} final_value={}",
                strategy.name(),
                signals.keySet(),
                commonDates.size(),
                result.tradeCount(),
                result.finalValue()
        );
        return result;
    }

    private void execute(Run run, Signal signal, LocalDate date, double close) {
        switch (signal.type()) {
            case BUY -> executeBuy(run, signal, date, close);
            case SELL -> executeSell(run, signal, date, close, signal.hasRequestedQuantity());
            case CLOSE_LONG -> executeSell(run, signal, date, close, false);
            case HOLD, CLOSE_SHORT -> {
                // no shorting, nothing to do
            }
        }
    }

    private void executeBuy(Run run, Signal signal, LocalDate date, double close) {
        Ledger ledger = run.ledger;
        double effectivePrice = frictionModel.effectivePrice(OrderSide.BUY, close);
        long quantity = frictionModel.affordableQuantity(ledger.cash(), effectivePrice);
        if (signal.hasRequestedQuantity()) {
            quantity = frictionModel.roundToLot(Math.min(quantity, signal.requestedQuantity()));
        }
        if (quantity < frictionModel.lotSize()) {
            log.debug("event=signal_skipped date={} symbol={} type=BUY reason=below_lot cash={}", date, signal.symbol(), ledger.cash());
            return;
        }

        ExecutionFill fill = frictionModel.quoteAtPrice(OrderSide.BUY, quantity, effectivePrice);
        if (!ledger.canAfford(fill)) {
            log.debug(
                    "event=signal_skipped date={} symbol={} type=BUY reason=insufficient_cash required={} cash={}",
                    date,
                    signal.symbol(),
                    fill.totalCost(),
                    ledger.cash()
            );
            return;
        }

        ledger.applyBuy(signal.symbol(), fill);
        run.trades.add(record(date, signal.symbol(), fill, ledger.cash(), null));
    }

    private void executeSell(Run run, Signal signal, LocalDate date, double close, boolean partial) {
        Ledger ledger = run.ledger;
        long held = ledger.quantity(signal.symbol());
        if (held <= 0) {
            log.debug("event=signal_skipped date={} symbol={} type={} reason=no_position", date, signal.symbol(), signal.type());
            return;
        }

        long quantity = partial ? frictionModel.roundToLot(Math.min(held, signal.requestedQuantity())) : held;
        if (quantity <= 0) {
            log.debug("event=signal_skipped date={} symbol={} type={} reason=below_lot held={}", date, signal.symbol(), signal.type(), held);
            return;
        }

        ExecutionFill fill = frictionModel.quote(OrderSide.SELL, quantity, close);
        if (fill.isEmpty()) {
            return;
        }
        double profit = ledger.applySell(signal.symbol(), fill);
        run.trades.add(record(date, signal.symbol(), fill, ledger.cash(), profit));
    }

    private TradeRecord record(LocalDate date, String symbol, ExecutionFill fill, double cashAfter, Double profit) {
        return new TradeRecord(
                date,
                symbol,
                fill.side(),
                fill.effectivePrice(),
                fill.quantity(),
                fill.grossAmount(),
                fill.commission(),
                fill.stampDuty(),
                cashAfter,
                profit
        );
    }

    private BacktestResult finish(String strategyName, List<String> symbols, Run run) {
        double initialCapital = run.ledger.initialCapital();
        PerformanceReport performance = performanceAnalyzer.analyze(run.snapshots, run.trades, initialCapital);
        double finalValue = run.snapshots.get(run.snapshots.size() - 1).totalValue();
        return new BacktestResult(strategyName, symbols, initialCapital, finalValue, run.trades, run.snapshots, performance);
    }

    private Map<LocalDate, List<Signal>> groupByDate(List<Signal> signals, String symbol) {
        Map<LocalDate, List<Signal>> byDate = new HashMap<>();
        if (signals == null) {
            return byDate;
        }
        for (Signal signal : signals) {
            if (signal == null) {
                continue;
            }
            byDate.computeIfAbsent(signal.date(), ignored -> new ArrayList<>()).add(signal.withSymbol(symbol));
        }
        return byDate;
    }

    private void validateBars(String symbol, List<Bar> bars) {
        if (bars == null || bars.isEmpty()) {
            throw new TradingException(ErrorCode.EMPTY_DATA, "no bars for " + symbol);
        }
        LocalDate previous = null;
        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            if (bar == null || bar.date() == null) {
                throw new TradingException(ErrorCode.INVALID_DATA, "bar " + i + " of " + symbol + " has no date");
            }
            if (!Double.isFinite(bar.close()) || bar.close() <= 0.0) {
                throw new TradingException(ErrorCode.INVALID_DATA, "bar " + bar.date() + " of " + symbol + " has invalid close=" + bar.close());
            }
            if (previous != null && !bar.date().isAfter(previous)) {
                throw new TradingException(ErrorCode.INVALID_DATA, "bars of " + symbol + " are not strictly ascending at " + bar.date());
            }
            previous = bar.date();
        }
    }

    private void requireStrategy(TradingStrategy strategy) {
        if (strategy == null) {
            throw new TradingException(ErrorCode.INVALID_PARAMETER, "strategy is required");
        }
    }

    private String requireSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new TradingException(ErrorCode.INVALID_PARAMETER, "symbol is required");
        }
        return symbol.trim();
    }

    private static final class Run {

        private final Ledger ledger;
        private final List<TradeRecord> trades = new ArrayList<>();
        private final List<DailySnapshot> snapshots = new ArrayList<>();

        private Run(Ledger ledger) {
            this.ledger = ledger;
        }

        private void snapshot(LocalDate date, Map<String, Double> prices) {
            double positionValue = ledger.positionValue(prices);
            snapshots.add(new DailySnapshot(date, ledger.cash() + positionValue, ledger.cash(), positionValue));
        }
    }
}
