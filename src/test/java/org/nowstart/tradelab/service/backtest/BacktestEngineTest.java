package org.nowstart.tradelab.service.backtest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.tradelab.data.dto.BacktestResult;
import org.nowstart.tradelab.data.dto.Bar;
import org.nowstart.tradelab.data.dto.DailySnapshot;
import org.nowstart.tradelab.data.dto.Signal;
import org.nowstart.tradelab.data.dto.TradeRecord;
import org.nowstart.tradelab.data.exception.ErrorCode;
import org.nowstart.tradelab.data.exception.TradingException;
import org.nowstart.tradelab.data.property.AnalysisProperties;
import org.nowstart.tradelab.data.property.ExecutionProperties;
import org.nowstart.tradelab.data.type.OrderSide;
import org.nowstart.tradelab.data.type.SignalType;
import org.nowstart.tradelab.service.execution.FrictionModel;
import org.nowstart.tradelab.service.performance.PerformanceAnalyzer;
import org.nowstart.tradelab.strategy.core.TradingStrategy;

class BacktestEngineTest {

    private static final LocalDate D1 = LocalDate.of(2024, 1, 2);
    private static final LocalDate D2 = LocalDate.of(2024, 1, 3);
    private static final LocalDate D3 = LocalDate.of(2024, 1, 4);
    private static final LocalDate D4 = LocalDate.of(2024, 1, 5);

    @Test
    void run_buysWholeLotsAtSlippedCloseAndChargesMinimumCommission() {
        BacktestEngine engine = engine(10_000.0);

        BacktestResult result = engine.run(fixed(signal(SignalType.BUY, D1, 10.0, null)), List.of(bar(D1, 10.0)), "600000");

        assertThat(result.trades()).hasSize(1);
        TradeRecord trade = result.trades().get(0);
        assertThat(trade.direction()).isEqualTo(OrderSide.BUY);
        assertThat(trade.symbol()).isEqualTo("600000");
        assertThat(trade.quantity()).isEqualTo(900);
        assertThat(trade.executedPrice()).isCloseTo(10.01, within(1e-9));
        assertThat(trade.grossAmount()).isCloseTo(9009.0, within(1e-6));
        assertThat(trade.commission()).isEqualTo(5.0);
        assertThat(trade.stampDuty()).isZero();
        assertThat(trade.resultingCash()).isCloseTo(986.0, within(1e-6));
        assertThat(trade.profit()).isNull();

        DailySnapshot snapshot = result.snapshots().get(0);
        assertThat(snapshot.cash()).isCloseTo(986.0, within(1e-6));
        assertThat(snapshot.positionValue()).isCloseTo(9000.0, within(1e-6));
        assertThat(result.finalValue()).isCloseTo(9986.0, within(1e-6));
    }

    @Test
    void run_roundsRequestedQuantityDownToLot() {
        BacktestEngine engine = engine(1_000_000.0);

        BacktestResult result = engine.run(fixed(signal(SignalType.BUY, D1, 10.0, 150L)), List.of(bar(D1, 10.0)), "600000");

        assertThat(result.trades()).singleElement().extracting(TradeRecord::quantity).isEqualTo(100L);
    }

    @Test
    void run_skipsBuyWhenCashCannotCoverOneLot() {
        BacktestEngine engine = engine(500.0);

        BacktestResult result = engine.run(fixed(signal(SignalType.BUY, D1, 10.0, null)), List.of(bar(D1, 10.0)), "600000");

        assertThat(result.trades()).isEmpty();
        assertThat(result.finalValue()).isEqualTo(500.0);
    }

    @Test
    void run_skipsBuyWhenCommissionExceedsRemainingCash() {
        // 100 shares at 10.01 leaves 4.0 for a 5.0 minimum commission
        BacktestEngine engine = engine(1005.0);

        BacktestResult result = engine.run(fixed(signal(SignalType.BUY, D1, 10.0, null)), List.of(bar(D1, 10.0)), "600000");

        assertThat(result.trades()).isEmpty();
        assertThat(result.snapshots().get(0).cash()).isEqualTo(1005.0);
    }

    @Test
    void run_sellWithoutPositionIsNoOp() {
        BacktestEngine engine = engine(10_000.0);

        BacktestResult result = engine.run(
                fixed(signal(SignalType.SELL, D1, 10.0, null)),
                List.of(bar(D1, 10.0), bar(D2, 11.0)),
                "600000"
        );

        assertThat(result.trades()).isEmpty();
        assertThat(result.snapshots()).extracting(DailySnapshot::totalValue).containsExactly(10_000.0, 10_000.0);
    }

    @Test
    void run_sellRecordsGrossProfitAndCreditsNetCash() {
        BacktestEngine engine = engine(10_000.0);

        BacktestResult result = engine.run(
                fixed(signal(SignalType.BUY, D1, 10.0, null), signal(SignalType.SELL, D2, 11.0, null)),
                List.of(bar(D1, 10.0), bar(D2, 11.0)),
                "600000"
        );

        assertThat(result.trades()).hasSize(2);
        TradeRecord sell = result.trades().get(1);
        assertThat(sell.direction()).isEqualTo(OrderSide.SELL);
        assertThat(sell.quantity()).isEqualTo(900);
        assertThat(sell.executedPrice()).isCloseTo(10.989, within(1e-9));
        assertThat(sell.grossAmount()).isCloseTo(9890.1, within(1e-6));
        assertThat(sell.commission()).isEqualTo(5.0);
        assertThat(sell.stampDuty()).isCloseTo(9.8901, within(1e-6));
        assertThat(sell.profit()).isCloseTo(9890.1 - 9009.0, within(1e-6));
        assertThat(sell.resultingCash()).isCloseTo(986.0 + 9890.1 - 5.0 - 9.8901, within(1e-6));
        assertThat(result.snapshots().get(1).positionValue()).isZero();
    }

    @Test
    void run_partialSellKeepsAverageCostAndRemainingShares() {
        BacktestEngine engine = engine(100_000.0);

        BacktestResult result = engine.run(
                fixed(signal(SignalType.BUY, D1, 10.0, 1000L), signal(SignalType.SELL, D2, 12.0, 350L)),
                List.of(bar(D1, 10.0), bar(D2, 12.0)),
                "600000"
        );

        TradeRecord sell = result.trades().get(1);
        assertThat(sell.quantity()).isEqualTo(300);
        assertThat(sell.profit()).isCloseTo(300 * 12.0 * 0.999 - 300 * 10.01, within(1e-6));
        assertThat(result.snapshots().get(1).positionValue()).isCloseTo(700 * 12.0, within(1e-6));
    }

    @Test
    void run_closeLongSellsEntireHoldingIgnoringRequestedQuantity() {
        BacktestEngine engine = engine(100_000.0);

        BacktestResult result = engine.run(
                fixed(signal(SignalType.BUY, D1, 10.0, 1000L), signal(SignalType.CLOSE_LONG, D2, 10.0, 100L)),
                List.of(bar(D1, 10.0), bar(D2, 10.0)),
                "600000"
        );

        assertThat(result.trades()).extracting(TradeRecord::quantity).containsExactly(1000L, 1000L);
        assertThat(result.snapshots().get(1).positionValue()).isZero();
    }

    @Test
    void run_holdAndCloseShortDoNothing() {
        BacktestEngine engine = engine(100_000.0);

        BacktestResult result = engine.run(
                fixed(signal(SignalType.HOLD, D1, 10.0, null), signal(SignalType.CLOSE_SHORT, D1, 10.0, null)),
                List.of(bar(D1, 10.0)),
                "600000"
        );

        assertThat(result.trades()).isEmpty();
    }

    @Test
    void run_ignoresSignalsDatedOutsideTheBars() {
        BacktestEngine engine = engine(100_000.0);

        BacktestResult result = engine.run(
                fixed(signal(SignalType.BUY, LocalDate.of(2023, 12, 29), 10.0, null)),
                List.of(bar(D1, 10.0), bar(D2, 10.0)),
                "600000"
        );

        assertThat(result.trades()).isEmpty();
    }

    @Test
    void run_cashEqualsInitialCapitalPlusSumOfCashFlows() {
        BacktestEngine engine = engine(250_000.0);
        TradingStrategy strategy = fixed(
                signal(SignalType.BUY, D1, 10.0, 5000L),
                signal(SignalType.SELL, D2, 10.5, 2000L),
                signal(SignalType.BUY, D3, 9.8, null),
                signal(SignalType.CLOSE_LONG, D4, 11.2, null)
        );
        List<Bar> bars = List.of(bar(D1, 10.0), bar(D2, 10.5), bar(D3, 9.8), bar(D4, 11.2));

        BacktestResult result = engine.run(strategy, bars, "600000");

        double expectedCash = 250_000.0;
        for (TradeRecord trade : result.trades()) {
            expectedCash += trade.cashFlow();
            assertThat(trade.resultingCash()).isCloseTo(expectedCash, within(1e-6));
        }
        DailySnapshot last = result.snapshots().get(result.snapshots().size() - 1);
        assertThat(last.cash()).isCloseTo(expectedCash, within(1e-6));
        assertThat(last.positionValue()).isZero();
        assertThat(result.trades()).allSatisfy(trade -> assertThat(trade.quantity() % 100).isZero());
    }

    @Test
    void run_emitsOneSnapshotPerBarInAscendingOrder() {
        BacktestEngine engine = engine(100_000.0);
        List<Bar> bars = List.of(bar(D1, 10.0), bar(D2, 10.5), bar(D3, 9.8), bar(D4, 11.2));

        BacktestResult result = engine.run(fixed(signal(SignalType.BUY, D2, 10.5, 1000L)), bars, "600000");

        assertThat(result.snapshots()).extracting(DailySnapshot::date).containsExactly(D1, D2, D3, D4);
        assertThat(result.snapshots()).allSatisfy(snapshot ->
                assertThat(snapshot.totalValue()).isCloseTo(snapshot.cash() + snapshot.positionValue(), within(1e-6)));
        assertThat(result.snapshots().get(3).positionValue()).isCloseTo(1000 * 11.2, within(1e-6));
        assertThat(result.performance().tradingDays()).isEqualTo(4);
        assertThat(result.performance().startDate()).isEqualTo(D1);
        assertThat(result.performance().endDate()).isEqualTo(D4);
        assertThat(result.performance().maxDrawdown()).isLessThanOrEqualTo(0.0);
    }

    @Test
    void run_isDeterministic() {
        BacktestEngine engine = engine(100_000.0);
        TradingStrategy strategy = fixed(
                signal(SignalType.BUY, D1, 10.0, null),
                signal(SignalType.SELL, D3, 9.8, null)
        );
        List<Bar> bars = List.of(bar(D1, 10.0), bar(D2, 10.5), bar(D3, 9.8), bar(D4, 11.2));

        BacktestResult first = engine.run(strategy, bars, "600000");
        BacktestResult second = engine.run(strategy, bars, "600000");

        assertThat(second).isEqualTo(first);
    }

    @Test
    void run_throwsEmptyDataForNoBars() {
        BacktestEngine engine = engine(100_000.0);

        assertThatThrownBy(() -> engine.run(fixed(), List.of(), "600000"))
                .isInstanceOf(TradingException.class)
                .extracting(e -> ((TradingException) e).getErrorCode())
                .isEqualTo(ErrorCode.EMPTY_DATA);
    }

    @Test
    void run_throwsInvalidDataForUnorderedBars() {
        BacktestEngine engine = engine(100_000.0);

        assertThatThrownBy(() -> engine.run(fixed(), List.of(bar(D2, 10.0), bar(D1, 10.0)), "600000"))
                .isInstanceOf(TradingException.class)
                .extracting(e -> ((TradingException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_DATA);
    }

    @Test
    void run_throwsInvalidDataForNonPositiveClose() {
        BacktestEngine engine = engine(100_000.0);

        assertThatThrownBy(() -> engine.run(fixed(), List.of(bar(D1, 0.0)), "600000"))
                .isInstanceOf(TradingException.class)
                .hasMessageContaining("invalid close");
    }

    @Test
    void runMultiple_fillsEachSymbolAtItsOwnCloseOverCommonDates() {
        BacktestEngine engine = engine(1_000_000.0);
        Map<String, List<Bar>> barsBySymbol = new LinkedHashMap<>();
        barsBySymbol.put("A", List.of(bar(D1, 10.0), bar(D2, 12.0), bar(D3, 13.0)));
        barsBySymbol.put("B", List.of(bar(D1, 20.0), bar(D2, 19.0)));

        BacktestResult result = engine.runMultiple(new FirstBarBuyStrategy(100L), barsBySymbol);

        assertThat(result.symbols()).containsExactly("A", "B");
        assertThat(result.trades()).extracting(TradeRecord::symbol).containsExactly("A", "B");
        assertThat(result.trades().get(0).executedPrice()).isCloseTo(10.01, within(1e-9));
        assertThat(result.trades().get(1).executedPrice()).isCloseTo(20.02, within(1e-9));
        assertThat(result.snapshots()).extracting(DailySnapshot::date).containsExactly(D1, D2);

        double cash = 1_000_000.0 - 1006.0 - 2007.0;
        assertThat(result.snapshots().get(0).totalValue()).isCloseTo(cash + 1000.0 + 2000.0, within(1e-6));
        assertThat(result.snapshots().get(1).totalValue()).isCloseTo(cash + 1200.0 + 1900.0, within(1e-6));
    }

    @Test
    void runMultiple_throwsEmptyDataWithoutCommonDates() {
        BacktestEngine engine = engine(1_000_000.0);
        Map<String, List<Bar>> barsBySymbol = new LinkedHashMap<>();
        barsBySymbol.put("A", List.of(bar(D1, 10.0)));
        barsBySymbol.put("B", List.of(bar(D2, 20.0)));

        assertThatThrownBy(() -> engine.runMultiple(new FirstBarBuyStrategy(100L), barsBySymbol))
                .isInstanceOf(TradingException.class)
                .extracting(e -> ((TradingException) e).getErrorCode())
                .isEqualTo(ErrorCode.EMPTY_DATA);
    }

    private BacktestEngine engine(double capital) {
        ExecutionProperties properties = ExecutionProperties.defaults().withInitialCapital(capital);
        return new BacktestEngine(
                properties,
                new FrictionModel(properties),
                new PerformanceAnalyzer(AnalysisProperties.defaults())
        );
    }

    private static Bar bar(LocalDate date, double close) {
        return new Bar(date, close, close, close, close, 10_000, close * 10_000);
    }

    private static Signal signal(SignalType type, LocalDate date, double price, Long quantity) {
        return new Signal("", type, price, date.atStartOfDay(), 1.0, quantity, Map.of());
    }

    private static TradingStrategy fixed(Signal... signals) {
        return new FixedSignalStrategy(List.of(signals));
    }

    private record FixedSignalStrategy(List<Signal> signals) implements TradingStrategy {

        @Override
        public String name() {
            return "fixed";
        }

        @Override
        public List<Signal> generateSignals(List<Bar> bars) {
            return signals;
        }
    }

    private record FirstBarBuyStrategy(Long quantity) implements TradingStrategy {

        @Override
        public String name() {
            return "first-bar-buy";
        }

        @Override
        public List<Signal> generateSignals(List<Bar> bars) {
            List<Signal> signals = new ArrayList<>();
            Bar first = bars.get(0);
            signals.add(signal(SignalType.BUY, first.date(), first.close(), quantity));
            return signals;
        }
    }
}
