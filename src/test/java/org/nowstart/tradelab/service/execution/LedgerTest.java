package org.nowstart.tradelab.service.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.tradelab.data.dto.Position;
import org.nowstart.tradelab.data.exception.ErrorCode;
import org.nowstart.tradelab.data.exception.TradingException;
import org.nowstart.tradelab.data.property.ExecutionProperties;
import org.nowstart.tradelab.data.type.OrderSide;

class LedgerTest {

    private final FrictionModel frictionModel = new FrictionModel(ExecutionProperties.defaults());

    @Test
    void applyBuy_updatesWeightedAverageCost() {
        Ledger ledger = new Ledger(100_000.0);

        ledger.applyBuy("600000", frictionModel.quoteAtPrice(OrderSide.BUY, 1000, 10.0));
        ledger.applyBuy("600000", frictionModel.quoteAtPrice(OrderSide.BUY, 1000, 12.0));

        Position position = ledger.position("600000");
        assertThat(position.quantity()).isEqualTo(2000);
        assertThat(position.averageCost()).isCloseTo(11.0, within(1e-9));
        assertThat(position.totalCost()).isCloseTo(position.quantity() * position.averageCost(), within(1e-6));
        assertThat(ledger.cash()).isCloseTo(100_000.0 - 10_005.0 - 12_005.0, within(1e-6));
    }

    @Test
    void checkFill_raisesWithoutTouchingTheLedger() {
        Ledger ledger = new Ledger(1_000.0);

        assertThatThrownBy(() -> ledger.checkFill("600000", frictionModel.quoteAtPrice(OrderSide.BUY, 1000, 10.0)))
                .isInstanceOf(TradingException.class)
                .extracting(e -> ((TradingException) e).getErrorCode())
                .isEqualTo(ErrorCode.INSUFFICIENT_FUNDS);
        assertThatThrownBy(() -> ledger.checkFill("600000", frictionModel.quoteAtPrice(OrderSide.SELL, 100, 10.0)))
                .isInstanceOf(TradingException.class)
                .extracting(e -> ((TradingException) e).getErrorCode())
                .isEqualTo(ErrorCode.INSUFFICIENT_POSITION);

        ledger.checkFill("600000", frictionModel.quoteAtPrice(OrderSide.BUY, 100, 5.0));
        assertThat(ledger.cash()).isEqualTo(1_000.0);
        assertThat(ledger.quantity("600000")).isZero();
    }

    @Test
    void applySell_returnsGrossProfitAndCreditsNetProceeds() {
        Ledger ledger = new Ledger(100_000.0);
        ledger.applyBuy("600000", frictionModel.quoteAtPrice(OrderSide.BUY, 1000, 10.0));
        double cashBefore = ledger.cash();

        ExecutionFill sell = frictionModel.quoteAtPrice(OrderSide.SELL, 400, 12.0);
        double profit = ledger.applySell("600000", sell);

        assertThat(profit).isCloseTo(400 * 12.0 - 400 * 10.0, within(1e-9));
        assertThat(ledger.cash()).isCloseTo(cashBefore + sell.netProceeds(), within(1e-9));
        Position position = ledger.position("600000");
        assertThat(position.quantity()).isEqualTo(600);
        assertThat(position.averageCost()).isCloseTo(10.0, within(1e-9));
        assertThat(position.totalCost()).isCloseTo(6000.0, within(1e-6));
    }

    @Test
    void applySell_flatteningResetsCost() {
        Ledger ledger = new Ledger(100_000.0);
        ledger.applyBuy("600000", frictionModel.quoteAtPrice(OrderSide.BUY, 500, 10.0));

        ledger.applySell("600000", frictionModel.quoteAtPrice(OrderSide.SELL, 500, 9.0));

        assertThat(ledger.position("600000")).isEqualTo(Position.flat("600000"));
        assertThat(ledger.openPositions()).isEmpty();
    }

    @Test
    void applyBuy_refusesWhenFeesPushCostAboveCash() {
        Ledger ledger = new Ledger(1000.0);
        ExecutionFill fill = frictionModel.quoteAtPrice(OrderSide.BUY, 100, 10.0);

        assertThatThrownBy(() -> ledger.applyBuy("600000", fill))
                .isInstanceOf(TradingException.class)
                .extracting(e -> ((TradingException) e).getErrorCode())
                .isEqualTo(ErrorCode.INSUFFICIENT_FUNDS);
        assertThat(ledger.cash()).isEqualTo(1000.0);
        assertThat(ledger.quantity("600000")).isZero();
    }

    @Test
    void applySell_refusesMoreThanHeldAndLeavesLedgerUnchanged() {
        Ledger ledger = new Ledger(100_000.0);
        ledger.applyBuy("600000", frictionModel.quoteAtPrice(OrderSide.BUY, 100, 10.0));
        double cash = ledger.cash();

        assertThatThrownBy(() -> ledger.applySell("600000", frictionModel.quoteAtPrice(OrderSide.SELL, 200, 10.0)))
                .isInstanceOf(TradingException.class)
                .hasMessageContaining("insufficient position");
        assertThat(ledger.cash()).isEqualTo(cash);
        assertThat(ledger.quantity("600000")).isEqualTo(100);
    }

    @Test
    void applySell_rejectsBuyFill() {
        Ledger ledger = new Ledger(100_000.0);

        assertThatThrownBy(() -> ledger.applySell("600000", frictionModel.quoteAtPrice(OrderSide.BUY, 100, 10.0)))
                .isInstanceOf(TradingException.class)
                .extracting(e -> ((TradingException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_ORDER);
    }

    @Test
    void liquidate_creditsGrossRevenueWithoutFees() {
        Ledger ledger = new Ledger(100_000.0);
        ledger.applyBuy("600000", frictionModel.quoteAtPrice(OrderSide.BUY, 300, 10.0));
        double cash = ledger.cash();

        double revenue = ledger.liquidate("600000", 11.0);

        assertThat(revenue).isCloseTo(3300.0, within(1e-9));
        assertThat(ledger.cash()).isCloseTo(cash + 3300.0, within(1e-9));
        assertThat(ledger.quantity("600000")).isZero();
        assertThat(ledger.liquidate("600000", 11.0)).isZero();
    }

    @Test
    void positionValue_marksOnlySymbolsWithPrices() {
        Ledger ledger = new Ledger(100_000.0);
        ledger.applyBuy("A", frictionModel.quoteAtPrice(OrderSide.BUY, 100, 10.0));
        ledger.applyBuy("B", frictionModel.quoteAtPrice(OrderSide.BUY, 200, 5.0));

        assertThat(ledger.positionValue(Map.of("A", 11.0, "B", 6.0))).isCloseTo(2300.0, within(1e-9));
        assertThat(ledger.positionValue(Map.of("A", 11.0))).isCloseTo(1100.0, within(1e-9));
    }

    @Test
    void reset_restoresInitialCapital() {
        Ledger ledger = new Ledger(50_000.0);
        ledger.applyBuy("A", frictionModel.quoteAtPrice(OrderSide.BUY, 100, 10.0));

        ledger.reset();

        assertThat(ledger.cash()).isEqualTo(50_000.0);
        assertThat(ledger.openPositions()).isEmpty();
    }

    @Test
    void constructor_rejectsNegativeCapital() {
        assertThatThrownBy(() -> new Ledger(-1.0))
                .isInstanceOf(TradingException.class)
                .hasMessageContaining("initial capital");
    }
}
