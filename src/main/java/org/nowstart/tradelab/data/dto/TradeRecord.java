package org.nowstart.tradelab.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;
import org.nowstart.tradelab.data.type.OrderSide;

/**
 * One executed fill of a backtest run.
 *
 * <p>{@code profit} is only set for sells and equals {@code grossAmount - quantity * averageCost}. Fees are
 * left out of it even though they are deducted from {@code resultingCash}.
 */
public record TradeRecord(
        LocalDate date,
        String symbol,
        OrderSide direction,
        double executedPrice,
        long quantity,
        double grossAmount,
        double commission,
        double stampDuty,
        double resultingCash,
        Double profit
) {

    @JsonProperty("fees")
    public double fees() {
        return commission + stampDuty;
    }

    @JsonIgnore
    public boolean isSell() {
        return direction == OrderSide.SELL;
    }

    /**
     * Net cash effect of the fill: negative for buys, positive for sells.
     */
    public double cashFlow() {
        return isSell() ? grossAmount - fees() : -(grossAmount + fees());
    }
}
