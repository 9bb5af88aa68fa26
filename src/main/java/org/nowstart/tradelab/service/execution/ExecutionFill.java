package org.nowstart.tradelab.service.execution;

import org.nowstart.tradelab.data.type.OrderSide;

/**
 * Priced, lot-rounded fill produced by {@link FrictionModel}.
 *
 * @param side           fill direction
 * @param effectivePrice price per share after slippage (or the limit price)
 * @param quantity       lot-rounded share count, possibly 0
 * @param grossAmount    {@code quantity * effectivePrice}
 * @param commission     commission after the minimum floor, 0 for an empty fill
 * @param stampDuty      sell-side tax, 0 for buys
 */
public record ExecutionFill(
        OrderSide side,
        double effectivePrice,
        long quantity,
        double grossAmount,
        double commission,
        double stampDuty
) {

    public boolean isEmpty() {
        return quantity <= 0;
    }

    public double fees() {
        return commission + stampDuty;
    }

    /**
     * Cash needed to settle a buy.
     */
    public double totalCost() {
        return grossAmount + fees();
    }

    /**
     * Cash received from a sell.
     */
    public double netProceeds() {
        return grossAmount - fees();
    }

    public double cashDelta() {
        return side == OrderSide.BUY ? -totalCost() : netProceeds();
    }
}
