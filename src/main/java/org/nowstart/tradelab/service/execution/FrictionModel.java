package org.nowstart.tradelab.service.execution;

import lombok.RequiredArgsConstructor;
import org.nowstart.tradelab.data.property.ExecutionProperties;
import org.nowstart.tradelab.data.type.OrderSide;
import org.springframework.stereotype.Component;

/**
 * Pricing policy shared by the backtest engine, the simulated broker and the position manager.
 *
 * <p>Every method is a pure function of its arguments and the configured rates, so the same request
 * priced on either execution path yields the same fill.
 */
@Component
@RequiredArgsConstructor
public class FrictionModel {

    private final ExecutionProperties properties;

    public double effectivePrice(OrderSide side, double referencePrice) {
        if (side == OrderSide.BUY) {
            return referencePrice * (1.0 + properties.slippage());
        }
        return referencePrice * (1.0 - properties.slippage());
    }

    public long roundToLot(long quantity) {
        if (quantity <= 0) {
            return 0L;
        }
        long lotSize = properties.lotSize();
        return (quantity / lotSize) * lotSize;
    }

    public boolean isLotMultiple(long quantity) {
        return quantity > 0 && quantity % properties.lotSize() == 0;
    }

    /**
     * Largest lot-rounded quantity whose gross amount fits in {@code cash} at {@code effectivePrice}.
     * Fees are not reserved here; callers re-check the fee-inclusive cost.
     */
    public long affordableQuantity(double cash, double effectivePrice) {
        if (!Double.isFinite(cash) || !Double.isFinite(effectivePrice) || cash <= 0.0 || effectivePrice <= 0.0) {
            return 0L;
        }
        return roundToLot((long) Math.floor(cash / effectivePrice));
    }

    public ExecutionFill quote(OrderSide side, long requestedQuantity, double referencePrice) {
        return quoteAtPrice(side, requestedQuantity, effectivePrice(side, referencePrice));
    }

    public ExecutionFill quoteAtPrice(OrderSide side, long requestedQuantity, double executionPrice) {
        if (side == null) {
            throw new IllegalArgumentException("side is required");
        }
        if (!Double.isFinite(executionPrice) || executionPrice <= 0.0) {
            throw new IllegalArgumentException("execution price must be finite and > 0");
        }

        long quantity = roundToLot(requestedQuantity);
        if (quantity == 0L) {
            return new ExecutionFill(side, executionPrice, 0L, 0.0, 0.0, 0.0);
        }

        double amount = quantity * executionPrice;
        double commission = Math.max(amount * properties.commissionRate(), properties.minCommission());
        double stampDuty = side == OrderSide.SELL ? amount * properties.stampDutyRate() : 0.0;
        return new ExecutionFill(side, executionPrice, quantity, amount, commission, stampDuty);
    }

    public long lotSize() {
        return properties.lotSize();
    }

    public double initialCapital() {
        return properties.initialCapital();
    }
}
