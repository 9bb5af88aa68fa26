package org.nowstart.tradelab.data.dto;

import java.time.Instant;
import org.nowstart.tradelab.data.type.OrderSide;

public record BrokerTrade(
        String orderId,
        String symbol,
        OrderSide direction,
        double executedPrice,
        long quantity,
        double grossAmount,
        double commission,
        double stampDuty,
        Double profit,
        Instant executedAt
) {

    public double fees() {
        return commission + stampDuty;
    }
}
