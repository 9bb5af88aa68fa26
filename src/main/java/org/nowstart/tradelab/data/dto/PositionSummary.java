package org.nowstart.tradelab.data.dto;

import java.util.List;

public record PositionSummary(
        double totalValue,
        double cash,
        double positionValue,
        int positionCount,
        double totalProfitLoss,
        List<PositionView> positions
) {
}
