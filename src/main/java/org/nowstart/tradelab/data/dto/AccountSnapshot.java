package org.nowstart.tradelab.data.dto;

public record AccountSnapshot(
        double initialCapital,
        double cash,
        double positionValue,
        double totalValue
) {
}
