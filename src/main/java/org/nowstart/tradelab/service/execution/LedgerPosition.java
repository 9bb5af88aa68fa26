package org.nowstart.tradelab.service.execution;

import lombok.Getter;
import org.nowstart.tradelab.data.dto.Position;

@Getter
public class LedgerPosition {

    private final String symbol;
    private long quantity;
    private double averageCost;
    private double totalCost;

    LedgerPosition(String symbol) {
        this.symbol = symbol;
    }

    void add(long shares, double amount) {
        totalCost += amount;
        quantity += shares;
        averageCost = totalCost / quantity;
    }

    void reduce(long shares) {
        quantity -= shares;
        if (quantity <= 0) {
            quantity = 0;
            averageCost = 0.0;
            totalCost = 0.0;
        } else {
            totalCost = quantity * averageCost;
        }
    }

    void clear() {
        quantity = 0;
        averageCost = 0.0;
        totalCost = 0.0;
    }

    public Position toPosition() {
        return new Position(symbol, quantity, averageCost, totalCost);
    }
}
