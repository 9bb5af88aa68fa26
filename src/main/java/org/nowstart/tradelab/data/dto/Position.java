package org.nowstart.tradelab.data.dto;

public record Position(
        String symbol,
        long quantity,
        double averageCost,
        double totalCost
) {

    public static Position flat(String symbol) {
        return new Position(symbol, 0L, 0.0, 0.0);
    }

    public boolean hasQuantity() {
        return quantity > 0;
    }
}
