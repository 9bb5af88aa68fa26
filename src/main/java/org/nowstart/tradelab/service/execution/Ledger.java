package org.nowstart.tradelab.service.execution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.nowstart.tradelab.data.dto.Position;
import org.nowstart.tradelab.data.exception.ErrorCode;
import org.nowstart.tradelab.data.exception.TradingException;
import org.nowstart.tradelab.data.type.OrderSide;

/**
 * Cash plus per-symbol quantity and weighted-average cost.
 *
 * <p>Each {@code apply*} call validates first and mutates afterwards, so a refused fill leaves the ledger
 * untouched. Not thread-safe; owners serialize access.
 */
public class Ledger {

    private final double initialCapital;
    private final Map<String, LedgerPosition> positions = new LinkedHashMap<>();
    private double cash;

    public Ledger(double initialCapital) {
        if (!Double.isFinite(initialCapital) || initialCapital < 0.0) {
            throw new TradingException(ErrorCode.INVALID_PARAMETER, "initial capital must be finite and >= 0");
        }
        this.initialCapital = initialCapital;
        this.cash = initialCapital;
    }

    public double initialCapital() {
        return initialCapital;
    }

    public double cash() {
        return cash;
    }

    public long quantity(String symbol) {
        LedgerPosition position = positions.get(symbol);
        return position == null ? 0L : position.getQuantity();
    }

    public Position position(String symbol) {
        LedgerPosition position = positions.get(symbol);
        return position == null ? Position.flat(symbol) : position.toPosition();
    }

    public List<Position> openPositions() {
        List<Position> open = new ArrayList<>();
        for (LedgerPosition position : positions.values()) {
            if (position.getQuantity() > 0) {
                open.add(position.toPosition());
            }
        }
        return open;
    }

    public boolean canAfford(ExecutionFill fill) {
        return fill.totalCost() <= cash;
    }

    /**
     * Throws the exception {@link #applyBuy} or {@link #applySell} would throw for {@code fill}, without
     * touching the ledger.
     */
    public void checkFill(String symbol, ExecutionFill fill) {
        if (fill != null && fill.side() == OrderSide.SELL) {
            checkSell(symbol, fill);
        } else {
            checkBuy(symbol, fill);
        }
    }

    public void applyBuy(String symbol, ExecutionFill fill) {
        checkBuy(symbol, fill);

        cash -= fill.totalCost();
        positions.computeIfAbsent(symbol, LedgerPosition::new).add(fill.quantity(), fill.grossAmount());
    }

    /**
     * Applies a sell and returns its gross profit, {@code grossAmount - quantity * averageCost}.
     */
    public double applySell(String symbol, ExecutionFill fill) {
        checkSell(symbol, fill);

        LedgerPosition position = positions.get(symbol);
        double profit = fill.grossAmount() - fill.quantity() * position.getAverageCost();
        cash += fill.netProceeds();
        position.reduce(fill.quantity());
        return profit;
    }

    /**
     * Flattens a holding at {@code price} without fees and returns the gross revenue.
     */
    public double liquidate(String symbol, double price) {
        LedgerPosition position = positions.get(symbol);
        if (position == null || position.getQuantity() <= 0) {
            return 0.0;
        }
        double revenue = position.getQuantity() * price;
        cash += revenue;
        position.clear();
        return revenue;
    }

    public double positionValue(Map<String, Double> prices) {
        double value = 0.0;
        for (LedgerPosition position : positions.values()) {
            if (position.getQuantity() <= 0) {
                continue;
            }
            Double price = prices.get(position.getSymbol());
            if (price != null) {
                value += position.getQuantity() * price;
            }
        }
        return value;
    }

    public void reset() {
        positions.clear();
        cash = initialCapital;
    }

    private void checkBuy(String symbol, ExecutionFill fill) {
        requireSide(fill, OrderSide.BUY);
        if (fill.isEmpty()) {
            throw new TradingException(ErrorCode.INVALID_ORDER, "buy fill for " + symbol + " has no quantity");
        }
        if (!canAfford(fill)) {
            throw new TradingException(
                    ErrorCode.INSUFFICIENT_FUNDS,
                    "insufficient funds for " + symbol + ": required=" + fill.totalCost() + ", cash=" + cash
            );
        }
    }

    private void checkSell(String symbol, ExecutionFill fill) {
        requireSide(fill, OrderSide.SELL);
        if (fill.isEmpty()) {
            throw new TradingException(ErrorCode.INVALID_ORDER, "sell fill for " + symbol + " has no quantity");
        }
        long held = quantity(symbol);
        if (held < fill.quantity()) {
            throw new TradingException(
                    ErrorCode.INSUFFICIENT_POSITION,
                    "insufficient position for " + symbol + ": requested=" + fill.quantity() + ", held=" + held
            );
        }
    }

    private void requireSide(ExecutionFill fill, OrderSide expected) {
        if (fill == null || fill.side() != expected) {
            throw new TradingException(ErrorCode.INVALID_ORDER, "expected a " + expected + " fill");
        }
    }
}
