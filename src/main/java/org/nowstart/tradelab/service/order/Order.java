package org.nowstart.tradelab.service.order;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.Getter;
import org.nowstart.tradelab.data.dto.SignalAttribute;
import org.nowstart.tradelab.data.exception.ErrorCode;
import org.nowstart.tradelab.data.exception.TradingException;
import org.nowstart.tradelab.data.type.OrderSide;
import org.nowstart.tradelab.data.type.OrderStatus;
import org.nowstart.tradelab.data.type.OrderType;

/**
 * Order with an explicit lifecycle.
 *
 * <pre>
 * PENDING -> SUBMITTED -> PARTIAL_FILLED* -> FILLED
 * PENDING | SUBMITTED | PARTIAL_FILLED -> CANCELLED
 * PENDING -> REJECTED
 * </pre>
 *
 * <p>Each transition is a compare-and-transition under the order's monitor and returns {@code false} when the
 * current status does not allow it. Terminal states are final. Transitions are driven by {@link OrderManager} so
 * its id buckets stay in step with the status.
 */
@Getter
public class Order {

    private final String id;
    private final String symbol;
    private final OrderSide side;
    private final long quantity;
    private final OrderType type;
    private final Double price;
    private final Double stopPrice;
    private final String strategyId;
    private final Instant createdAt;
    private final Map<String, SignalAttribute> attributes;

    private volatile OrderStatus status = OrderStatus.PENDING;
    private volatile long filledQuantity;
    private volatile double filledPrice;
    private volatile double commission;
    private volatile Instant updatedAt;
    private volatile String message = "";

    private Order(
            String symbol,
            OrderSide side,
            long quantity,
            OrderType type,
            Double price,
            Double stopPrice,
            String strategyId,
            Map<String, SignalAttribute> attributes
    ) {
        this.id = UUID.randomUUID().toString();
        this.symbol = symbol;
        this.side = side;
        this.quantity = quantity;
        this.type = type;
        this.price = price;
        this.stopPrice = stopPrice;
        this.strategyId = strategyId;
        this.attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }

    public static Order create(
            String symbol,
            OrderSide side,
            long quantity,
            OrderType type,
            Double price,
            Double stopPrice,
            String strategyId,
            Map<String, SignalAttribute> attributes
    ) {
        if (symbol == null || symbol.isBlank()) {
            throw new TradingException(ErrorCode.INVALID_ORDER, "order symbol is required");
        }
        if (side == null || type == null) {
            throw new TradingException(ErrorCode.INVALID_ORDER, "order side and type are required");
        }
        if (quantity <= 0) {
            throw new TradingException(ErrorCode.INVALID_ORDER, "order quantity must be > 0");
        }
        if ((type == OrderType.LIMIT || type == OrderType.STOP_LIMIT) && !isPositive(price)) {
            throw new TradingException(ErrorCode.INVALID_ORDER, type + " order requires a limit price > 0");
        }
        if ((type == OrderType.STOP || type == OrderType.STOP_LIMIT) && !isPositive(stopPrice)) {
            throw new TradingException(ErrorCode.INVALID_ORDER, type + " order requires a stop price > 0");
        }
        return new Order(symbol.trim(), side, quantity, type, price, stopPrice, strategyId, attributes);
    }

    synchronized boolean submit() {
        if (status != OrderStatus.PENDING) {
            return false;
        }
        transition(OrderStatus.SUBMITTED);
        return true;
    }

    /**
     * Applies a (partial) fill and recomputes the volume-weighted fill price. Fills that would exceed the
     * order quantity are refused.
     */
    synchronized boolean fill(long shares, double executionPrice, double fee) {
        if (status != OrderStatus.SUBMITTED && status != OrderStatus.PARTIAL_FILLED) {
            return false;
        }
        if (shares <= 0 || shares > quantity - filledQuantity) {
            return false;
        }
        if (!Double.isFinite(executionPrice) || executionPrice <= 0.0 || fee < 0.0) {
            return false;
        }

        long total = filledQuantity + shares;
        filledPrice = (filledPrice * filledQuantity + executionPrice * shares) / total;
        filledQuantity = total;
        commission += fee;
        transition(total == quantity ? OrderStatus.FILLED : OrderStatus.PARTIAL_FILLED);
        return true;
    }

    synchronized boolean cancel(String reason) {
        if (!status.isActive()) {
            return false;
        }
        message = reason == null ? "" : reason;
        transition(OrderStatus.CANCELLED);
        return true;
    }

    synchronized boolean reject(String reason) {
        if (status != OrderStatus.PENDING) {
            return false;
        }
        message = reason == null ? "" : reason;
        transition(OrderStatus.REJECTED);
        return true;
    }

    public boolean isBuy() {
        return side == OrderSide.BUY;
    }

    public boolean isSell() {
        return side == OrderSide.SELL;
    }

    public boolean isActive() {
        return status.isActive();
    }

    public boolean isFilled() {
        return status == OrderStatus.FILLED;
    }

    public long unfilledQuantity() {
        return quantity - filledQuantity;
    }

    public double filledAmount() {
        return filledQuantity * filledPrice;
    }

    @Override
    public String toString() {
        return "Order(" + id + ", " + symbol + ", " + side + ", " + quantity + "@" + price + ", " + status + ")";
    }

    private void transition(OrderStatus next) {
        status = next;
        updatedAt = Instant.now();
    }

    private static boolean isPositive(Double value) {
        return value != null && Double.isFinite(value) && value > 0.0;
    }
}
