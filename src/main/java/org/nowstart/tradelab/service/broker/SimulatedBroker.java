package org.nowstart.tradelab.service.broker;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tradelab.data.dto.AccountSnapshot;
import org.nowstart.tradelab.data.dto.BrokerTrade;
import org.nowstart.tradelab.data.dto.PositionView;
import org.nowstart.tradelab.data.exception.ErrorCode;
import org.nowstart.tradelab.data.exception.TradingException;
import org.nowstart.tradelab.data.type.OrderSide;
import org.nowstart.tradelab.data.type.OrderStatus;
import org.nowstart.tradelab.data.type.OrderType;
import org.nowstart.tradelab.service.execution.ExecutionFill;
import org.nowstart.tradelab.service.execution.FrictionModel;
import org.nowstart.tradelab.service.order.Order;
import org.nowstart.tradelab.service.order.OrderManager;
import org.nowstart.tradelab.service.risk.PositionManager;
import org.springframework.stereotype.Service;

/**
 * In-process broker that fills orders against caller-supplied prices.
 *
 * <p>Pricing goes through the same {@link FrictionModel} as the backtest engine. Orders are validated when
 * submitted: a quantity that is not a whole number of lots, a buy the cash cannot cover or a sell larger
 * than the holding rejects the order and raises a {@link TradingException}. A fill that no longer fits the
 * ledger when executed cancels the order and raises.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SimulatedBroker implements Broker {

    private final OrderManager orderManager;
    private final PositionManager positionManager;
    private final FrictionModel frictionModel;

    private final List<BrokerTrade> trades = new ArrayList<>();
    private volatile boolean connected;

    @Override
    public boolean connect() {
        connected = true;
        log.info("event=broker_connected broker=simulated");
        return true;
    }

    @Override
    public boolean disconnect() {
        connected = false;
        log.info("event=broker_disconnected broker=simulated");
        return true;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public synchronized boolean submitOrder(String orderId) {
        Order order = requireOrder(orderId);
        if (!connected) {
            log.warn("event=order_submit_skipped order_id={} reason=not_connected", orderId);
            return false;
        }
        if (order.getStatus() != OrderStatus.PENDING) {
            return false;
        }

        validatePreTrade(order);
        return orderManager.submitOrder(orderId);
    }

    @Override
    public synchronized boolean cancelOrder(String orderId) {
        return orderManager.cancelOrder(orderId, "cancelled by user");
    }

    @Override
    public Optional<OrderStatus> getOrderStatus(String orderId) {
        return orderManager.getOrder(orderId).map(Order::getStatus);
    }

    @Override
    public List<PositionView> getPositions() {
        return positionManager.getAllPositions();
    }

    @Override
    public AccountSnapshot getAccount() {
        double cash = positionManager.getCash();
        double positionValue = positionManager.getTotalPositionValue();
        return new AccountSnapshot(positionManager.getInitialCapital(), cash, positionValue, cash + positionValue);
    }

    @Override
    public synchronized List<BrokerTrade> getTrades() {
        return List.copyOf(trades);
    }

    public void updateMarketPrice(String symbol, double price) {
        positionManager.updateCurrentPrices(Map.of(symbol, price));
    }

    public boolean executeOrder(String orderId, double currentPrice) {
        return executeOrder(orderId, currentPrice, Long.MAX_VALUE);
    }

    /**
     * Tries to fill up to {@code maxQuantity} shares (lot-rounded) of a submitted order at {@code currentPrice}.
     *
     * <p>The status check, the order transition and the ledger booking run while holding the order manager and
     * the position manager, so a concurrent cancel or fill lands either before or after the whole execution.
     *
     * @return {@code true} when a fill was booked, {@code false} when the order is not live, the broker is
     * disconnected, a stop has not triggered or a limit is not marketable
     */
    public synchronized boolean executeOrder(String orderId, double currentPrice, long maxQuantity) {
        Order order = requireOrder(orderId);
        if (!Double.isFinite(currentPrice) || currentPrice <= 0.0) {
            throw new TradingException(ErrorCode.INVALID_PARAMETER, "current price must be finite and > 0");
        }
        if (!connected) {
            log.warn("event=order_execute_skipped order_id={} reason=not_connected", orderId);
            return false;
        }

        synchronized (orderManager) {
            synchronized (positionManager) {
                return executeLocked(order, currentPrice, maxQuantity);
            }
        }
    }

    private boolean executeLocked(Order order, double currentPrice, long maxQuantity) {
        String orderId = order.getId();
        if (order.getStatus() != OrderStatus.SUBMITTED && order.getStatus() != OrderStatus.PARTIAL_FILLED) {
            return false;
        }

        OptionalDouble executionPrice = executionPrice(order, currentPrice);
        if (executionPrice.isEmpty()) {
            log.debug("event=order_not_triggered order_id={} type={} current_price={}", orderId, order.getType(), currentPrice);
            return false;
        }

        long quantity = frictionModel.roundToLot(Math.min(order.unfilledQuantity(), maxQuantity));
        if (quantity <= 0) {
            return false;
        }

        ExecutionFill fill = frictionModel.quoteAtPrice(order.getSide(), quantity, executionPrice.getAsDouble());
        try {
            positionManager.checkFill(order.getSymbol(), fill);
        } catch (TradingException e) {
            orderManager.cancelOrder(orderId, e.getMessage());
            log.warn("event=order_execution_failed order_id={} code={} reason={}", orderId, e.getCode(), e.getMessage());
            throw e;
        }

        if (!orderManager.fillOrder(orderId, fill.quantity(), fill.effectivePrice(), fill.fees())) {
            log.warn("event=order_execution_skipped order_id={} status={}", orderId, order.getStatus());
            return false;
        }
        Double profit = positionManager.applyFill(order.getSymbol(), fill);
        trades.add(new BrokerTrade(
                orderId,
                order.getSymbol(),
                order.getSide(),
                fill.effectivePrice(),
                fill.quantity(),
                fill.grossAmount(),
                fill.commission(),
                fill.stampDuty(),
                profit,
                Instant.now()
        ));
        return true;
    }

    public synchronized void reset() {
        orderManager.reset();
        positionManager.reset();
        trades.clear();
    }

    private void validatePreTrade(Order order) {
        if (!frictionModel.isLotMultiple(order.getQuantity())) {
            reject(order, ErrorCode.INVALID_ORDER,
                    "quantity " + order.getQuantity() + " is not a multiple of lot size " + frictionModel.lotSize());
        }

        if (order.isSell()) {
            long held = positionManager.getPositionQuantity(order.getSymbol());
            if (held < order.getQuantity()) {
                reject(order, ErrorCode.INSUFFICIENT_POSITION,
                        "insufficient position for " + order.getSymbol() + ": requested=" + order.getQuantity() + ", held=" + held);
            }
            return;
        }

        OptionalDouble reference = referencePrice(order);
        if (reference.isEmpty()) {
            // market buy without a known price; funds are checked when it fills
            return;
        }
        ExecutionFill estimate = frictionModel.quoteAtPrice(OrderSide.BUY, order.getQuantity(), reference.getAsDouble());
        double cash = positionManager.getCash();
        if (estimate.totalCost() > cash) {
            reject(order, ErrorCode.INSUFFICIENT_FUNDS,
                    "insufficient funds for " + order.getSymbol() + ": required=" + estimate.totalCost() + ", cash=" + cash);
        }
    }

    private OptionalDouble referencePrice(Order order) {
        if (order.getType() == OrderType.LIMIT || order.getType() == OrderType.STOP_LIMIT) {
            return OptionalDouble.of(order.getPrice());
        }
        if (order.getType() == OrderType.STOP) {
            return OptionalDouble.of(frictionModel.effectivePrice(OrderSide.BUY, order.getStopPrice()));
        }
        return positionManager.getLastPrice(order.getSymbol())
                .map(price -> OptionalDouble.of(frictionModel.effectivePrice(OrderSide.BUY, price)))
                .orElse(OptionalDouble.empty());
    }

    private OptionalDouble executionPrice(Order order, double currentPrice) {
        return switch (order.getType()) {
            case MARKET -> OptionalDouble.of(frictionModel.effectivePrice(order.getSide(), currentPrice));
            case LIMIT -> limitPrice(order, currentPrice);
            case STOP -> stopTriggered(order, currentPrice)
                    ? OptionalDouble.of(frictionModel.effectivePrice(order.getSide(), currentPrice))
                    : OptionalDouble.empty();
            case STOP_LIMIT -> stopTriggered(order, currentPrice) ? limitPrice(order, currentPrice) : OptionalDouble.empty();
        };
    }

    private OptionalDouble limitPrice(Order order, double currentPrice) {
        double limit = order.getPrice();
        boolean marketable = order.isBuy() ? limit >= currentPrice : limit <= currentPrice;
        return marketable ? OptionalDouble.of(limit) : OptionalDouble.empty();
    }

    private boolean stopTriggered(Order order, double currentPrice) {
        double stop = order.getStopPrice();
        return order.isBuy() ? currentPrice >= stop : currentPrice <= stop;
    }

    private void reject(Order order, ErrorCode code, String reason) {
        orderManager.rejectOrder(order.getId(), reason);
        throw new TradingException(code, reason);
    }

    private Order requireOrder(String orderId) {
        return orderManager.getOrder(orderId)
                .orElseThrow(() -> new TradingException(ErrorCode.INVALID_ORDER, "unknown order id=" + orderId));
    }
}
