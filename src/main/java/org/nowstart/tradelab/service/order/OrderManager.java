package org.nowstart.tradelab.service.order;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tradelab.data.dto.OrderStatistics;
import org.nowstart.tradelab.data.dto.SignalAttribute;
import org.nowstart.tradelab.data.type.OrderSide;
import org.nowstart.tradelab.data.type.OrderStatus;
import org.nowstart.tradelab.data.type.OrderType;
import org.springframework.stereotype.Service;

/**
 * Registry of orders with pending / active / completed id buckets.
 *
 * <p>An order id lives in exactly one bucket: pending while PENDING, active while SUBMITTED or PARTIAL_FILLED,
 * completed once terminal. All methods are synchronized on the manager.
 */
@Slf4j
@Service
public class OrderManager {

    private final Map<String, Order> orders = new LinkedHashMap<>();
    private final Set<String> pendingIds = new LinkedHashSet<>();
    private final Set<String> activeIds = new LinkedHashSet<>();
    private final Set<String> completedIds = new LinkedHashSet<>();

    public synchronized Order createOrder(
            String symbol,
            OrderSide side,
            long quantity,
            OrderType type,
            Double price,
            Double stopPrice,
            String strategyId,
            Map<String, SignalAttribute> attributes
    ) {
        Order order = Order.create(symbol, side, quantity, type, price, stopPrice, strategyId, attributes);
        orders.put(order.getId(), order);
        pendingIds.add(order.getId());
        log.info(
                "event=order_created order_id={} symbol={} side={} type={} quantity={} price={} stop_price={} strategy={}",
                order.getId(),
                order.getSymbol(),
                side,
                type,
                quantity,
                price,
                stopPrice,
                strategyId
        );
        return order;
    }

    public Order createMarketOrder(String symbol, OrderSide side, long quantity, String strategyId) {
        return createOrder(symbol, side, quantity, OrderType.MARKET, null, null, strategyId, null);
    }

    public Order createLimitOrder(String symbol, OrderSide side, long quantity, double price, String strategyId) {
        return createOrder(symbol, side, quantity, OrderType.LIMIT, price, null, strategyId, null);
    }

    public Order createStopOrder(String symbol, OrderSide side, long quantity, double stopPrice, String strategyId) {
        return createOrder(symbol, side, quantity, OrderType.STOP, null, stopPrice, strategyId, null);
    }

    public Order createStopLimitOrder(
            String symbol,
            OrderSide side,
            long quantity,
            double price,
            double stopPrice,
            String strategyId
    ) {
        return createOrder(symbol, side, quantity, OrderType.STOP_LIMIT, price, stopPrice, strategyId, null);
    }

    public synchronized Optional<Order> getOrder(String orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    public synchronized List<Order> getAllOrders() {
        return new ArrayList<>(orders.values());
    }

    public synchronized List<Order> getPendingOrders() {
        return collect(pendingIds);
    }

    public synchronized List<Order> getActiveOrders() {
        return collect(activeIds);
    }

    public synchronized List<Order> getCompletedOrders() {
        return collect(completedIds);
    }

    public synchronized List<Order> getOrdersBySymbol(String symbol) {
        return orders.values().stream().filter(order -> order.getSymbol().equals(symbol)).toList();
    }

    public synchronized List<Order> getOrdersByStrategy(String strategyId) {
        return orders.values().stream().filter(order -> Objects.equals(order.getStrategyId(), strategyId)).toList();
    }

    public synchronized List<Order> getOrdersByStatus(OrderStatus status) {
        return orders.values().stream().filter(order -> order.getStatus() == status).toList();
    }

    public synchronized boolean submitOrder(String orderId) {
        Order order = orders.get(orderId);
        if (order == null || !order.submit()) {
            return false;
        }
        pendingIds.remove(orderId);
        activeIds.add(orderId);
        log.info("event=order_submitted order_id={} symbol={}", orderId, order.getSymbol());
        return true;
    }

    public synchronized boolean fillOrder(String orderId, long quantity, double price, double commission) {
        Order order = orders.get(orderId);
        if (order == null || !order.fill(quantity, price, commission)) {
            log.warn("event=order_fill_refused order_id={} quantity={} price={}", orderId, quantity, price);
            return false;
        }
        if (order.isFilled()) {
            activeIds.remove(orderId);
            completedIds.add(orderId);
        }
        log.info(
                "event=order_filled order_id={} status={} fill_quantity={} fill_price={} filled_quantity={} vwap={}",
                orderId,
                order.getStatus(),
                quantity,
                price,
                order.getFilledQuantity(),
                order.getFilledPrice()
        );
        return true;
    }

    public synchronized boolean cancelOrder(String orderId, String reason) {
        Order order = orders.get(orderId);
        if (order == null || !order.cancel(reason)) {
            return false;
        }
        pendingIds.remove(orderId);
        activeIds.remove(orderId);
        completedIds.add(orderId);
        log.info("event=order_cancelled order_id={} reason={}", orderId, reason);
        return true;
    }

    public synchronized boolean rejectOrder(String orderId, String reason) {
        Order order = orders.get(orderId);
        if (order == null || !order.reject(reason)) {
            return false;
        }
        pendingIds.remove(orderId);
        completedIds.add(orderId);
        log.warn("event=order_rejected order_id={} reason={}", orderId, reason);
        return true;
    }

    /**
     * Cancels every pending or active order, optionally restricted to one symbol, and returns how many were
     * cancelled.
     */
    public synchronized int cancelAllOrders(String symbol) {
        List<Order> candidates = new ArrayList<>(collect(pendingIds));
        candidates.addAll(collect(activeIds));
        int cancelled = 0;
        for (Order order : candidates) {
            if (symbol != null && !order.getSymbol().equals(symbol)) {
                continue;
            }
            if (cancelOrder(order.getId(), "bulk cancel")) {
                cancelled++;
            }
        }
        return cancelled;
    }

    public synchronized OrderStatistics getOrderStatistics() {
        int filled = 0;
        int cancelled = 0;
        int rejected = 0;
        for (Order order : orders.values()) {
            switch (order.getStatus()) {
                case FILLED -> filled++;
                case CANCELLED -> cancelled++;
                case REJECTED -> rejected++;
                default -> {
                }
            }
        }
        return new OrderStatistics(
                orders.size(),
                pendingIds.size(),
                activeIds.size(),
                completedIds.size(),
                filled,
                cancelled,
                rejected
        );
    }

    public synchronized void clearCompletedOrders() {
        for (String orderId : completedIds) {
            orders.remove(orderId);
        }
        completedIds.clear();
    }

    public synchronized void reset() {
        orders.clear();
        pendingIds.clear();
        activeIds.clear();
        completedIds.clear();
    }

    private List<Order> collect(Set<String> ids) {
        List<Order> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            Order order = orders.get(id);
            if (order != null) {
                out.add(order);
            }
        }
        return out;
    }
}
