package org.nowstart.tradelab.service.order;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.nowstart.tradelab.data.dto.OrderStatistics;
import org.nowstart.tradelab.data.type.OrderSide;
import org.nowstart.tradelab.data.type.OrderStatus;
import org.nowstart.tradelab.data.type.OrderType;

class OrderManagerTest {

    private OrderManager orderManager;

    @BeforeEach
    void setUp() {
        orderManager = new OrderManager();
    }

    @Test
    void createOrder_registersInPendingBucket() {
        Order order = orderManager.createLimitOrder("600000", OrderSide.BUY, 100, 9.5, "ma-cross");

        assertThat(order.getType()).isEqualTo(OrderType.LIMIT);
        assertThat(orderManager.getOrder(order.getId())).containsSame(order);
        assertThat(orderManager.getPendingOrders()).containsExactly(order);
        assertThat(orderManager.getActiveOrders()).isEmpty();
    }

    @Test
    void lifecycle_movesOrderThroughBuckets() {
        Order order = orderManager.createMarketOrder("600000", OrderSide.BUY, 1000, null);

        assertThat(orderManager.submitOrder(order.getId())).isTrue();
        assertThat(orderManager.getPendingOrders()).isEmpty();
        assertThat(orderManager.getActiveOrders()).containsExactly(order);

        assertThat(orderManager.fillOrder(order.getId(), 300, 10.0, 5.0)).isTrue();
        assertThat(orderManager.getActiveOrders()).containsExactly(order);

        assertThat(orderManager.fillOrder(order.getId(), 700, 10.0, 5.0)).isTrue();
        assertThat(orderManager.getActiveOrders()).isEmpty();
        assertThat(orderManager.getCompletedOrders()).containsExactly(order);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.FILLED);
    }

    @Test
    void fillOrder_refusesUnknownOrPendingOrders() {
        Order order = orderManager.createMarketOrder("600000", OrderSide.BUY, 100, null);

        assertThat(orderManager.fillOrder("missing", 100, 10.0, 0.0)).isFalse();
        assertThat(orderManager.fillOrder(order.getId(), 100, 10.0, 0.0)).isFalse();
        assertThat(orderManager.getPendingOrders()).containsExactly(order);
    }

    @Test
    void rejectOrder_completesPendingOrder() {
        Order order = orderManager.createMarketOrder("600000", OrderSide.BUY, 150, null);

        assertThat(orderManager.rejectOrder(order.getId(), "not a lot multiple")).isTrue();

        assertThat(orderManager.getCompletedOrders()).containsExactly(order);
        assertThat(orderManager.getOrdersByStatus(OrderStatus.REJECTED)).containsExactly(order);
        assertThat(orderManager.rejectOrder(order.getId(), "again")).isFalse();
    }

    @Test
    void cancelAllOrders_restrictsToSymbol() {
        Order a1 = orderManager.createMarketOrder("A", OrderSide.BUY, 100, null);
        Order a2 = orderManager.createMarketOrder("A", OrderSide.SELL, 100, null);
        Order b = orderManager.createMarketOrder("B", OrderSide.BUY, 100, null);
        orderManager.submitOrder(a2.getId());

        assertThat(orderManager.cancelAllOrders("A")).isEqualTo(2);

        assertThat(a1.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(a2.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(b.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(orderManager.cancelAllOrders(null)).isEqualTo(1);
    }

    @Test
    void queries_filterBySymbolAndStrategy() {
        Order a = orderManager.createMarketOrder("A", OrderSide.BUY, 100, "ma-cross");
        Order b = orderManager.createStopOrder("B", OrderSide.SELL, 100, 9.0, "rsi-threshold");
        Order c = orderManager.createStopLimitOrder("A", OrderSide.BUY, 100, 11.2, 11.0, "rsi-threshold");

        assertThat(orderManager.getOrdersBySymbol("A")).containsExactly(a, c);
        assertThat(orderManager.getOrdersByStrategy("rsi-threshold")).containsExactly(b, c);
        assertThat(orderManager.getAllOrders()).containsExactly(a, b, c);
    }

    @Test
    void getOrderStatistics_countsEachBucketAndOutcome() {
        Order filled = orderManager.createMarketOrder("A", OrderSide.BUY, 100, null);
        orderManager.submitOrder(filled.getId());
        orderManager.fillOrder(filled.getId(), 100, 10.0, 5.0);
        Order cancelled = orderManager.createMarketOrder("A", OrderSide.BUY, 100, null);
        orderManager.cancelOrder(cancelled.getId(), "user");
        Order rejected = orderManager.createMarketOrder("A", OrderSide.BUY, 100, null);
        orderManager.rejectOrder(rejected.getId(), "risk");
        Order active = orderManager.createMarketOrder("A", OrderSide.BUY, 100, null);
        orderManager.submitOrder(active.getId());
        orderManager.createMarketOrder("A", OrderSide.BUY, 100, null);

        OrderStatistics statistics = orderManager.getOrderStatistics();

        assertThat(statistics).isEqualTo(new OrderStatistics(5, 1, 1, 3, 1, 1, 1));
    }

    @Test
    void clearCompletedOrders_keepsLiveOrders() {
        Order done = orderManager.createMarketOrder("A", OrderSide.BUY, 100, null);
        orderManager.cancelOrder(done.getId(), "user");
        Order live = orderManager.createMarketOrder("A", OrderSide.BUY, 100, null);

        orderManager.clearCompletedOrders();

        assertThat(orderManager.getOrder(done.getId())).isEmpty();
        assertThat(orderManager.getAllOrders()).containsExactly(live);
        assertThat(orderManager.getCompletedOrders()).isEmpty();
    }

    @Test
    void reset_dropsEverything() {
        orderManager.createMarketOrder("A", OrderSide.BUY, 100, null);

        orderManager.reset();

        assertThat(orderManager.getAllOrders()).isEmpty();
        assertThat(orderManager.getOrderStatistics().totalOrders()).isZero();
    }
}
