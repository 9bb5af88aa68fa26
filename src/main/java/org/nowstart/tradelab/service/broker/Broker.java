package org.nowstart.tradelab.service.broker;

import java.util.List;
import java.util.Optional;
import org.nowstart.tradelab.data.dto.AccountSnapshot;
import org.nowstart.tradelab.data.dto.BrokerTrade;
import org.nowstart.tradelab.data.dto.PositionView;
import org.nowstart.tradelab.data.type.OrderStatus;

/**
 * Execution venue seen by order-driven callers. Orders are created through the order manager and handed to
 * the broker by id.
 */
public interface Broker {

    boolean connect();

    boolean disconnect();

    boolean isConnected();

    boolean submitOrder(String orderId);

    boolean cancelOrder(String orderId);

    Optional<OrderStatus> getOrderStatus(String orderId);

    List<PositionView> getPositions();

    AccountSnapshot getAccount();

    List<BrokerTrade> getTrades();
}
