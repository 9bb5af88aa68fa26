package org.nowstart.tradelab.data.dto;

public record OrderStatistics(
        int totalOrders,
        int pendingOrders,
        int activeOrders,
        int completedOrders,
        int filledOrders,
        int cancelledOrders,
        int rejectedOrders
) {
}
