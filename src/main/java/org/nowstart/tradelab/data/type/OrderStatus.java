package org.nowstart.tradelab.data.type;

import java.util.EnumSet;
import java.util.Set;

public enum OrderStatus {
    PENDING,
    SUBMITTED,
    PARTIAL_FILLED,
    FILLED,
    CANCELLED,
    REJECTED;

    private static final Set<OrderStatus> ACTIVE = EnumSet.of(PENDING, SUBMITTED, PARTIAL_FILLED);

    public boolean isActive() {
        return ACTIVE.contains(this);
    }
}
