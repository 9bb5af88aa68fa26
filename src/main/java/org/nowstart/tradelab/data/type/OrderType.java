package org.nowstart.tradelab.data.type;

public enum OrderType {
    MARKET,
    LIMIT,
    STOP,
    STOP_LIMIT
}
