package org.nowstart.tradelab.data.type;

public enum OrderSide {
    BUY,
    SELL
}
