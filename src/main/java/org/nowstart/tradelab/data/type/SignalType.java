package org.nowstart.tradelab.data.type;

public enum SignalType {
    HOLD,
    BUY,
    SELL,
    CLOSE_LONG,
    CLOSE_SHORT
}
