package org.nowstart.tradelab.data.exception;

public enum ErrorCode {
    EMPTY_DATA("empty_data"),
    INVALID_DATA("invalid_data"),
    INVALID_PARAMETER("invalid_parameter"),
    INSUFFICIENT_FUNDS("insufficient_funds"),
    INSUFFICIENT_POSITION("insufficient_position"),
    INVALID_ORDER("invalid_order");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
