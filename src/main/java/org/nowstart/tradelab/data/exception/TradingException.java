package org.nowstart.tradelab.data.exception;

import lombok.Getter;

@Getter
public class TradingException extends RuntimeException {

    private final ErrorCode errorCode;

    public TradingException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getCode() {
        return errorCode.code();
    }
}
