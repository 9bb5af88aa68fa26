package org.nowstart.tradelab.strategy.macd;

import jakarta.validation.constraints.Positive;
import org.nowstart.tradelab.data.exception.ErrorCode;
import org.nowstart.tradelab.data.exception.TradingException;
import org.nowstart.tradelab.strategy.core.StrategyParams;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "tradelab.strategy.macd-cross")
public record MacdCrossParams(
        @Positive @DefaultValue("12") int fastPeriod,
        @Positive @DefaultValue("26") int slowPeriod,
        @Positive @DefaultValue("9") int signalPeriod
) implements StrategyParams {

    public MacdCrossParams {
        if (fastPeriod <= 0 || slowPeriod <= 0 || signalPeriod <= 0) {
            throw new TradingException(ErrorCode.INVALID_PARAMETER, "MACD periods must be > 0");
        }
        if (fastPeriod >= slowPeriod) {
            throw new TradingException(
                    ErrorCode.INVALID_PARAMETER,
                    "fastPeriod must be < slowPeriod, fast=" + fastPeriod + ", slow=" + slowPeriod
            );
        }
    }

    public static MacdCrossParams defaults() {
        return new MacdCrossParams(12, 26, 9);
    }
}
