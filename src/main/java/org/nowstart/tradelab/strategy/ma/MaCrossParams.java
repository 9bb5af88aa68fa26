package org.nowstart.tradelab.strategy.ma;

import jakarta.validation.constraints.Positive;
import org.nowstart.tradelab.data.exception.ErrorCode;
import org.nowstart.tradelab.data.exception.TradingException;
import org.nowstart.tradelab.strategy.core.StrategyParams;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "tradelab.strategy.ma-cross")
public record MaCrossParams(
        @Positive @DefaultValue("5") int fastPeriod,
        @Positive @DefaultValue("20") int slowPeriod
) implements StrategyParams {

    public MaCrossParams {
        if (fastPeriod <= 0 || slowPeriod <= 0) {
            throw new TradingException(ErrorCode.INVALID_PARAMETER, "moving average periods must be > 0");
        }
        if (fastPeriod >= slowPeriod) {
            throw new TradingException(
                    ErrorCode.INVALID_PARAMETER,
                    "fastPeriod must be < slowPeriod, fast=" + fastPeriod + ", slow=" + slowPeriod
            );
        }
    }

    public static MaCrossParams defaults() {
        return new MaCrossParams(5, 20);
    }
}
