package org.nowstart.tradelab.strategy.rsi;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.nowstart.tradelab.data.exception.ErrorCode;
import org.nowstart.tradelab.data.exception.TradingException;
import org.nowstart.tradelab.strategy.core.StrategyParams;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "tradelab.strategy.rsi-threshold")
public record RsiThresholdParams(
        @Positive @DefaultValue("14") int period,
        @DecimalMin(value = "0", inclusive = false) @DecimalMax(value = "100", inclusive = false)
        @DefaultValue("30") double oversold,
        @DecimalMin(value = "0", inclusive = false) @DecimalMax(value = "100", inclusive = false)
        @DefaultValue("70") double overbought
) implements StrategyParams {

    public RsiThresholdParams {
        if (period <= 0) {
            throw new TradingException(ErrorCode.INVALID_PARAMETER, "RSI period must be > 0");
        }
        if (oversold <= 0.0 || overbought >= 100.0) {
            throw new TradingException(ErrorCode.INVALID_PARAMETER, "RSI thresholds must lie in (0, 100)");
        }
        if (oversold >= overbought) {
            throw new TradingException(
                    ErrorCode.INVALID_PARAMETER,
                    "oversold must be < overbought, oversold=" + oversold + ", overbought=" + overbought
            );
        }
    }

    public static RsiThresholdParams defaults() {
        return new RsiThresholdParams(14, 30.0, 70.0);
    }
}
