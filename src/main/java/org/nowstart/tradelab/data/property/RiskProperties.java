package org.nowstart.tradelab.data.property;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "tradelab.risk")
public record RiskProperties(
        // invested value / total value ceiling
        @DecimalMin("0") @DecimalMax("1") @DefaultValue("0.8") double maxPositionRatio,
        // single stock value / total value ceiling
        @DecimalMin("0") @DecimalMax("1") @DefaultValue("0.2") double maxSingleStockRatio,
        // intraday loss ceiling relative to the day's starting value
        @DecimalMin("0") @DecimalMax("1") @DefaultValue("0.05") double maxDailyLossRatio,
        // peak-to-current decline ceiling
        @DecimalMin("0") @DecimalMax("1") @DefaultValue("0.15") double maxDrawdownRatio,
        // loss versus average cost that triggers a stop
        @DecimalMin("0") @DefaultValue("0.08") double stopLossRatio,
        // gain versus average cost that triggers profit taking
        @DecimalMin("0") @DefaultValue("0.15") double takeProfitRatio
) {

    public RiskProperties {
        if (maxPositionRatio < 0.0 || maxSingleStockRatio < 0.0 || maxDailyLossRatio < 0.0 || maxDrawdownRatio < 0.0) {
            throw new IllegalArgumentException("risk ratios must be >= 0");
        }
        if (stopLossRatio < 0.0 || takeProfitRatio < 0.0) {
            throw new IllegalArgumentException("stop-loss/take-profit ratios must be >= 0");
        }
    }

    public static RiskProperties defaults() {
        return new RiskProperties(0.8, 0.2, 0.05, 0.15, 0.08, 0.15);
    }
}
