package org.nowstart.tradelab.data.property;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "tradelab.execution")
public record ExecutionProperties(
        // starting cash of every backtest run and of the simulated broker
        @Positive @DefaultValue("1000000") double initialCapital,
        // commission rate applied to both sides (e.g. 0.0003 = 0.03%)
        @DecimalMin("0") @DecimalMax("1") @DefaultValue("0.0003") double commissionRate,
        // sell-side stamp duty rate
        @DecimalMin("0") @DecimalMax("1") @DefaultValue("0.001") double stampDutyRate,
        // adverse price move applied to market fills
        @DecimalMin("0") @DecimalMax("0.5") @DefaultValue("0.001") double slippage,
        // minimum tradable share increment
        @Positive @DefaultValue("100") long lotSize,
        // commission floor per fill
        @DecimalMin("0") @DefaultValue("5") double minCommission
) {

    public ExecutionProperties {
        if (!Double.isFinite(initialCapital) || initialCapital <= 0.0) {
            throw new IllegalArgumentException("initialCapital must be > 0");
        }
        if (commissionRate < 0.0 || stampDutyRate < 0.0 || slippage < 0.0 || minCommission < 0.0) {
            throw new IllegalArgumentException("commission/stamp-duty/slippage/min-commission must be >= 0");
        }
        if (slippage >= 1.0) {
            throw new IllegalArgumentException("slippage must be < 1");
        }
        if (lotSize <= 0) {
            throw new IllegalArgumentException("lotSize must be > 0");
        }
    }

    public static ExecutionProperties defaults() {
        return new ExecutionProperties(1_000_000.0, 0.0003, 0.001, 0.001, 100, 5.0);
    }

    public ExecutionProperties withInitialCapital(double capital) {
        return new ExecutionProperties(capital, commissionRate, stampDutyRate, slippage, lotSize, minCommission);
    }
}
