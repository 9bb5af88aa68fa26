package org.nowstart.tradelab.data.property;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "tradelab.analysis")
public record AnalysisProperties(
        // annual risk-free rate used by Sharpe, Sortino and alpha
        @DefaultValue("0.03") double riskFreeRate,
        // annualization factor
        @Positive @DefaultValue("252") int tradingDaysPerYear,
        // confidence level for VaR / CVaR
        @DecimalMin(value = "0", inclusive = false) @DecimalMax(value = "1", inclusive = false)
        @DefaultValue("0.95") double varConfidence
) {

    public AnalysisProperties {
        if (tradingDaysPerYear <= 0) {
            throw new IllegalArgumentException("tradingDaysPerYear must be > 0");
        }
        if (varConfidence <= 0.0 || varConfidence >= 1.0) {
            throw new IllegalArgumentException("varConfidence must be in (0, 1)");
        }
    }

    public static AnalysisProperties defaults() {
        return new AnalysisProperties(0.03, 252, 0.95);
    }
}
