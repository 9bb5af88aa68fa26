package org.nowstart.tradelab.data.dto;

import java.util.List;
import org.nowstart.tradelab.data.type.RiskLevel;

public record RiskReport(
        RiskLevel riskLevel,
        double positionRatio,
        double dailyPnlRatio,
        double drawdownRatio,
        List<String> warnings,
        boolean shouldReduce
) {
}
