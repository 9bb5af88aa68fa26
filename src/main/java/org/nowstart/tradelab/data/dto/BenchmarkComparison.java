package org.nowstart.tradelab.data.dto;

public record BenchmarkComparison(
        double beta,
        double alpha,
        double informationRatio,
        int overlappingDays
) {
}
