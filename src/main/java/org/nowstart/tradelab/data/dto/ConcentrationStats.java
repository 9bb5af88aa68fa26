package org.nowstart.tradelab.data.dto;

public record ConcentrationStats(
        double maxWeight,
        double averageWeight,
        double herfindahl
) {

    public static final ConcentrationStats EMPTY = new ConcentrationStats(0.0, 0.0, 0.0);
}
