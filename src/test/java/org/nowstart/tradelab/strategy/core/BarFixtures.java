package org.nowstart.tradelab.strategy.core;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.nowstart.tradelab.data.dto.Bar;

public final class BarFixtures {

    public static final LocalDate START = LocalDate.of(2024, 1, 2);

    private BarFixtures() {
    }

    public static List<Bar> closes(double... closes) {
        List<Bar> bars = new ArrayList<>();
        for (int i = 0; i < closes.length; i++) {
            double close = closes[i];
            bars.add(new Bar(START.plusDays(i), close, close, close, close, 1_000, close * 1_000));
        }
        return bars;
    }
}
