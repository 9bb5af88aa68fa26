package org.nowstart.tradelab.data.dto;

import java.time.LocalDate;

public record DailySnapshot(
        LocalDate date,
        double totalValue,
        double cash,
        double positionValue
) {
}
