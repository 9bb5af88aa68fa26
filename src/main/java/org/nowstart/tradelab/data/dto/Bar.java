package org.nowstart.tradelab.data.dto;

import java.time.LocalDate;

public record Bar(
        LocalDate date,
        double open,
        double high,
        double low,
        double close,
        double volume,
        double amount
) {
}
