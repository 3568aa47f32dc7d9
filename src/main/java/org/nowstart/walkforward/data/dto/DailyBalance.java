package org.nowstart.walkforward.data.dto;

import java.time.LocalDate;

public record DailyBalance(
        LocalDate date,
        double minBalance,
        double maxBalance,
        double closeBalance
) {
}
