package org.nowstart.walkforward.data.dto;

import java.time.LocalDate;

public record ComplianceMetrics(
        double initialBalance,
        double finalBalance,
        double totalReturn,
        double worstDailyDrawdown,
        LocalDate worstDay,
        double maxDrawdownFromPeak,
        int tradingDays
) {
}
