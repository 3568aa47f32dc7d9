package org.nowstart.walkforward.data.dto;

import java.time.LocalDate;

public record DailyComplianceStat(
        LocalDate date,
        double previousClose,
        double closeBalance,
        double dailyPnlPct,
        double dailyDrawdown,
        double peakBalance,
        double drawdownFromPeak
) {
}
