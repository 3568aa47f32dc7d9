package org.nowstart.walkforward.service;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.nowstart.walkforward.data.dto.DailyBalance;
import org.nowstart.walkforward.data.dto.EquityPoint;
import org.nowstart.walkforward.data.dto.Trade;
import org.springframework.stereotype.Component;

/**
 * Cuts an equity curve into calendar days. Daily rows use marked-to-market equity so that
 * floating losses count toward the day's low.
 */
@Component
public class DailyBalanceAggregator {

    public List<DailyBalance> aggregate(List<EquityPoint> equityCurve, ZoneId zoneId) {
        if (zoneId == null) {
            throw new IllegalArgumentException("zoneId is required");
        }
        if (equityCurve == null || equityCurve.isEmpty()) {
            return List.of();
        }

        Map<LocalDate, double[]> byDay = new TreeMap<>();
        for (EquityPoint point : equityCurve) {
            if (point.timestamp() == null || !Double.isFinite(point.equity())) {
                continue;
            }
            LocalDate date = point.timestamp().atZone(zoneId).toLocalDate();
            double equity = point.equity();
            double[] row = byDay.get(date);
            if (row == null) {
                byDay.put(date, new double[] {equity, equity, equity});
                continue;
            }
            row[0] = Math.min(row[0], equity);
            row[1] = Math.max(row[1], equity);
            row[2] = equity;
        }

        List<DailyBalance> out = new ArrayList<>(byDay.size());
        for (Map.Entry<LocalDate, double[]> entry : byDay.entrySet()) {
            double[] row = entry.getValue();
            out.add(new DailyBalance(entry.getKey(), row[0], row[1], row[2]));
        }
        return List.copyOf(out);
    }

    public Set<LocalDate> tradeDays(List<Trade> trades, ZoneId zoneId) {
        if (zoneId == null) {
            throw new IllegalArgumentException("zoneId is required");
        }
        Set<LocalDate> days = new LinkedHashSet<>();
        if (trades == null) {
            return days;
        }
        for (Trade trade : trades) {
            if (trade.entryTime() != null) {
                days.add(trade.entryTime().atZone(zoneId).toLocalDate());
            }
        }
        return days;
    }
}
