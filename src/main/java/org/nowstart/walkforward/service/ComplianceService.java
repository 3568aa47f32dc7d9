package org.nowstart.walkforward.service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.walkforward.data.dto.ComplianceMetrics;
import org.nowstart.walkforward.data.dto.ComplianceRules;
import org.nowstart.walkforward.data.dto.ComplianceVerdict;
import org.nowstart.walkforward.data.dto.DailyBalance;
import org.nowstart.walkforward.data.dto.DailyComplianceStat;
import org.nowstart.walkforward.data.dto.SimulationResult;
import org.nowstart.walkforward.data.property.ComplianceProperties;
import org.nowstart.walkforward.data.type.ComplianceRule;
import org.springframework.stereotype.Service;

/**
 * Checks a daily balance series against prop-firm style account rules. Every rule is evaluated
 * independently and all violations are reported.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ComplianceService {

    private final DailyBalanceAggregator dailyBalanceAggregator;
    private final ComplianceProperties complianceProperties;

    public ComplianceVerdict check(SimulationResult result) {
        return check(result, complianceProperties.toRules());
    }

    public ComplianceVerdict check(SimulationResult result, ComplianceRules rules) {
        if (result == null) {
            throw new IllegalArgumentException("result is required");
        }
        List<DailyBalance> days = dailyBalanceAggregator.aggregate(result.equityCurve(), complianceProperties.zoneId());
        Collection<LocalDate> tradeDays = dailyBalanceAggregator.tradeDays(result.trades(), complianceProperties.zoneId());
        return check(days, tradeDays, rules, result.initialBalance());
    }

    public ComplianceVerdict check(
            List<DailyBalance> days,
            Collection<LocalDate> tradeDays,
            ComplianceRules rules,
            double initialBalance
    ) {
        if (rules == null) {
            throw new IllegalArgumentException("rules are required");
        }
        if (!Double.isFinite(initialBalance) || initialBalance <= 0.0) {
            throw new IllegalArgumentException("initialBalance must be finite and > 0");
        }
        List<DailyBalance> safeDays = days == null ? List.of() : days;

        List<DailyComplianceStat> stats = new ArrayList<>(safeDays.size());
        double previousClose = initialBalance;
        double peak = Double.NEGATIVE_INFINITY;
        double worstDailyDrawdown = 0.0;
        LocalDate worstDay = null;
        double maxDrawdownFromPeak = 0.0;
        for (DailyBalance day : safeDays) {
            double close = day.closeBalance();
            peak = Math.max(peak, close);
            double dailyPnlPct = (close - previousClose) / previousClose;
            double dailyDrawdown = (day.minBalance() - previousClose) / previousClose;
            double drawdownFromPeak = (close - peak) / peak;
            stats.add(new DailyComplianceStat(
                    day.date(),
                    previousClose,
                    close,
                    dailyPnlPct,
                    dailyDrawdown,
                    peak,
                    drawdownFromPeak
            ));
            if (worstDay == null || dailyDrawdown < worstDailyDrawdown) {
                worstDailyDrawdown = dailyDrawdown;
                worstDay = day.date();
            }
            maxDrawdownFromPeak = Math.min(maxDrawdownFromPeak, drawdownFromPeak);
            previousClose = close;
        }

        double finalBalance = safeDays.isEmpty() ? initialBalance : safeDays.get(safeDays.size() - 1).closeBalance();
        double totalReturn = (finalBalance - initialBalance) / initialBalance;
        int tradingDays = tradeDays == null ? 0 : new HashSet<>(tradeDays).size();

        List<ComplianceRule> violated = new ArrayList<>();
        List<String> reasons = new ArrayList<>();
        if (totalReturn < rules.profitTarget()) {
            violated.add(ComplianceRule.PROFIT_TARGET);
            reasons.add("total return " + percent(totalReturn) + " below profit target " + percent(rules.profitTarget()));
        }
        if (worstDailyDrawdown < -rules.maxDailyLoss()) {
            violated.add(ComplianceRule.DAILY_LOSS);
            reasons.add("daily drawdown " + percent(worstDailyDrawdown) + " on " + worstDay
                    + " exceeds limit " + percent(rules.maxDailyLoss()));
        }
        if (maxDrawdownFromPeak < -rules.maxTotalDrawdown()) {
            violated.add(ComplianceRule.TOTAL_DRAWDOWN);
            reasons.add("drawdown from peak " + percent(maxDrawdownFromPeak) + " exceeds limit "
                    + percent(rules.maxTotalDrawdown()));
        }
        if (tradingDays < rules.minTradingDays()) {
            violated.add(ComplianceRule.TRADING_DAYS);
            reasons.add("traded on " + tradingDays + " days, minimum is " + rules.minTradingDays());
        }

        ComplianceMetrics metrics = new ComplianceMetrics(
                initialBalance,
                finalBalance,
                totalReturn,
                worstDailyDrawdown,
                worstDay,
                maxDrawdownFromPeak,
                tradingDays
        );
        log.info(
                "[Compliance] compliant={} totalReturn={} worstDaily={} maxDrawdown={} tradingDays={} violated={}",
                violated.isEmpty(),
                percent(totalReturn),
                percent(worstDailyDrawdown),
                percent(maxDrawdownFromPeak),
                tradingDays,
                violated
        );
        return new ComplianceVerdict(violated.isEmpty(), violated, reasons, metrics, stats);
    }

    private String percent(double fraction) {
        return String.format(Locale.US, "%.2f%%", fraction * 100.0);
    }
}
