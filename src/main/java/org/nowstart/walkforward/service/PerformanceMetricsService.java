package org.nowstart.walkforward.service;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.nowstart.walkforward.data.dto.EquityPoint;
import org.nowstart.walkforward.data.dto.PerformanceMetrics;
import org.nowstart.walkforward.data.dto.SimulationResult;
import org.nowstart.walkforward.data.dto.Trade;
import org.springframework.stereotype.Service;

/**
 * Pure trade-log and equity-curve statistics. Degenerate samples produce sentinel values, never exceptions.
 */
@Service
public class PerformanceMetricsService {

    private static final double TRADING_DAYS_PER_YEAR = 252.0;

    public PerformanceMetrics compute(SimulationResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result is required");
        }
        return compute(result.trades(), result.equityCurve(), result.initialBalance());
    }

    /**
     * Starting balance is recovered as the last recorded balance minus the realized net profit.
     */
    public PerformanceMetrics compute(List<Trade> trades, List<EquityPoint> equityCurve) {
        List<Trade> safeTrades = trades == null ? List.of() : trades;
        List<EquityPoint> safeCurve = equityCurve == null ? List.of() : equityCurve;
        double netProfit = 0.0;
        for (Trade trade : safeTrades) {
            netProfit += trade.profitLoss();
        }
        double startingBalance = safeCurve.isEmpty()
                ? Double.NaN
                : safeCurve.get(safeCurve.size() - 1).balance() - netProfit;
        return compute(safeTrades, safeCurve, startingBalance);
    }

    public PerformanceMetrics compute(List<Trade> trades, List<EquityPoint> equityCurve, double startingBalance) {
        List<Trade> safeTrades = trades == null ? List.of() : trades;
        List<EquityPoint> safeCurve = equityCurve == null ? List.of() : equityCurve;

        int total = safeTrades.size();
        int wins = 0;
        int losses = 0;
        double grossProfit = 0.0;
        double grossLoss = 0.0;
        double largestWin = 0.0;
        double largestLoss = 0.0;
        int winStreak = 0;
        int lossStreak = 0;
        int maxWinStreak = 0;
        int maxLossStreak = 0;
        Set<LocalDate> entryDays = new HashSet<>();

        for (Trade trade : safeTrades) {
            double pnl = trade.profitLoss();
            if (trade.isWin()) {
                wins++;
                grossProfit += pnl;
                largestWin = Math.max(largestWin, pnl);
                winStreak++;
                lossStreak = 0;
            } else if (trade.isLoss()) {
                losses++;
                grossLoss += pnl;
                largestLoss = Math.min(largestLoss, pnl);
                lossStreak++;
                winStreak = 0;
            } else {
                winStreak = 0;
                lossStreak = 0;
            }
            maxWinStreak = Math.max(maxWinStreak, winStreak);
            maxLossStreak = Math.max(maxLossStreak, lossStreak);
            if (trade.entryTime() != null) {
                entryDays.add(trade.entryTime().atZone(ZoneOffset.UTC).toLocalDate());
            }
        }

        double netProfit = grossProfit + grossLoss;
        double winRate = total == 0 ? 0.0 : wins / (double) total;
        double avgWin = wins == 0 ? 0.0 : grossProfit / wins;
        double avgLoss = losses == 0 ? 0.0 : Math.abs(grossLoss) / losses;
        double avgTrade = total == 0 ? 0.0 : netProfit / total;
        double profitFactor = profitFactor(grossProfit, grossLoss);
        double expectancy = winRate * avgWin - (1.0 - winRate) * avgLoss;
        double kelly = kellyFraction(total, wins, losses, winRate, avgWin, avgLoss);
        double totalReturn = Double.isFinite(startingBalance) && startingBalance > 0.0
                ? netProfit / startingBalance
                : 0.0;

        DrawdownStats drawdown = drawdown(safeCurve);
        List<Double> dailyReturns = dailyReturns(safeCurve);

        return new PerformanceMetrics(
                total,
                wins,
                losses,
                winRate,
                grossProfit,
                grossLoss,
                netProfit,
                totalReturn,
                profitFactor,
                avgWin,
                avgLoss,
                avgTrade,
                largestWin,
                largestLoss,
                drawdown.maxDrawdown(),
                drawdown.longestDuration(),
                sharpe(dailyReturns),
                sortino(dailyReturns),
                expectancy,
                kelly,
                maxWinStreak,
                maxLossStreak,
                entryDays.size()
        );
    }

    private double profitFactor(double grossProfit, double grossLoss) {
        if (grossLoss == 0.0) {
            return grossProfit > 0.0 ? Double.POSITIVE_INFINITY : 0.0;
        }
        return grossProfit / Math.abs(grossLoss);
    }

    private double kellyFraction(int total, int wins, int losses, double winRate, double avgWin, double avgLoss) {
        if (total == 0 || wins == 0) {
            return 0.0;
        }
        if (losses == 0 || avgLoss == 0.0) {
            return winRate;
        }
        double payoff = avgWin / avgLoss;
        return winRate - (1.0 - winRate) / payoff;
    }

    private DrawdownStats drawdown(List<EquityPoint> curve) {
        double peak = Double.NaN;
        double maxDrawdown = 0.0;
        int currentDuration = 0;
        int longestDuration = 0;
        for (EquityPoint point : curve) {
            double equity = point.equity();
            if (!Double.isFinite(equity)) {
                continue;
            }
            if (Double.isNaN(peak) || equity >= peak) {
                peak = equity;
                currentDuration = 0;
                continue;
            }
            currentDuration++;
            longestDuration = Math.max(longestDuration, currentDuration);
            if (peak > 0.0) {
                maxDrawdown = Math.max(maxDrawdown, (peak - equity) / peak);
            }
        }
        return new DrawdownStats(maxDrawdown, longestDuration);
    }

    private List<Double> dailyReturns(List<EquityPoint> curve) {
        Map<LocalDate, Double> closeByDay = new LinkedHashMap<>();
        for (EquityPoint point : curve) {
            if (point.timestamp() == null || !Double.isFinite(point.equity())) {
                continue;
            }
            closeByDay.put(point.timestamp().atZone(ZoneOffset.UTC).toLocalDate(), point.equity());
        }
        List<Double> returns = new ArrayList<>();
        Double previous = null;
        for (double close : closeByDay.values()) {
            if (previous != null && previous != 0.0) {
                returns.add((close - previous) / previous);
            }
            previous = close;
        }
        return returns;
    }

    private double sharpe(List<Double> returns) {
        if (returns.isEmpty()) {
            return 0.0;
        }
        double mean = mean(returns);
        double stdev = populationStdev(returns, mean);
        if (stdev == 0.0 || !Double.isFinite(stdev)) {
            return 0.0;
        }
        return mean / stdev * Math.sqrt(TRADING_DAYS_PER_YEAR);
    }

    private double sortino(List<Double> returns) {
        if (returns.isEmpty()) {
            return 0.0;
        }
        List<Double> downside = new ArrayList<>();
        for (double value : returns) {
            if (value < 0.0) {
                downside.add(value);
            }
        }
        if (downside.isEmpty()) {
            return 0.0;
        }
        double downsideStdev = populationStdev(downside, mean(downside));
        if (downsideStdev == 0.0 || !Double.isFinite(downsideStdev)) {
            return 0.0;
        }
        return mean(returns) / downsideStdev * Math.sqrt(TRADING_DAYS_PER_YEAR);
    }

    private double mean(List<Double> values) {
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    private double populationStdev(List<Double> values, double mean) {
        double sumSq = 0.0;
        for (double value : values) {
            double diff = value - mean;
            sumSq += diff * diff;
        }
        return Math.sqrt(sumSq / values.size());
    }

    private record DrawdownStats(double maxDrawdown, int longestDuration) {
    }
}
