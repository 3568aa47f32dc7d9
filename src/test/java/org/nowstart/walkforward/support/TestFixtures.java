package org.nowstart.walkforward.support;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import org.nowstart.walkforward.data.dto.PerformanceMetrics;
import org.nowstart.walkforward.data.dto.Trade;
import org.nowstart.walkforward.data.property.BacktestProperties;
import org.nowstart.walkforward.data.property.ComplianceProperties;
import org.nowstart.walkforward.data.property.MonteCarloProperties;
import org.nowstart.walkforward.data.property.OptimizationProperties;
import org.nowstart.walkforward.data.type.ExitReason;
import org.nowstart.walkforward.data.type.IntrabarExitPolicy;
import org.nowstart.walkforward.data.type.OptimizationDirection;
import org.nowstart.walkforward.data.type.PerformanceMetric;
import org.nowstart.walkforward.data.type.TradeDirection;
import org.nowstart.walkforward.strategy.core.OhlcvCandle;

public final class TestFixtures {

    public static final Instant BASE = Instant.parse("2024-01-01T00:00:00Z");
    public static final String SYMBOL = "EURUSD";

    private TestFixtures() {
    }

    public static Instant day(int index) {
        return BASE.plus(Duration.ofDays(index));
    }

    public static OhlcvCandle candle(int dayIndex, double open, double high, double low, double close) {
        return new OhlcvCandle(day(dayIndex), open, high, low, close, 1_000.0);
    }

    public static OhlcvCandle flat(int dayIndex, double close) {
        return candle(dayIndex, close, close + 1.0, close - 1.0, close);
    }

    public static BacktestProperties backtestProperties(IntrabarExitPolicy policy) {
        return new BacktestProperties(100_000.0, 0.0, 0.0, 0.0, 1.0, 0.01, policy, 0.01, 1_000.0, 0.01);
    }

    public static BacktestProperties backtestProperties() {
        return backtestProperties(IntrabarExitPolicy.STOP_LOSS_FIRST);
    }

    public static OptimizationProperties optimizationProperties(int minTrades, int parallelism) {
        return new OptimizationProperties(
                PerformanceMetric.NET_PROFIT,
                OptimizationDirection.MAXIMIZE,
                minTrades,
                parallelism,
                10,
                Duration.ofDays(90),
                Duration.ofDays(30),
                Duration.ofDays(30)
        );
    }

    public static MonteCarloProperties monteCarloProperties(int parallelism) {
        return new MonteCarloProperties(500, 7L, parallelism);
    }

    public static ComplianceProperties complianceProperties() {
        return new ComplianceProperties(0.10, 0.05, 0.10, 4, ZoneId.of("UTC"));
    }

    public static Trade trade(double profitLoss, Instant entryTime) {
        return new Trade(
                SYMBOL,
                TradeDirection.LONG,
                entryTime,
                entryTime.plus(Duration.ofHours(4)),
                100.0,
                100.0,
                1.0,
                profitLoss,
                0.0,
                ExitReason.SIGNAL
        );
    }

    public static PerformanceMetrics metrics(int totalTrades, double netProfit) {
        return new PerformanceMetrics(
                totalTrades,
                0,
                0,
                0.0,
                0.0,
                0.0,
                netProfit,
                0.0,
                0.0,
                0.0,
                0.0,
                0.0,
                0.0,
                0.0,
                0.0,
                0,
                0.0,
                0.0,
                0.0,
                0.0,
                0,
                0,
                0
        );
    }
}
