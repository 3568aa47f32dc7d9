package org.nowstart.walkforward.data.type;

import java.util.Locale;
import java.util.function.ToDoubleFunction;
import org.nowstart.walkforward.data.dto.PerformanceMetrics;

public enum PerformanceMetric {
    TOTAL_RETURN("total_return", PerformanceMetrics::totalReturn),
    NET_PROFIT("net_profit", PerformanceMetrics::netProfit),
    WIN_RATE("win_rate", PerformanceMetrics::winRate),
    PROFIT_FACTOR("profit_factor", PerformanceMetrics::profitFactor),
    MAX_DRAWDOWN("max_drawdown", PerformanceMetrics::maxDrawdown),
    SHARPE_RATIO("sharpe_ratio", PerformanceMetrics::sharpeRatio),
    SORTINO_RATIO("sortino_ratio", PerformanceMetrics::sortinoRatio),
    EXPECTANCY("expectancy", PerformanceMetrics::expectancy),
    KELLY_FRACTION("kelly_fraction", PerformanceMetrics::kellyFraction),
    TOTAL_TRADES("total_trades", metrics -> metrics.totalTrades());

    private final String key;
    private final ToDoubleFunction<PerformanceMetrics> extractor;

    PerformanceMetric(String key, ToDoubleFunction<PerformanceMetrics> extractor) {
        this.key = key;
        this.extractor = extractor;
    }

    public String key() {
        return key;
    }

    public double extract(PerformanceMetrics metrics) {
        if (metrics == null) {
            return Double.NaN;
        }
        return extractor.applyAsDouble(metrics);
    }

    public static PerformanceMetric fromKey(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("metric name is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (PerformanceMetric metric : values()) {
            if (metric.key.equals(normalized)) {
                return metric;
            }
        }
        throw new IllegalArgumentException("Unsupported metric: " + raw);
    }
}
