package org.nowstart.walkforward.data.dto;

public record PerformanceMetrics(
        int totalTrades,
        int winningTrades,
        int losingTrades,
        double winRate,
        double grossProfit,
        double grossLoss,
        double netProfit,
        double totalReturn,
        double profitFactor,
        double avgWin,
        double avgLoss,
        double avgTrade,
        double largestWin,
        double largestLoss,
        double maxDrawdown,
        int maxDrawdownDuration,
        double sharpeRatio,
        double sortinoRatio,
        double expectancy,
        double kellyFraction,
        int maxConsecutiveWins,
        int maxConsecutiveLosses,
        int tradingDays
) {
    public static PerformanceMetrics empty() {
        return new PerformanceMetrics(
                0,
                0,
                0,
                0.0,
                0.0,
                0.0,
                0.0,
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
