package org.nowstart.walkforward.data.dto;

import java.util.List;

public record SimulationResult(
        List<Trade> trades,
        List<EquityPoint> equityCurve,
        List<Position> openPositions,
        double initialBalance,
        double finalBalance,
        int skippedBars,
        int rejectedEntries
) {
    public SimulationResult {
        trades = List.copyOf(trades);
        equityCurve = List.copyOf(equityCurve);
        openPositions = List.copyOf(openPositions);
    }

    public double finalEquity() {
        if (equityCurve.isEmpty()) {
            return initialBalance;
        }
        return equityCurve.get(equityCurve.size() - 1).equity();
    }
}
