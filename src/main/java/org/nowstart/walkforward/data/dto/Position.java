package org.nowstart.walkforward.data.dto;

import java.time.Instant;
import org.nowstart.walkforward.data.type.TradeDirection;

/**
 * Open position owned by the simulation. {@code NaN} stop-loss or take-profit means the level is not set.
 */
public record Position(
        String symbol,
        TradeDirection direction,
        Instant entryTime,
        double entryPrice,
        double volume,
        double stopLoss,
        double takeProfit
) {
    public boolean hasStopLoss() {
        return Double.isFinite(stopLoss);
    }

    public boolean hasTakeProfit() {
        return Double.isFinite(takeProfit);
    }

    public double unrealizedPnl(double markPrice, double contractSize) {
        return (markPrice - entryPrice) * volume * contractSize * direction.sign();
    }
}
