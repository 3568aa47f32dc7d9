package org.nowstart.walkforward.data.dto;

import java.time.Instant;
import org.nowstart.walkforward.data.type.ExitReason;
import org.nowstart.walkforward.data.type.TradeDirection;

public record Trade(
        String symbol,
        TradeDirection direction,
        Instant entryTime,
        Instant exitTime,
        double entryPrice,
        double exitPrice,
        double volume,
        double profitLoss,
        double commission,
        ExitReason exitReason
) {
    public boolean isWin() {
        return profitLoss > 0.0;
    }

    public boolean isLoss() {
        return profitLoss < 0.0;
    }
}
