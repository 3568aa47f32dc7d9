package org.nowstart.walkforward.strategy.core;

import java.util.List;

/**
 * {@code candles} ends with the bar being evaluated; nothing after it is visible.
 */
public record StrategyInput(
        String symbol,
        List<OhlcvCandle> candles,
        PositionSnapshot position
) {
    public StrategyInput {
        position = position == null ? PositionSnapshot.EMPTY : position;
    }

    public OhlcvCandle current() {
        return candles.get(candles.size() - 1);
    }
}
