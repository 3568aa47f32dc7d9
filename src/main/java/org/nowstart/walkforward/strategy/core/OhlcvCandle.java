package org.nowstart.walkforward.strategy.core;

import java.time.Instant;

public record OhlcvCandle(
        Instant timestamp,
        double open,
        double high,
        double low,
        double close,
        double volume
) {

    public boolean isWellFormed() {
        if (timestamp == null) {
            return false;
        }
        if (!positiveFinite(open) || !positiveFinite(high) || !positiveFinite(low) || !positiveFinite(close)) {
            return false;
        }
        if (high < low) {
            return false;
        }
        if (open < low || open > high || close < low || close > high) {
            return false;
        }
        return Double.isFinite(volume) && volume >= 0.0;
    }

    private static boolean positiveFinite(double value) {
        return Double.isFinite(value) && value > 0.0;
    }
}
