package org.nowstart.walkforward.strategy.core;

import org.nowstart.walkforward.data.type.SignalAction;

/**
 * Strategy decision for one bar. Price fields are {@code NaN} when not set; a missing entry price
 * means "enter at the bar close".
 */
public record StrategySignal(
        SignalAction action,
        double entryPrice,
        double stopLoss,
        double takeProfit,
        String reason
) {
    private static final StrategySignal NONE = new StrategySignal(SignalAction.NONE, Double.NaN, Double.NaN, Double.NaN, null);

    public StrategySignal {
        action = action == null ? SignalAction.NONE : action;
    }

    public static StrategySignal none() {
        return NONE;
    }

    public static StrategySignal exit(String reason) {
        return new StrategySignal(SignalAction.EXIT, Double.NaN, Double.NaN, Double.NaN, reason);
    }

    public static StrategySignal enterLong(double entryPrice, double stopLoss, double takeProfit, String reason) {
        return new StrategySignal(SignalAction.ENTER_LONG, entryPrice, stopLoss, takeProfit, reason);
    }

    public static StrategySignal enterShort(double entryPrice, double stopLoss, double takeProfit, String reason) {
        return new StrategySignal(SignalAction.ENTER_SHORT, entryPrice, stopLoss, takeProfit, reason);
    }
}
