package org.nowstart.walkforward.strategy.core;

public interface TradingStrategy {

    String name();

    int requiredWarmupCandles();

    StrategySignal evaluate(StrategyInput input);
}
