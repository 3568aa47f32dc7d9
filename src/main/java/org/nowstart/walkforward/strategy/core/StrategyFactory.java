package org.nowstart.walkforward.strategy.core;

import org.nowstart.walkforward.data.dto.ParameterSet;

@FunctionalInterface
public interface StrategyFactory {

    TradingStrategy create(ParameterSet parameters);
}
