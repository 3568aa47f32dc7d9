package org.nowstart.walkforward.data.dto;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.nowstart.walkforward.data.type.OptimizationDirection;
import org.nowstart.walkforward.data.type.PerformanceMetric;
import org.nowstart.walkforward.strategy.core.OhlcvCandle;
import org.nowstart.walkforward.strategy.core.StrategyFactory;

/**
 * Inputs of one walk-forward run. Validation happens in the orchestrator so that a bad request
 * becomes a failed report instead of an exception.
 */
public record WalkForwardRequest(
        Map<String, List<OhlcvCandle>> barsBySymbol,
        StrategyFactory strategyFactory,
        List<ParameterDomain> domains,
        Instant rangeStart,
        Instant rangeEnd,
        Duration windowSize,
        Duration oosSize,
        Duration stepSize,
        PerformanceMetric metric,
        OptimizationDirection direction,
        int minTrades,
        CostModel costModel,
        double initialBalance
) {
}
