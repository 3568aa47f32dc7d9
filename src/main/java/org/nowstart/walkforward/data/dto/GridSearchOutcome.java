package org.nowstart.walkforward.data.dto;

import java.util.List;
import java.util.Optional;
import org.nowstart.walkforward.data.type.FailureCode;
import org.nowstart.walkforward.data.type.OptimizationDirection;
import org.nowstart.walkforward.data.type.PerformanceMetric;

/**
 * Output of one grid search. {@code ranked} holds the valid results best-first, {@code results}
 * holds every evaluated combination in enumeration order, invalid ones included.
 */
public record GridSearchOutcome(
        boolean success,
        FailureCode failureCode,
        String failureReason,
        PerformanceMetric metric,
        OptimizationDirection direction,
        List<OptimizationResult> ranked,
        List<OptimizationResult> results
) {
    public GridSearchOutcome {
        ranked = ranked == null ? List.of() : List.copyOf(ranked);
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static GridSearchOutcome succeeded(
            PerformanceMetric metric,
            OptimizationDirection direction,
            List<OptimizationResult> ranked,
            List<OptimizationResult> results
    ) {
        return new GridSearchOutcome(true, null, null, metric, direction, ranked, results);
    }

    public static GridSearchOutcome failed(
            FailureCode code,
            String reason,
            PerformanceMetric metric,
            OptimizationDirection direction,
            List<OptimizationResult> results
    ) {
        return new GridSearchOutcome(false, code, reason, metric, direction, List.of(), results);
    }

    public Optional<OptimizationResult> best() {
        return ranked.isEmpty() ? Optional.empty() : Optional.of(ranked.get(0));
    }

    public int evaluatedCount() {
        return results.size();
    }
}
