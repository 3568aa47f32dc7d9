package org.nowstart.walkforward.data.dto;

public record OptimizationResult(
        int index,
        ParameterSet parameters,
        PerformanceMetrics metrics,
        boolean valid,
        String rejectionReason
) {
    public static OptimizationResult valid(int index, ParameterSet parameters, PerformanceMetrics metrics) {
        return new OptimizationResult(index, parameters, metrics, true, null);
    }

    public static OptimizationResult rejected(
            int index,
            ParameterSet parameters,
            PerformanceMetrics metrics,
            String reason
    ) {
        return new OptimizationResult(index, parameters, metrics, false, reason);
    }
}
