package org.nowstart.walkforward.data.dto;

public record WindowResult(
        WindowSpec window,
        boolean success,
        ParameterSet parameters,
        PerformanceMetrics isMetrics,
        PerformanceMetrics oosMetrics,
        int evaluatedCombinations,
        String failureReason
) {
    public static WindowResult succeeded(
            WindowSpec window,
            ParameterSet parameters,
            PerformanceMetrics isMetrics,
            PerformanceMetrics oosMetrics,
            int evaluatedCombinations
    ) {
        return new WindowResult(window, true, parameters, isMetrics, oosMetrics, evaluatedCombinations, null);
    }

    public static WindowResult failed(
            WindowSpec window,
            ParameterSet parameters,
            PerformanceMetrics isMetrics,
            int evaluatedCombinations,
            String reason
    ) {
        return new WindowResult(window, false, parameters, isMetrics, null, evaluatedCombinations, reason);
    }
}
