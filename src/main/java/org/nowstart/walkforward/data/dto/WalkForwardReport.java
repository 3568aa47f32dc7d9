package org.nowstart.walkforward.data.dto;

import java.util.List;
import org.nowstart.walkforward.data.type.FailureCode;
import org.nowstart.walkforward.data.type.PerformanceMetric;

public record WalkForwardReport(
        boolean success,
        FailureCode failureCode,
        String failureReason,
        PerformanceMetric metric,
        List<WindowResult> windows,
        ParameterSet robustParameters,
        PerformanceMetrics fullPeriodMetrics,
        int successfulWindows,
        double meanIsMetric,
        double meanOosMetric,
        double walkForwardEfficiency
) {
    public WalkForwardReport {
        windows = windows == null ? List.of() : List.copyOf(windows);
    }

    public static WalkForwardReport failed(
            FailureCode code,
            String reason,
            PerformanceMetric metric,
            List<WindowResult> windows
    ) {
        return new WalkForwardReport(false, code, reason, metric, windows, null, null, 0, 0.0, 0.0, 0.0);
    }
}
