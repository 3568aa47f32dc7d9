package org.nowstart.walkforward.data.property;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.nowstart.walkforward.data.type.OptimizationDirection;
import org.nowstart.walkforward.data.type.PerformanceMetric;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "walkforward.optimization")
public record OptimizationProperties(
        // ranking metric of the grid search
        @NotNull @DefaultValue("SHARPE_RATIO") PerformanceMetric metric,
        @NotNull @DefaultValue("MAXIMIZE") OptimizationDirection direction,
        // combinations with fewer trades are rejected
        @PositiveOrZero @DefaultValue("10") int minTrades,
        // grid worker threads, 1 runs on the caller thread
        @Positive @DefaultValue("4") int parallelism,
        @Positive @DefaultValue("10") int progressLogSeconds,
        // in-sample length of each walk-forward window
        @NotNull @DefaultValue("180d") Duration windowSize,
        // out-of-sample length following each in-sample period
        @NotNull @DefaultValue("30d") Duration oosSize,
        // shift between consecutive window starts
        @NotNull @DefaultValue("30d") Duration stepSize
) {
    public OptimizationProperties {
        requirePositive(windowSize, "window-size");
        requirePositive(oosSize, "oos-size");
        requirePositive(stepSize, "step-size");
    }

    private static void requirePositive(Duration value, String name) {
        if (value != null && (value.isZero() || value.isNegative())) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }
}
