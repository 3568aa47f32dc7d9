package org.nowstart.walkforward.data.property;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.nowstart.walkforward.data.dto.ComplianceRules;
import org.nowstart.walkforward.data.dto.CostModel;
import org.nowstart.walkforward.data.type.IntrabarExitPolicy;
import org.nowstart.walkforward.data.type.OptimizationDirection;
import org.nowstart.walkforward.data.type.PerformanceMetric;
import org.nowstart.walkforward.support.TestFixtures;

class PropertiesRecordsTest {

    @Test
    void backtestProperties_buildCostModel() {
        BacktestProperties properties = new BacktestProperties(
                50_000, 0.0002, 0.0001, 7.0, 100_000, 0.01, IntrabarExitPolicy.STOP_LOSS_FIRST, 0.01, 50, 0.01
        );

        assertThat(properties.toCostModel()).isEqualTo(new CostModel(0.0002, 0.0001, 7.0, 100_000));
    }

    @Test
    void backtestProperties_rejectInvertedVolumeBounds() {
        assertThatThrownBy(() -> new BacktestProperties(
                50_000, 0, 0, 0, 1, 0.01, IntrabarExitPolicy.STOP_LOSS_FIRST, 5, 1, 0.01
        )).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void optimizationProperties_rejectNonPositiveDurations() {
        assertThatThrownBy(() -> new OptimizationProperties(
                PerformanceMetric.SHARPE_RATIO,
                OptimizationDirection.MAXIMIZE,
                10,
                1,
                10,
                Duration.ZERO,
                Duration.ofDays(30),
                Duration.ofDays(30)
        )).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("window-size");
    }

    @Test
    void complianceProperties_buildRules() {
        assertThat(TestFixtures.complianceProperties().toRules()).isEqualTo(ComplianceRules.ftmoDefaults());
    }
}
