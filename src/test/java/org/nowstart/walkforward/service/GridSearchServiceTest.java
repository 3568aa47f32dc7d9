package org.nowstart.walkforward.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.nowstart.walkforward.support.TestFixtures.metrics;
import static org.nowstart.walkforward.support.TestFixtures.optimizationProperties;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.Test;
import org.nowstart.walkforward.data.dto.GridSearchOutcome;
import org.nowstart.walkforward.data.dto.OptimizationResult;
import org.nowstart.walkforward.data.dto.ParameterDomain;
import org.nowstart.walkforward.data.dto.ParameterSet;
import org.nowstart.walkforward.data.dto.PerformanceMetrics;
import org.nowstart.walkforward.data.type.FailureCode;
import org.nowstart.walkforward.data.type.OptimizationDirection;
import org.nowstart.walkforward.data.type.PerformanceMetric;

class GridSearchServiceTest {

    private static final List<ParameterDomain> DOMAINS = List.of(
            ParameterDomain.of("a", 1, 2),
            ParameterDomain.of("b", 10, 20, 30)
    );
    private static final Function<ParameterSet, PerformanceMetrics> SCORE =
            params -> metrics(10, params.getInt("a") * 100 + params.getInt("b"));

    private final GridSearchService service = new GridSearchService(optimizationProperties(0, 1));

    @Test
    void optimize_enumeratesCartesianProductWithLastDomainFastest() {
        GridSearchOutcome outcome = service.optimize(
                DOMAINS,
                SCORE,
                PerformanceMetric.NET_PROFIT,
                OptimizationDirection.MAXIMIZE
        );

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.evaluatedCount()).isEqualTo(6);
        assertThat(outcome.results()).extracting(OptimizationResult::index).containsExactly(0, 1, 2, 3, 4, 5);
        assertThat(outcome.results().get(1).parameters()).isEqualTo(ParameterSet.of(Map.of("a", 1, "b", 20)));
        assertThat(outcome.results().get(3).parameters()).isEqualTo(ParameterSet.of(Map.of("a", 2, "b", 10)));
    }

    @Test
    void optimize_ranksBestFirstForEachDirection() {
        GridSearchOutcome maximize = service.optimize(
                DOMAINS,
                SCORE,
                PerformanceMetric.NET_PROFIT,
                OptimizationDirection.MAXIMIZE
        );
        GridSearchOutcome minimize = service.optimize(
                DOMAINS,
                SCORE,
                PerformanceMetric.NET_PROFIT,
                OptimizationDirection.MINIMIZE
        );

        assertThat(maximize.best().orElseThrow().index()).isEqualTo(5);
        assertThat(minimize.best().orElseThrow().index()).isEqualTo(0);
        for (OptimizationResult result : maximize.ranked()) {
            assertThat(result.metrics().netProfit())
                    .isLessThanOrEqualTo(maximize.best().orElseThrow().metrics().netProfit());
        }
    }

    @Test
    void optimize_breaksTiesByEnumerationIndex() {
        GridSearchOutcome outcome = service.optimize(
                DOMAINS,
                params -> metrics(10, 42.0),
                PerformanceMetric.NET_PROFIT,
                OptimizationDirection.MAXIMIZE
        );

        assertThat(outcome.ranked()).extracting(OptimizationResult::index).containsExactly(0, 1, 2, 3, 4, 5);
    }

    @Test
    void optimize_ranksNaNLast() {
        GridSearchOutcome outcome = service.optimize(
                DOMAINS,
                params -> params.getInt("b") == 30 && params.getInt("a") == 2
                        ? metrics(10, Double.NaN)
                        : SCORE.apply(params),
                PerformanceMetric.NET_PROFIT,
                OptimizationDirection.MAXIMIZE
        );

        assertThat(outcome.best().orElseThrow().index()).isEqualTo(4);
        assertThat(outcome.ranked().get(outcome.ranked().size() - 1).index()).isEqualTo(5);
    }

    @Test
    void optimize_rejectsCombinationsBelowMinTrades() {
        GridSearchOutcome outcome = service.optimize(
                DOMAINS,
                params -> metrics(params.getInt("a"), params.getInt("b")),
                PerformanceMetric.NET_PROFIT,
                OptimizationDirection.MAXIMIZE,
                2,
                1
        );

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.ranked()).hasSize(3);
        assertThat(outcome.ranked()).allMatch(result -> result.parameters().getInt("a") == 2);
        assertThat(outcome.results().get(0).valid()).isFalse();
        assertThat(outcome.results().get(0).rejectionReason()).contains("min_trades=2");
    }

    @Test
    void optimize_failsWithNoValidCombinationWhenAllAreRejected() {
        GridSearchOutcome outcome = service.optimize(
                DOMAINS,
                params -> metrics(0, 1.0),
                PerformanceMetric.NET_PROFIT,
                OptimizationDirection.MAXIMIZE,
                5,
                1
        );

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.failureCode()).isEqualTo(FailureCode.NO_VALID_COMBINATION);
        assertThat(outcome.best()).isEmpty();
        assertThat(outcome.results()).hasSize(6);
    }

    @Test
    void optimize_marksOnlyTheFailingCombinationInvalidWhenEvaluatorThrows() {
        GridSearchOutcome outcome = service.optimize(
                DOMAINS,
                params -> {
                    if (params.getInt("b") == 20) {
                        throw new IllegalStateException("boom");
                    }
                    return SCORE.apply(params);
                },
                PerformanceMetric.NET_PROFIT,
                OptimizationDirection.MAXIMIZE
        );

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.ranked()).hasSize(4);
        assertThat(outcome.results().get(1).valid()).isFalse();
        assertThat(outcome.results().get(1).rejectionReason()).contains("boom");
    }

    @Test
    void optimize_reportsInvalidConfiguration() {
        assertThat(service.optimize(List.of(), SCORE, PerformanceMetric.NET_PROFIT, OptimizationDirection.MAXIMIZE)
                .failureCode()).isEqualTo(FailureCode.INVALID_CONFIGURATION);
        assertThat(service.optimize(
                List.of(new ParameterDomain("a", List.of())),
                SCORE,
                PerformanceMetric.NET_PROFIT,
                OptimizationDirection.MAXIMIZE
        ).failureCode()).isEqualTo(FailureCode.INVALID_CONFIGURATION);
        assertThat(service.optimize(
                List.of(ParameterDomain.of("a", 1), ParameterDomain.of("a", 2)),
                SCORE,
                PerformanceMetric.NET_PROFIT,
                OptimizationDirection.MAXIMIZE
        ).failureReason()).contains("duplicate");
        assertThat(service.optimize(DOMAINS, SCORE, null, OptimizationDirection.MAXIMIZE).failureCode())
                .isEqualTo(FailureCode.INVALID_CONFIGURATION);
    }

    @Test
    void optimize_parallelRunMatchesSequentialRun() {
        List<ParameterDomain> domains = List.of(
                ParameterDomain.range("fast", 1, 10, 1),
                ParameterDomain.range("slow", 20, 60, 5),
                ParameterDomain.of("mode", "ema", "sma")
        );
        Function<ParameterSet, PerformanceMetrics> evaluator = params -> metrics(
                10,
                params.getDouble("slow") / params.getDouble("fast") + (params.getString("mode").equals("ema") ? 1 : 0)
        );

        GridSearchOutcome sequential = service.optimize(
                domains,
                evaluator,
                PerformanceMetric.NET_PROFIT,
                OptimizationDirection.MAXIMIZE,
                0,
                1
        );
        GridSearchOutcome parallel = service.optimize(
                domains,
                evaluator,
                PerformanceMetric.NET_PROFIT,
                OptimizationDirection.MAXIMIZE,
                0,
                4
        );

        assertThat(parallel.evaluatedCount()).isEqualTo(10 * 9 * 2);
        assertThat(parallel).isEqualTo(sequential);
    }
}
