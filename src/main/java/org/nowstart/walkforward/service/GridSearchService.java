package org.nowstart.walkforward.service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.walkforward.data.dto.GridSearchOutcome;
import org.nowstart.walkforward.data.dto.OptimizationResult;
import org.nowstart.walkforward.data.dto.ParameterDomain;
import org.nowstart.walkforward.data.dto.ParameterSet;
import org.nowstart.walkforward.data.dto.PerformanceMetrics;
import org.nowstart.walkforward.data.property.OptimizationProperties;
import org.nowstart.walkforward.data.type.FailureCode;
import org.nowstart.walkforward.data.type.OptimizationDirection;
import org.nowstart.walkforward.data.type.PerformanceMetric;
import org.springframework.stereotype.Service;

/**
 * Exhaustive search over the Cartesian product of parameter domains. The last domain varies fastest;
 * every combination writes into its own result slot so parallel completion order never shows in the output.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GridSearchService {

    private final OptimizationProperties optimizationProperties;

    public GridSearchOutcome optimize(
            List<ParameterDomain> domains,
            Function<ParameterSet, PerformanceMetrics> evaluator,
            PerformanceMetric metric,
            OptimizationDirection direction
    ) {
        return optimize(
                domains,
                evaluator,
                metric,
                direction,
                optimizationProperties.minTrades(),
                optimizationProperties.parallelism()
        );
    }

    public GridSearchOutcome optimize(
            List<ParameterDomain> domains,
            Function<ParameterSet, PerformanceMetrics> evaluator,
            PerformanceMetric metric,
            OptimizationDirection direction,
            int minTrades,
            int parallelism
    ) {
        String configError = validate(domains, evaluator, metric, direction, minTrades);
        if (configError != null) {
            log.warn("[Grid] invalid configuration reason={}", configError);
            return GridSearchOutcome.failed(FailureCode.INVALID_CONFIGURATION, configError, metric, direction, List.of());
        }

        int[] sizes = new int[domains.size()];
        for (int i = 0; i < sizes.length; i++) {
            sizes[i] = domains.get(i).size();
        }
        long[] strides;
        try {
            strides = buildStrides(sizes);
        } catch (IllegalArgumentException e) {
            return GridSearchOutcome.failed(FailureCode.INVALID_CONFIGURATION, e.getMessage(), metric, direction, List.of());
        }
        long totalLong = strides[0] * sizes[0];
        if (totalLong > Integer.MAX_VALUE) {
            String reason = "combination count overflow: " + totalLong;
            return GridSearchOutcome.failed(FailureCode.INVALID_CONFIGURATION, reason, metric, direction, List.of());
        }
        int total = (int) totalLong;

        long startedAtNanos = System.nanoTime();
        long logIntervalNanos = TimeUnit.SECONDS.toNanos(optimizationProperties.progressLogSeconds());
        AtomicLong processed = new AtomicLong(0L);
        AtomicLong nextLogAtNanos = new AtomicLong(startedAtNanos + logIntervalNanos);

        OptimizationResult[] slots = new OptimizationResult[total];
        ParallelIndexRunner.run(total, parallelism, index -> {
            ParameterSet parameters = parametersAt(domains, strides, sizes, index);
            slots[index] = evaluate(index, parameters, evaluator, minTrades);
            logProgress(processed, nextLogAtNanos, logIntervalNanos, total, startedAtNanos);
        }, "Grid search");
        logProgressFinal(processed.get(), total, startedAtNanos);

        List<OptimizationResult> results = Arrays.asList(slots);
        List<OptimizationResult> ranked = new ArrayList<>();
        for (OptimizationResult result : results) {
            if (result.valid()) {
                ranked.add(result);
            }
        }
        if (ranked.isEmpty()) {
            String reason = "no combination passed validation out of " + total + " (min_trades=" + minTrades + ")";
            return GridSearchOutcome.failed(FailureCode.NO_VALID_COMBINATION, reason, metric, direction, results);
        }
        ranked.sort(rankingComparator(metric, direction));
        return GridSearchOutcome.succeeded(metric, direction, ranked, results);
    }

    private String validate(
            List<ParameterDomain> domains,
            Function<ParameterSet, PerformanceMetrics> evaluator,
            PerformanceMetric metric,
            OptimizationDirection direction,
            int minTrades
    ) {
        if (domains == null || domains.isEmpty()) {
            return "at least one parameter domain is required";
        }
        Set<String> names = new HashSet<>();
        for (ParameterDomain domain : domains) {
            if (domain == null) {
                return "parameter domain must not be null";
            }
            if (domain.size() == 0) {
                return "parameter domain is empty: " + domain.name();
            }
            if (!names.add(domain.name())) {
                return "duplicate parameter domain: " + domain.name();
            }
        }
        if (evaluator == null) {
            return "evaluator is required";
        }
        if (metric == null) {
            return "metric is required";
        }
        if (direction == null) {
            return "direction is required";
        }
        if (minTrades < 0) {
            return "min_trades must be >= 0";
        }
        return null;
    }

    private OptimizationResult evaluate(
            int index,
            ParameterSet parameters,
            Function<ParameterSet, PerformanceMetrics> evaluator,
            int minTrades
    ) {
        PerformanceMetrics metrics;
        try {
            metrics = evaluator.apply(parameters);
        } catch (RuntimeException e) {
            log.warn("[Grid] evaluation failed index={} params={} reason={}", index, parameters, e.getMessage());
            return OptimizationResult.rejected(index, parameters, null, "evaluation failed: " + e.getMessage());
        }
        if (metrics == null) {
            return OptimizationResult.rejected(index, parameters, null, "evaluator returned no metrics");
        }
        if (metrics.totalTrades() < minTrades) {
            String reason = "total_trades=" + metrics.totalTrades() + " below min_trades=" + minTrades;
            return OptimizationResult.rejected(index, parameters, metrics, reason);
        }
        return OptimizationResult.valid(index, parameters, metrics);
    }

    private ParameterSet parametersAt(List<ParameterDomain> domains, long[] strides, int[] sizes, int index) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int d = 0; d < domains.size(); d++) {
            ParameterDomain domain = domains.get(d);
            values.put(domain.name(), domain.values().get(coord(index, strides[d], sizes[d])));
        }
        return new ParameterSet(values);
    }

    private Comparator<OptimizationResult> rankingComparator(PerformanceMetric metric, OptimizationDirection direction) {
        return (left, right) -> {
            double a = metric.extract(left.metrics());
            double b = metric.extract(right.metrics());
            boolean aMissing = Double.isNaN(a);
            boolean bMissing = Double.isNaN(b);
            if (aMissing != bMissing) {
                return aMissing ? 1 : -1;
            }
            if (!aMissing && a != b) {
                boolean leftBetter = direction == OptimizationDirection.MAXIMIZE ? a > b : a < b;
                return leftBetter ? -1 : 1;
            }
            return Integer.compare(left.index(), right.index());
        };
    }

    private int coord(long index, long stride, int size) {
        return (int) ((index / stride) % size);
    }

    private long[] buildStrides(int[] sizes) {
        long[] strides = new long[sizes.length];
        long stride = 1L;
        for (int i = sizes.length - 1; i >= 0; i--) {
            strides[i] = stride;
            if (sizes[i] > 0 && stride > Long.MAX_VALUE / sizes[i]) {
                throw new IllegalArgumentException("grid stride overflow");
            }
            stride *= sizes[i];
        }
        return strides;
    }

    private void logProgress(
            AtomicLong processed,
            AtomicLong nextLogAtNanos,
            long logIntervalNanos,
            long total,
            long startedAtNanos
    ) {
        long done = processed.incrementAndGet();
        long now = System.nanoTime();
        long targetNanos = nextLogAtNanos.get();
        if (now < targetNanos) {
            return;
        }
        if (!nextLogAtNanos.compareAndSet(targetNanos, now + logIntervalNanos)) {
            return;
        }

        double elapsedSec = Math.max(1e-9, (System.nanoTime() - startedAtNanos) / 1_000_000_000.0);
        double rate = done / elapsedSec;
        double pct = (done * 100.0) / Math.max(1L, total);
        log.info(
                "[Grid][Progress] done={}/{} ({}%) rate={}/s",
                done,
                total,
                String.format(Locale.US, "%.2f", pct),
                Math.round(rate)
        );
    }

    private void logProgressFinal(long done, long total, long startedAtNanos) {
        double elapsedSec = Math.max(1e-9, (System.nanoTime() - startedAtNanos) / 1_000_000_000.0);
        double rate = done / elapsedSec;
        log.info(
                "[Grid][Done] done={}/{} elapsedSec={} rate={}/s",
                done,
                total,
                String.format(Locale.US, "%.2f", elapsedSec),
                Math.round(rate)
        );
    }
}
