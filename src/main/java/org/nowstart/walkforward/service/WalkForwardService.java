package org.nowstart.walkforward.service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.walkforward.data.dto.GridSearchOutcome;
import org.nowstart.walkforward.data.dto.OptimizationResult;
import org.nowstart.walkforward.data.dto.ParameterDomain;
import org.nowstart.walkforward.data.dto.ParameterSet;
import org.nowstart.walkforward.data.dto.PerformanceMetrics;
import org.nowstart.walkforward.data.dto.SimulationResult;
import org.nowstart.walkforward.data.dto.WalkForwardReport;
import org.nowstart.walkforward.data.dto.WalkForwardRequest;
import org.nowstart.walkforward.data.dto.WindowResult;
import org.nowstart.walkforward.data.dto.WindowSpec;
import org.nowstart.walkforward.data.property.OptimizationProperties;
import org.nowstart.walkforward.data.type.FailureCode;
import org.nowstart.walkforward.data.type.PerformanceMetric;
import org.nowstart.walkforward.strategy.core.OhlcvCandle;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class WalkForwardService {

    private final GridSearchService gridSearchService;
    private final SimulationService simulationService;
    private final PerformanceMetricsService performanceMetricsService;
    private final WalkForwardWindowPlanner windowPlanner;
    private final RobustParameterAggregator robustParameterAggregator;
    private final OptimizationProperties optimizationProperties;

    public WalkForwardReport run(WalkForwardRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request is required");
        }
        PerformanceMetric metric = request.metric();
        String configError = validate(request);
        if (configError != null) {
            log.warn("[WalkForward] invalid configuration reason={}", configError);
            return WalkForwardReport.failed(FailureCode.INVALID_CONFIGURATION, configError, metric, List.of());
        }

        List<WindowSpec> windows = windowPlanner.plan(
                request.rangeStart(),
                request.rangeEnd(),
                request.windowSize(),
                request.oosSize(),
                request.stepSize()
        );
        if (windows.isEmpty()) {
            String reason = "range [" + request.rangeStart() + ", " + request.rangeEnd()
                    + ") is shorter than window_size + oos_size";
            log.warn("[WalkForward] no windows reason={}", reason);
            return WalkForwardReport.failed(FailureCode.NO_WINDOWS, reason, metric, List.of());
        }

        List<WindowResult> windowResults = new ArrayList<>(windows.size());
        for (WindowSpec window : windows) {
            windowResults.add(runWindow(request, window, windows.size()));
        }

        List<WindowResult> successful = new ArrayList<>();
        for (WindowResult result : windowResults) {
            if (result.success()) {
                successful.add(result);
            }
        }
        if (successful.isEmpty()) {
            String reason = "all " + windows.size() + " windows failed";
            log.warn("[WalkForward] no successful window reason={}", reason);
            return WalkForwardReport.failed(FailureCode.NO_SUCCESSFUL_WINDOW, reason, metric, windowResults);
        }

        List<ParameterSet> winners = new ArrayList<>(successful.size());
        double isSum = 0.0;
        double oosSum = 0.0;
        for (WindowResult result : successful) {
            winners.add(result.parameters());
            isSum += metric.extract(result.isMetrics());
            oosSum += metric.extract(result.oosMetrics());
        }
        double meanIs = isSum / successful.size();
        double meanOos = oosSum / successful.size();
        double efficiency = meanIs == 0.0 || !Double.isFinite(meanIs) ? 0.0 : meanOos / meanIs;

        ParameterSet robust = robustParameterAggregator.aggregate(request.domains(), winners);
        PerformanceMetrics fullPeriod = evaluateFullPeriod(request, robust);

        log.info(
                "[WalkForward][Done] windows={} successful={} metric={} meanIs={} meanOos={} efficiency={} robust={}",
                windows.size(),
                successful.size(),
                metric.key(),
                format(meanIs),
                format(meanOos),
                format(efficiency),
                robust
        );
        return new WalkForwardReport(
                true,
                null,
                null,
                metric,
                windowResults,
                robust,
                fullPeriod,
                successful.size(),
                meanIs,
                meanOos,
                efficiency
        );
    }

    private WindowResult runWindow(WalkForwardRequest request, WindowSpec window, int windowCount) {
        String tag = "[WalkForward][Window " + window.windowIndex() + "/" + windowCount + "]";
        log.info(
                "{} is=[{}, {}) oos=[{}, {})",
                tag,
                window.isStart(),
                window.isEnd(),
                window.oosStart(),
                window.oosEnd()
        );

        Map<String, List<OhlcvCandle>> inSample = slice(request.barsBySymbol(), window.isStart(), window.isEnd());
        GridSearchOutcome outcome = gridSearchService.optimize(
                request.domains(),
                parameters -> evaluate(request, inSample, parameters),
                request.metric(),
                request.direction(),
                request.minTrades(),
                optimizationProperties.parallelism()
        );
        if (!outcome.success()) {
            log.warn("{} optimization failed code={} reason={}", tag, outcome.failureCode(), outcome.failureReason());
            return WindowResult.failed(window, null, null, outcome.evaluatedCount(), outcome.failureReason());
        }

        OptimizationResult best = outcome.best().orElseThrow();
        Map<String, List<OhlcvCandle>> outOfSample = slice(request.barsBySymbol(), window.oosStart(), window.oosEnd());
        PerformanceMetrics oosMetrics;
        try {
            oosMetrics = evaluate(request, outOfSample, best.parameters());
        } catch (RuntimeException e) {
            log.warn("{} out-of-sample simulation failed params={} reason={}", tag, best.parameters(), e.getMessage());
            return WindowResult.failed(
                    window,
                    best.parameters(),
                    best.metrics(),
                    outcome.evaluatedCount(),
                    "out-of-sample simulation failed: " + e.getMessage()
            );
        }

        log.info(
                "{} best={} isMetric={} oosMetric={} evaluated={}",
                tag,
                best.parameters(),
                format(request.metric().extract(best.metrics())),
                format(request.metric().extract(oosMetrics)),
                outcome.evaluatedCount()
        );
        return WindowResult.succeeded(window, best.parameters(), best.metrics(), oosMetrics, outcome.evaluatedCount());
    }

    private PerformanceMetrics evaluateFullPeriod(WalkForwardRequest request, ParameterSet robust) {
        Map<String, List<OhlcvCandle>> fullRange = slice(request.barsBySymbol(), request.rangeStart(), request.rangeEnd());
        try {
            return evaluate(request, fullRange, robust);
        } catch (RuntimeException e) {
            log.warn("[WalkForward] full-range validation failed params={} reason={}", robust, e.getMessage());
            return null;
        }
    }

    private PerformanceMetrics evaluate(
            WalkForwardRequest request,
            Map<String, List<OhlcvCandle>> bars,
            ParameterSet parameters
    ) {
        SimulationResult result = simulationService.simulate(
                bars,
                request.strategyFactory().create(parameters),
                request.costModel(),
                request.initialBalance()
        );
        return performanceMetricsService.compute(result);
    }

    private Map<String, List<OhlcvCandle>> slice(Map<String, List<OhlcvCandle>> barsBySymbol, Instant start, Instant end) {
        Map<String, List<OhlcvCandle>> out = new TreeMap<>();
        for (Map.Entry<String, List<OhlcvCandle>> entry : barsBySymbol.entrySet()) {
            List<OhlcvCandle> bars = entry.getValue() == null ? List.of() : entry.getValue();
            List<OhlcvCandle> window = new ArrayList<>();
            for (OhlcvCandle bar : bars) {
                if (bar == null || bar.timestamp() == null) {
                    continue;
                }
                if (!bar.timestamp().isBefore(start) && bar.timestamp().isBefore(end)) {
                    window.add(bar);
                }
            }
            out.put(entry.getKey(), window);
        }
        return out;
    }

    private String validate(WalkForwardRequest request) {
        if (request.barsBySymbol() == null) {
            return "barsBySymbol is required";
        }
        if (request.strategyFactory() == null) {
            return "strategyFactory is required";
        }
        if (request.domains() == null || request.domains().isEmpty()) {
            return "at least one parameter domain is required";
        }
        Set<String> names = new HashSet<>();
        for (ParameterDomain domain : request.domains()) {
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
        if (request.rangeStart() == null || request.rangeEnd() == null
                || !request.rangeStart().isBefore(request.rangeEnd())) {
            return "rangeStart must be before rangeEnd";
        }
        if (!isPositive(request.windowSize())) {
            return "window_size must be > 0";
        }
        if (!isPositive(request.oosSize())) {
            return "oos_size must be > 0";
        }
        if (!isPositive(request.stepSize())) {
            return "step_size must be > 0";
        }
        if (request.metric() == null) {
            return "metric is required";
        }
        if (request.direction() == null) {
            return "direction is required";
        }
        if (request.minTrades() < 0) {
            return "min_trades must be >= 0";
        }
        if (request.costModel() == null) {
            return "costModel is required";
        }
        if (!Double.isFinite(request.initialBalance()) || request.initialBalance() <= 0.0) {
            return "initialBalance must be finite and > 0";
        }
        return null;
    }

    private boolean isPositive(Duration duration) {
        return duration != null && !duration.isZero() && !duration.isNegative();
    }

    private String format(double value) {
        return String.format(Locale.US, "%.4f", value);
    }
}
