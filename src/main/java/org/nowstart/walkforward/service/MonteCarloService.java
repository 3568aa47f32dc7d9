package org.nowstart.walkforward.service;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.walkforward.data.dto.MonteCarloDistribution;
import org.nowstart.walkforward.data.dto.Trade;
import org.nowstart.walkforward.data.property.MonteCarloProperties;
import org.springframework.stereotype.Service;

/**
 * Bootstrap resampling of a trade log. Each simulation gets its own seed derived up front from the
 * caller's seed, so the distribution is identical for any parallelism.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MonteCarloService {

    private static final int[] PERCENTILE_LEVELS = {5, 25, 50, 75, 95};

    private final MonteCarloProperties monteCarloProperties;

    public MonteCarloDistribution resample(List<Trade> trades, double initialBalance) {
        return resample(trades, initialBalance, monteCarloProperties.simulations(), monteCarloProperties.seed());
    }

    public MonteCarloDistribution resample(List<Trade> trades, double initialBalance, int numSimulations, long seed) {
        if (numSimulations <= 0) {
            throw new IllegalArgumentException("numSimulations must be > 0");
        }
        if (!Double.isFinite(initialBalance) || initialBalance <= 0.0) {
            throw new IllegalArgumentException("initialBalance must be finite and > 0");
        }
        List<Trade> safeTrades = trades == null ? List.of() : trades;
        if (safeTrades.isEmpty()) {
            log.info("[MonteCarlo] no trades, returning degenerate distribution simulations={}", numSimulations);
            return degenerate(numSimulations, seed, initialBalance);
        }

        double[] returns = new double[safeTrades.size()];
        for (int i = 0; i < returns.length; i++) {
            returns[i] = safeTrades.get(i).profitLoss() / initialBalance;
        }

        SplittableRandom root = new SplittableRandom(seed);
        long[] seeds = new long[numSimulations];
        for (int i = 0; i < numSimulations; i++) {
            seeds[i] = root.nextLong();
        }

        double[] finals = new double[numSimulations];
        double[] drawdowns = new double[numSimulations];
        ParallelIndexRunner.run(numSimulations, monteCarloProperties.parallelism(), index -> {
            double[] path = simulatePath(returns, initialBalance, new SplittableRandom(seeds[index]));
            finals[index] = path[0];
            drawdowns[index] = path[1];
        }, "Monte Carlo resampling");

        MonteCarloDistribution distribution = summarize(numSimulations, seed, returns.length, initialBalance, finals, drawdowns);
        log.info(
                "[MonteCarlo][Done] simulations={} trades={} mean={} p5={} p95={} worstDrawdown={} probabilityOfLoss={}",
                numSimulations,
                returns.length,
                distribution.meanFinalBalance(),
                distribution.percentile(5),
                distribution.percentile(95),
                distribution.worstDrawdown(),
                distribution.probabilityOfLoss()
        );
        return distribution;
    }

    private double[] simulatePath(double[] returns, double initialBalance, SplittableRandom random) {
        double balance = initialBalance;
        double peak = initialBalance;
        double maxDrawdown = 0.0;
        for (int i = 0; i < returns.length; i++) {
            balance = Math.max(0.0, balance * (1.0 + returns[random.nextInt(returns.length)]));
            if (balance > peak) {
                peak = balance;
            } else if (peak > 0.0) {
                maxDrawdown = Math.max(maxDrawdown, (peak - balance) / peak);
            }
        }
        return new double[] {balance, maxDrawdown};
    }

    private MonteCarloDistribution summarize(
            int numSimulations,
            long seed,
            int tradesPerSimulation,
            double initialBalance,
            double[] finals,
            double[] drawdowns
    ) {
        double[] sorted = finals.clone();
        Arrays.sort(sorted);

        double sum = 0.0;
        int losing = 0;
        for (double value : finals) {
            sum += value;
            if (value < initialBalance) {
                losing++;
            }
        }
        double mean = sum / numSimulations;
        double sumSq = 0.0;
        for (double value : finals) {
            sumSq += (value - mean) * (value - mean);
        }
        double stdev = numSimulations > 1 ? Math.sqrt(sumSq / (numSimulations - 1)) : 0.0;

        double worstDrawdown = 0.0;
        double drawdownSum = 0.0;
        for (double drawdown : drawdowns) {
            worstDrawdown = Math.max(worstDrawdown, drawdown);
            drawdownSum += drawdown;
        }

        Map<Integer, Double> percentiles = new LinkedHashMap<>();
        for (int level : PERCENTILE_LEVELS) {
            percentiles.put(level, percentile(sorted, level));
        }

        return new MonteCarloDistribution(
                numSimulations,
                seed,
                tradesPerSimulation,
                initialBalance,
                mean,
                percentile(sorted, 50),
                stdev,
                sorted[0],
                sorted[sorted.length - 1],
                percentiles,
                worstDrawdown,
                drawdownSum / numSimulations,
                losing / (double) numSimulations
        );
    }

    private MonteCarloDistribution degenerate(int numSimulations, long seed, double initialBalance) {
        Map<Integer, Double> percentiles = new LinkedHashMap<>();
        for (int level : PERCENTILE_LEVELS) {
            percentiles.put(level, initialBalance);
        }
        return new MonteCarloDistribution(
                numSimulations,
                seed,
                0,
                initialBalance,
                initialBalance,
                initialBalance,
                0.0,
                initialBalance,
                initialBalance,
                percentiles,
                0.0,
                0.0,
                0.0
        );
    }

    // linear interpolation between closest ranks
    private double percentile(double[] sorted, double level) {
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = (level / 100.0) * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = Math.min(sorted.length - 1, lower + 1);
        double weight = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * weight;
    }
}
