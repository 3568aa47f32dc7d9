package org.nowstart.walkforward.data.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record MonteCarloDistribution(
        int numSimulations,
        long seed,
        int tradesPerSimulation,
        double initialBalance,
        double meanFinalBalance,
        double medianFinalBalance,
        double stdevFinalBalance,
        double minFinalBalance,
        double maxFinalBalance,
        Map<Integer, Double> percentiles,
        double worstDrawdown,
        double meanDrawdown,
        double probabilityOfLoss
) {
    public MonteCarloDistribution {
        percentiles = Collections.unmodifiableMap(new LinkedHashMap<>(percentiles));
    }

    public double percentile(int level) {
        Double value = percentiles.get(level);
        if (value == null) {
            throw new IllegalArgumentException("Percentile not computed: " + level);
        }
        return value;
    }
}
