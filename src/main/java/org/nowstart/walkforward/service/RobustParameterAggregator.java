package org.nowstart.walkforward.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.nowstart.walkforward.data.dto.ParameterDomain;
import org.nowstart.walkforward.data.dto.ParameterSet;
import org.springframework.stereotype.Component;

/**
 * Combines the per-window winners into one parameter set. Numeric parameters take the mean snapped
 * back onto the domain grid; categorical ones take the most frequent value.
 */
@Component
public class RobustParameterAggregator {

    public ParameterSet aggregate(List<ParameterDomain> domains, List<ParameterSet> winners) {
        if (domains == null || domains.isEmpty()) {
            throw new IllegalArgumentException("domains are required");
        }
        if (winners == null || winners.isEmpty()) {
            throw new IllegalArgumentException("at least one winning parameter set is required");
        }

        Map<String, Object> values = new LinkedHashMap<>();
        for (ParameterDomain domain : domains) {
            Object value = domain.isNumeric()
                    ? snappedMean(domain, winners)
                    : mode(domain, winners);
            values.put(domain.name(), value);
        }
        return new ParameterSet(values);
    }

    private Object snappedMean(ParameterDomain domain, List<ParameterSet> winners) {
        double sum = 0.0;
        for (ParameterSet winner : winners) {
            sum += winner.getDouble(domain.name());
        }
        double mean = sum / winners.size();

        Object nearest = null;
        double nearestDistance = Double.POSITIVE_INFINITY;
        for (Object candidate : domain.values()) {
            double distance = Math.abs(((Number) candidate).doubleValue() - mean);
            if (distance < nearestDistance) {
                nearest = candidate;
                nearestDistance = distance;
            }
        }
        return nearest;
    }

    private Object mode(ParameterDomain domain, List<ParameterSet> winners) {
        Map<Object, Integer> counts = new LinkedHashMap<>();
        for (ParameterSet winner : winners) {
            counts.merge(winner.get(domain.name()), 1, Integer::sum);
        }
        Object best = null;
        int bestCount = 0;
        for (Map.Entry<Object, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }
}
