package org.nowstart.walkforward.risk;

import lombok.extern.slf4j.Slf4j;
import org.nowstart.walkforward.data.property.BacktestProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Risks a fixed fraction of the balance between entry and stop-loss. Volumes are floored to
 * {@code volumeStep} and clamped to {@code [minVolume, maxVolume]}.
 */
@Slf4j
@Component
public class FixedFractionalPositionSizer implements PositionSizer {

    private static final double STEP_EPSILON = 1e-9;

    private final double minVolume;
    private final double maxVolume;
    private final double volumeStep;

    @Autowired
    public FixedFractionalPositionSizer(BacktestProperties properties) {
        this(properties.minVolume(), properties.maxVolume(), properties.volumeStep());
    }

    public FixedFractionalPositionSizer(double minVolume, double maxVolume, double volumeStep) {
        if (!(minVolume > 0.0) || !(maxVolume >= minVolume) || !(volumeStep > 0.0)) {
            throw new IllegalArgumentException(
                    "invalid volume bounds min=" + minVolume + ", max=" + maxVolume + ", step=" + volumeStep
            );
        }
        this.minVolume = minVolume;
        this.maxVolume = maxVolume;
        this.volumeStep = volumeStep;
    }

    @Override
    public double size(double entryPrice, double stopLoss, double accountBalance, double riskFraction) {
        if (!Double.isFinite(accountBalance) || accountBalance <= 0.0) {
            return 0.0;
        }
        double riskAmount = accountBalance * riskFraction;
        if (!Double.isFinite(riskAmount) || riskAmount <= 0.0) {
            return 0.0;
        }
        if (Double.isNaN(stopLoss)) {
            return minVolume;
        }
        double distance = Math.abs(entryPrice - stopLoss);
        if (!Double.isFinite(distance) || distance == 0.0) {
            log.debug("[Sizer] zero stop distance entry={} stop={}", entryPrice, stopLoss);
            return 0.0;
        }
        double raw = riskAmount / distance;
        double stepped = Math.floor(raw / volumeStep + STEP_EPSILON) * volumeStep;
        return Math.min(maxVolume, Math.max(minVolume, stepped));
    }
}
