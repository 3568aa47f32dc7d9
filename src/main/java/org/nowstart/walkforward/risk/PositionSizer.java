package org.nowstart.walkforward.risk;

/**
 * Turns a risk budget into a position volume. A non-positive result means "do not enter".
 */
public interface PositionSizer {

    double size(double entryPrice, double stopLoss, double accountBalance, double riskFraction);
}
