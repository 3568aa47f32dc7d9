package org.nowstart.walkforward.data.dto;

/**
 * Account-level challenge rules. All values are fractions except the day count.
 */
public record ComplianceRules(
        double profitTarget,
        double maxDailyLoss,
        double maxTotalDrawdown,
        int minTradingDays
) {
    public ComplianceRules {
        if (!Double.isFinite(profitTarget)) {
            throw new IllegalArgumentException("profit-target must be finite");
        }
        if (!Double.isFinite(maxDailyLoss) || maxDailyLoss < 0.0) {
            throw new IllegalArgumentException("max-daily-loss must be finite and >= 0");
        }
        if (!Double.isFinite(maxTotalDrawdown) || maxTotalDrawdown < 0.0) {
            throw new IllegalArgumentException("max-total-drawdown must be finite and >= 0");
        }
        if (minTradingDays < 0) {
            throw new IllegalArgumentException("min-trading-days must be >= 0");
        }
    }

    public static ComplianceRules ftmoDefaults() {
        return new ComplianceRules(0.10, 0.05, 0.10, 4);
    }
}
