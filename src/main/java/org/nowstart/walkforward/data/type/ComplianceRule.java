package org.nowstart.walkforward.data.type;

public enum ComplianceRule {
    PROFIT_TARGET,
    DAILY_LOSS,
    TOTAL_DRAWDOWN,
    TRADING_DAYS
}
