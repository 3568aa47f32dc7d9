package org.nowstart.walkforward.data.type;

/**
 * Resolves a bar whose range touches both the stop-loss and the take-profit level.
 * The order of the two touches inside the bar is unknown, so the engine has to pick one.
 */
public enum IntrabarExitPolicy {
    STOP_LOSS_FIRST,
    TAKE_PROFIT_FIRST
}
