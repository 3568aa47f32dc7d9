package org.nowstart.walkforward.data.type;

public enum ExitReason {
    SIGNAL,
    STOP_LOSS,
    TAKE_PROFIT
}
