package org.nowstart.walkforward.data.type;

public enum SignalAction {
    ENTER_LONG,
    ENTER_SHORT,
    EXIT,
    NONE;

    public boolean isEntry() {
        return this == ENTER_LONG || this == ENTER_SHORT;
    }

    public TradeDirection direction() {
        return switch (this) {
            case ENTER_LONG -> TradeDirection.LONG;
            case ENTER_SHORT -> TradeDirection.SHORT;
            default -> throw new IllegalStateException("No direction for action=" + this);
        };
    }
}
