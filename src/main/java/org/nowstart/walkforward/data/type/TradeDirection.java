package org.nowstart.walkforward.data.type;

public enum TradeDirection {
    LONG(1),
    SHORT(-1);

    private final int sign;

    TradeDirection(int sign) {
        this.sign = sign;
    }

    public int sign() {
        return sign;
    }
}
