package org.nowstart.walkforward.data.type;

public enum PositionState {
    FLAT,
    LONG,
    SHORT
}
