package org.nowstart.walkforward.strategy.core;

import java.time.Instant;
import org.nowstart.walkforward.data.dto.Position;
import org.nowstart.walkforward.data.type.PositionState;
import org.nowstart.walkforward.data.type.TradeDirection;

/**
 * Read-only view of the position a strategy is asked about. {@link #EMPTY} stands for flat.
 */
public record PositionSnapshot(
        TradeDirection direction,
        double volume,
        double entryPrice,
        Instant entryTime
) {
    public static final PositionSnapshot EMPTY = new PositionSnapshot(null, 0.0, 0.0, null);

    public static PositionSnapshot of(Position position) {
        if (position == null) {
            return EMPTY;
        }
        return new PositionSnapshot(
                position.direction(),
                position.volume(),
                position.entryPrice(),
                position.entryTime()
        );
    }

    public boolean hasPosition() {
        return direction != null && Double.isFinite(volume) && volume > 0.0;
    }

    public PositionState state() {
        if (!hasPosition()) {
            return PositionState.FLAT;
        }
        return direction == TradeDirection.LONG ? PositionState.LONG : PositionState.SHORT;
    }
}
