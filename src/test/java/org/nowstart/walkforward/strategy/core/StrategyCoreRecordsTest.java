package org.nowstart.walkforward.strategy.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.walkforward.data.dto.Position;
import org.nowstart.walkforward.data.type.PositionState;
import org.nowstart.walkforward.data.type.SignalAction;
import org.nowstart.walkforward.data.type.TradeDirection;

class StrategyCoreRecordsTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void ohlcvCandle_detectsMalformedBars() {
        assertThat(new OhlcvCandle(T0, 100, 101, 99, 100.5, 10).isWellFormed()).isTrue();
        assertThat(new OhlcvCandle(T0, 100, 99, 101, 100, 10).isWellFormed()).isFalse();
        assertThat(new OhlcvCandle(T0, 100, 101, 99, 102, 10).isWellFormed()).isFalse();
        assertThat(new OhlcvCandle(T0, 0, 101, 99, 100, 10).isWellFormed()).isFalse();
        assertThat(new OhlcvCandle(T0, 100, 101, 99, Double.NaN, 10).isWellFormed()).isFalse();
        assertThat(new OhlcvCandle(T0, 100, 101, 99, 100, -1).isWellFormed()).isFalse();
        assertThat(new OhlcvCandle(null, 100, 101, 99, 100, 1).isWellFormed()).isFalse();
    }

    @Test
    void positionSnapshot_reflectsOpenPosition() {
        Position position = new Position("XAUUSD", TradeDirection.SHORT, T0, 2_000, 0.5, 2_020, Double.NaN);

        PositionSnapshot snapshot = PositionSnapshot.of(position);

        assertThat(snapshot.hasPosition()).isTrue();
        assertThat(snapshot.state()).isEqualTo(PositionState.SHORT);
        assertThat(snapshot.entryPrice()).isEqualTo(2_000.0);
        assertThat(PositionSnapshot.of(null)).isSameAs(PositionSnapshot.EMPTY);
        assertThat(PositionSnapshot.EMPTY.state()).isEqualTo(PositionState.FLAT);
    }

    @Test
    void strategyInput_defaultsToFlatPositionAndExposesCurrentBar() {
        OhlcvCandle last = new OhlcvCandle(T0.plusSeconds(60), 101, 102, 100, 101.5, 5);
        StrategyInput input = new StrategyInput("XAUUSD", List.of(new OhlcvCandle(T0, 100, 101, 99, 100, 5), last), null);

        assertThat(input.position()).isEqualTo(PositionSnapshot.EMPTY);
        assertThat(input.current()).isEqualTo(last);
    }

    @Test
    void strategySignal_factoriesSetAction() {
        assertThat(StrategySignal.none().action()).isEqualTo(SignalAction.NONE);
        assertThat(StrategySignal.exit("trail").action()).isEqualTo(SignalAction.EXIT);
        StrategySignal entry = StrategySignal.enterLong(Double.NaN, 95, 110, "breakout");
        assertThat(entry.action().isEntry()).isTrue();
        assertThat(entry.entryPrice()).isNaN();
        assertThat(new StrategySignal(null, 1, 1, 1, null).action()).isEqualTo(SignalAction.NONE);
    }
}
