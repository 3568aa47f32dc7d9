package org.nowstart.walkforward.service;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.nowstart.walkforward.data.dto.WindowSpec;
import org.springframework.stereotype.Component;

@Component
public class WalkForwardWindowPlanner {

    /**
     * Rolls an in-sample window followed by its out-of-sample period across {@code [rangeStart, rangeEnd)}.
     * A window whose out-of-sample end would pass {@code rangeEnd} is not emitted. Indices start at 1.
     */
    public List<WindowSpec> plan(
            Instant rangeStart,
            Instant rangeEnd,
            Duration windowSize,
            Duration oosSize,
            Duration stepSize
    ) {
        if (rangeStart == null || rangeEnd == null || !rangeStart.isBefore(rangeEnd)) {
            throw new IllegalArgumentException("rangeStart must be before rangeEnd");
        }
        requirePositive(windowSize, "windowSize");
        requirePositive(oosSize, "oosSize");
        requirePositive(stepSize, "stepSize");

        List<WindowSpec> windows = new ArrayList<>();
        Instant isStart = rangeStart;
        while (true) {
            Instant isEnd = plus(isStart, windowSize);
            Instant oosEnd = isEnd == null ? null : plus(isEnd, oosSize);
            if (oosEnd == null || oosEnd.isAfter(rangeEnd)) {
                break;
            }
            windows.add(new WindowSpec(windows.size() + 1, isStart, isEnd, isEnd, oosEnd));
            isStart = plus(isStart, stepSize);
            if (isStart == null) {
                break;
            }
        }
        return List.copyOf(windows);
    }

    // null once the sum leaves the Instant range
    private Instant plus(Instant instant, Duration duration) {
        try {
            return instant.plus(duration);
        } catch (ArithmeticException | DateTimeException e) {
            return null;
        }
    }

    private void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }
}
