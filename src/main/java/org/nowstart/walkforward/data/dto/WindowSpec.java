package org.nowstart.walkforward.data.dto;

import java.time.Instant;

/**
 * One walk-forward window. Both periods are half-open: {@code [isStart, isEnd)} and {@code [oosStart, oosEnd)}.
 */
public record WindowSpec(
        int windowIndex,
        Instant isStart,
        Instant isEnd,
        Instant oosStart,
        Instant oosEnd
) {
    public WindowSpec {
        if (isStart == null || isEnd == null || oosStart == null || oosEnd == null) {
            throw new IllegalArgumentException("window boundaries are required");
        }
        if (!isStart.isBefore(isEnd)) {
            throw new IllegalArgumentException("isStart must be before isEnd");
        }
        if (!oosStart.equals(isEnd)) {
            throw new IllegalArgumentException("oosStart must equal isEnd");
        }
        if (!oosStart.isBefore(oosEnd)) {
            throw new IllegalArgumentException("oosStart must be before oosEnd");
        }
    }
}
