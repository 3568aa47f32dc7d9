package org.nowstart.walkforward.data.dto;

import java.time.Instant;

public record EquityPoint(
        Instant timestamp,
        double balance,
        double equity,
        int openPositionCount
) {
}
