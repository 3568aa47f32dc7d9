package org.nowstart.walkforward.data.type;

import java.util.Locale;

public enum OptimizationDirection {
    MAXIMIZE,
    MINIMIZE;

    public static OptimizationDirection fromKey(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("optimization direction is required");
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
