package org.nowstart.walkforward.data.dto;

import java.util.ArrayList;
import java.util.List;

public record ParameterDomain(
        String name,
        List<Object> values
) {
    public ParameterDomain {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("domain name must not be blank");
        }
        if (values == null) {
            throw new IllegalArgumentException("domain values are required: " + name);
        }
        for (Object value : values) {
            if (value == null) {
                throw new IllegalArgumentException("domain values must not contain null: " + name);
            }
        }
        name = name.trim();
        values = List.copyOf(values);
    }

    public static ParameterDomain of(String name, Object... values) {
        return new ParameterDomain(name, List.of(values));
    }

    public static ParameterDomain range(String name, double start, double end, double step) {
        if (step <= 0) {
            throw new IllegalArgumentException("range step must be > 0: " + name);
        }
        if (end < start) {
            throw new IllegalArgumentException("range end must be >= start: " + name);
        }
        List<Object> out = new ArrayList<>();
        for (double value = start; value <= end + 1e-12; value += step) {
            out.add(value);
        }
        return new ParameterDomain(name, out);
    }

    public int size() {
        return values.size();
    }

    public boolean isNumeric() {
        if (values.isEmpty()) {
            return false;
        }
        for (Object value : values) {
            if (!(value instanceof Number)) {
                return false;
            }
        }
        return true;
    }
}
