package org.nowstart.walkforward.data.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable parameter assignment for one strategy run. Iteration order is the insertion order,
 * equality is the exact name/value contents.
 */
public record ParameterSet(Map<String, Object> values) {

    public ParameterSet {
        if (values == null) {
            throw new IllegalArgumentException("parameter values are required");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new IllegalArgumentException("parameter name must not be blank");
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("parameter value must not be null: " + entry.getKey());
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        values = Collections.unmodifiableMap(copy);
    }

    public static ParameterSet of(Map<String, ?> values) {
        return new ParameterSet(new LinkedHashMap<String, Object>(values));
    }

    public Set<String> names() {
        return values.keySet();
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Object get(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Unknown parameter: " + name);
        }
        return value;
    }

    public double getDouble(String name) {
        return asNumber(name).doubleValue();
    }

    public int getInt(String name) {
        return (int) Math.round(asNumber(name).doubleValue());
    }

    public String getString(String name) {
        return String.valueOf(get(name));
    }

    private Number asNumber(String name) {
        Object value = get(name);
        if (!(value instanceof Number number)) {
            throw new IllegalArgumentException("Parameter is not numeric: " + name + "=" + value);
        }
        return number;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
