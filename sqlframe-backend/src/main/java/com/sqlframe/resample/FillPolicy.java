package com.sqlframe.resample;

import lombok.Value;

import java.util.Map;
import java.util.Objects;

/**
 * How the resampler fills a slot that has no source point.
 */
@Value
public class FillPolicy {
    FillMode mode;
    Object value;
    Map<String, Object> columnValues;

    public static FillPolicy previous() {
        return new FillPolicy(FillMode.PREVIOUS, null, Map.of());
    }

    public static FillPolicy nulls() {
        return new FillPolicy(FillMode.NULL, null, Map.of());
    }

    /**
     * Fills every value column with {@code value}.
     */
    public static FillPolicy value(Object value) {
        return new FillPolicy(FillMode.VALUE, value, Map.of());
    }

    /**
     * Fills named columns with their own value and the rest with {@code defaultValue}.
     */
    public static FillPolicy values(Map<String, Object> columnValues, Object defaultValue) {
        return new FillPolicy(FillMode.VALUE, defaultValue, Map.copyOf(Objects.requireNonNull(columnValues)));
    }

    public Object valueFor(String column) {
        if (columnValues != null && columnValues.containsKey(column)) {
            return columnValues.get(column);
        }
        return value;
    }
}
