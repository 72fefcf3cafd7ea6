package com.sqlframe.model;

import lombok.Value;

import java.time.Instant;
import java.util.Objects;

/**
 * Inclusive time range of a query.
 */
@Value
public class TimeRange {
    Instant from;
    Instant to;

    public static TimeRange of(Instant from, Instant to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("time range ends before it starts: " + from + " > " + to);
        }
        return new TimeRange(from, to);
    }
}
