package com.sqlframe.dialect;

import java.time.Duration;
import java.time.Instant;

/**
 * Database-specific SQL fragments emitted by the time macros.
 */
public interface SqlDialect {

    String getName();

    /**
     * Timestamp literal comparable with a timestamp column.
     */
    String timestampLiteral(Instant instant);

    /**
     * Expression bucketing {@code column} into {@code period}-sized groups, in epoch seconds.
     */
    String timeGroup(String column, Duration period);

    String quoteIdentifier(String identifier);
}
