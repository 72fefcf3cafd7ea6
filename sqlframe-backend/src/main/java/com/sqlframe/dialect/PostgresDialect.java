package com.sqlframe.dialect;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

/**
 * PostgreSQL, TimescaleDB and other engines that understand {@code extract(epoch from ...)}.
 */
public final class PostgresDialect implements SqlDialect {
    public static final PostgresDialect INSTANCE = new PostgresDialect();

    private PostgresDialect() {
    }

    @Override
    public String getName() {
        return "postgres";
    }

    @Override
    public String timestampLiteral(Instant instant) {
        return "'" + DateTimeFormatter.ISO_INSTANT.format(instant) + "'";
    }

    @Override
    public String timeGroup(String column, Duration period) {
        long millis = period.toMillis();
        if (millis % 1000 == 0) {
            long seconds = millis / 1000;
            return "floor(extract(epoch from " + column + ")/" + seconds + ")*" + seconds;
        }
        return "floor(extract(epoch from " + column + ")*1000/" + millis + ")*" + millis + "/1000.0";
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
