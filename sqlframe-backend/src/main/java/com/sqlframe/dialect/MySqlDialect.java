package com.sqlframe.dialect;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * MySQL and MariaDB.
 */
public final class MySqlDialect implements SqlDialect {
    public static final MySqlDialect INSTANCE = new MySqlDialect();

    private static final DateTimeFormatter LITERAL =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC);

    private MySqlDialect() {
    }

    @Override
    public String getName() {
        return "mysql";
    }

    @Override
    public String timestampLiteral(Instant instant) {
        return "'" + LITERAL.format(instant) + "'";
    }

    @Override
    public String timeGroup(String column, Duration period) {
        long millis = period.toMillis();
        if (millis % 1000 == 0) {
            long seconds = millis / 1000;
            return "UNIX_TIMESTAMP(" + column + ") DIV " + seconds + " * " + seconds;
        }
        return "FLOOR(UNIX_TIMESTAMP(" + column + ")*1000/" + millis + ")*" + millis + "/1000";
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }
}
