package com.sqlframe.dialect;

import java.util.Locale;
import java.util.Map;

/**
 * Dialect lookup by database type name.
 *
 * <p>Engines that share a dialect are listed as aliases; {@code h2} speaks enough PostgreSQL for the
 * time macros.
 */
public final class SqlDialects {

    private static final Map<String, SqlDialect> BY_DB_TYPE = Map.ofEntries(
            Map.entry("postgres", PostgresDialect.INSTANCE),
            Map.entry("postgresql", PostgresDialect.INSTANCE),
            Map.entry("pg", PostgresDialect.INSTANCE),
            Map.entry("pgsql", PostgresDialect.INSTANCE),
            Map.entry("timescale", PostgresDialect.INSTANCE),
            Map.entry("timescaledb", PostgresDialect.INSTANCE),
            Map.entry("opengauss", PostgresDialect.INSTANCE),
            Map.entry("h2", PostgresDialect.INSTANCE),
            Map.entry("mysql", MySqlDialect.INSTANCE),
            Map.entry("mariadb", MySqlDialect.INSTANCE)
    );

    private SqlDialects() {
    }

    /**
     * @param dbType database type or alias, any case; blank selects PostgreSQL
     * @return dialect for the type
     * @throws IllegalArgumentException for unsupported types
     */
    public static SqlDialect forDbType(String dbType) {
        if (dbType == null || dbType.isBlank()) {
            return PostgresDialect.INSTANCE;
        }
        SqlDialect dialect = BY_DB_TYPE.get(dbType.trim().toLowerCase(Locale.ROOT));
        if (dialect == null) {
            throw new IllegalArgumentException("Unsupported dbType for macros: " + dbType);
        }
        return dialect;
    }
}
