package com.sqlframe.service;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;

/**
 * HikariCP SQL exception override that keeps pooled connections alive when an ad-hoc query fails
 * for reasons unrelated to the connection.
 *
 * <p>User-written SQL often fails with syntax or permission errors (SQLSTATE class 42), unsupported
 * features (class 0A) or data errors such as bad casts (class 22). None of these mean the connection is
 * broken.
 */
public class HikariSqlExceptionOverride implements SQLExceptionOverride {

    /**
     * Decide whether Hikari should evict a connection based on the exception.
     *
     * @param sqlException SQL exception
     * @return override decision
     */
    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }

        if (sqlException instanceof SQLFeatureNotSupportedException) {
            return Override.DO_NOT_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState != null && (sqlState.startsWith("0A") || sqlState.startsWith("42") || sqlState.startsWith("22"))) {
            return Override.DO_NOT_EVICT;
        }

        return Override.CONTINUE_EVICT;
    }
}
