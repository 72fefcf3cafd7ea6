package com.sqlframe.service;

import com.zaxxer.hikari.SQLExceptionOverride;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class HikariSqlExceptionOverrideTest {

    private final HikariSqlExceptionOverride override = new HikariSqlExceptionOverride();

    @Test
    public void testUserErrorsKeepConnection() {
        assertEquals(SQLExceptionOverride.Override.DO_NOT_EVICT,
                override.adjudicate(new SQLException("syntax error", "42601")));
        assertEquals(SQLExceptionOverride.Override.DO_NOT_EVICT,
                override.adjudicate(new SQLException("division by zero", "22012")));
        assertEquals(SQLExceptionOverride.Override.DO_NOT_EVICT,
                override.adjudicate(new SQLFeatureNotSupportedException("nope")));
    }

    @Test
    public void testConnectionErrorsEvict() {
        assertEquals(SQLExceptionOverride.Override.CONTINUE_EVICT,
                override.adjudicate(new SQLException("connection reset", "08006")));
        assertEquals(SQLExceptionOverride.Override.CONTINUE_EVICT,
                override.adjudicate(new SQLException("unknown")));
        assertEquals(SQLExceptionOverride.Override.CONTINUE_EVICT, override.adjudicate(null));
    }
}
