package com.sqlframe.model;

public enum FormatMode {
    TIME_SERIES,
    TABLE,
    LOGS,
    TRACE,
    MULTI
}
