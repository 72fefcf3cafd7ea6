package com.sqlframe.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.sqlframe.resample.FillPolicy;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Everything known about one query execution.
 *
 * <p>Immutable. Interpolation produces a copy through {@link #withSql(String)} so the original SQL stays
 * available for error reporting.
 */
@Value
@Builder(toBuilder = true)
public class QueryContext {
    String sql;
    @Builder.Default
    FormatMode format = FormatMode.TABLE;
    JsonNode connectionArgs;
    String refId;
    /** Null means zero. */
    Duration interval;
    TimeRange timeRange;
    /** Negative means unlimited. */
    @Builder.Default
    long maxRows = -1;
    FillPolicy fillPolicy;
    String schema;
    String table;
    String column;

    public QueryContext withSql(String newSql) {
        return toBuilder().sql(newSql).build();
    }

    public Duration intervalOrZero() {
        return interval != null ? interval : Duration.ZERO;
    }
}
