package com.sqlframe.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.sqlframe.model.FormatMode;
import com.sqlframe.resample.FillMode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QueryRequest {
    private String refId;

    @NotBlank(message = "SQL is required")
    private String sql;

    private FormatMode format = FormatMode.TABLE;

    @PositiveOrZero(message = "interval_ms must not be negative")
    private Long intervalMs;

    private Instant from;
    private Instant to;

    /** Omitted uses the configured default; negative disables the cap. */
    private Long maxRows;

    private FillMode fillMode;
    private Object fillValue;
    private Map<String, Object> fillValues;

    private String schema;
    private String table;
    private String column;

    private JsonNode connectionArgs;
}
