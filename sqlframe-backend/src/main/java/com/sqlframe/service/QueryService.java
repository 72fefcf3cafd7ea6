package com.sqlframe.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.sqlframe.api.QueryRequest;
import com.sqlframe.convert.FrameBuilder;
import com.sqlframe.dialect.SqlDialects;
import com.sqlframe.frame.Frame;
import com.sqlframe.frame.Notice;
import com.sqlframe.macro.MacroInterpolator;
import com.sqlframe.macro.Macros;
import com.sqlframe.model.FormatMode;
import com.sqlframe.model.QueryContext;
import com.sqlframe.model.TimeRange;
import com.sqlframe.resample.FillMode;
import com.sqlframe.resample.FillPolicy;
import com.sqlframe.resample.Resampler;
import com.sqlframe.source.JdbcRowSource;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the query-to-frame pipeline: interpolate macros, execute, convert every result set, and
 * optionally resample time series onto the interval grid.
 */
@Slf4j
@Service
public class QueryService {
    private static final String MDC_REF_ID = "ref_id";

    private final DataSource dataSource;
    private final FrameBuilder frameBuilder;
    private final Macros macros;
    private final ConverterConfigRegistry converterConfigRegistry;
    private final long defaultRowLimit;
    private final int fetchSize;
    private final int queryTimeoutSeconds;

    public QueryService(
            DataSource dataSource,
            FrameBuilder frameBuilder,
            Macros macros,
            ConverterConfigRegistry converterConfigRegistry,
            @Value("${sqlframe.query.row-limit:1000000}") long defaultRowLimit,
            @Value("${sqlframe.query.fetch-size:1000}") int fetchSize,
            @Value("${sqlframe.query.timeout-seconds:30}") int queryTimeoutSeconds
    ) {
        this.dataSource = dataSource;
        this.frameBuilder = frameBuilder;
        this.macros = macros;
        this.converterConfigRegistry = converterConfigRegistry;
        this.defaultRowLimit = defaultRowLimit;
        this.fetchSize = fetchSize;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    /**
     * Builds the immutable query context for an API request.
     *
     * @param request validated request
     * @return context with configured defaults applied
     */
    public QueryContext toContext(QueryRequest request) {
        TimeRange range = null;
        if (request.getFrom() != null || request.getTo() != null) {
            if (request.getFrom() == null || request.getTo() == null) {
                throw new IllegalArgumentException("from and to must be given together");
            }
            range = TimeRange.of(request.getFrom(), request.getTo());
        }

        return QueryContext.builder()
                .sql(request.getSql())
                .format(request.getFormat() != null ? request.getFormat() : FormatMode.TABLE)
                .connectionArgs(request.getConnectionArgs())
                .refId(request.getRefId() != null ? request.getRefId() : "A")
                .interval(request.getIntervalMs() != null ? Duration.ofMillis(request.getIntervalMs()) : null)
                .timeRange(range)
                .maxRows(request.getMaxRows() != null ? request.getMaxRows() : defaultRowLimit)
                .fillPolicy(toFillPolicy(request))
                .schema(request.getSchema())
                .table(request.getTable())
                .column(request.getColumn())
                .build();
    }

    private static FillPolicy toFillPolicy(QueryRequest request) {
        FillMode mode = request.getFillMode();
        if (mode == null) {
            return null;
        }
        switch (mode) {
            case PREVIOUS:
                return FillPolicy.previous();
            case VALUE:
                Map<String, Object> perColumn = request.getFillValues();
                return perColumn != null && !perColumn.isEmpty()
                        ? FillPolicy.values(perColumn, request.getFillValue())
                        : FillPolicy.value(request.getFillValue());
            case NULL:
            default:
                return FillPolicy.nulls();
        }
    }

    /**
     * Interpolates the query's macros.
     *
     * <p>{@code connection_args.db_type} selects another dialect than the configured one.
     */
    public QueryContext interpolate(QueryContext ctx) {
        return MacroInterpolator.interpolate(ctx, macrosFor(ctx));
    }

    private Macros macrosFor(QueryContext ctx) {
        String dbType = connectionArg(ctx, "db_type");
        if (dbType == null || dbType.isBlank()) {
            return macros;
        }
        return Macros.defaults(SqlDialects.forDbType(dbType));
    }

    /**
     * Executes a query and returns one frame per result set.
     *
     * @param ctx query context
     * @return frames in result set order
     * @throws SQLException on driver errors
     */
    public List<Frame> query(QueryContext ctx) throws SQLException {
        MDC.put(MDC_REF_ID, ctx.getRefId());
        try {
            QueryContext interpolated = interpolate(ctx);
            String sql = interpolated.getSql();
            log.info("Executing query: ref_id={}, format={}, max_rows={}", ctx.getRefId(), ctx.getFormat(), ctx.getMaxRows());
            log.debug("Interpolated SQL: {}", sql);

            long start = System.currentTimeMillis();
            List<Frame> frames = execute(ctx, sql);
            long duration = System.currentTimeMillis() - start;

            List<Frame> out = new ArrayList<>(frames.size());
            for (Frame frame : frames) {
                frame.setName(ctx.getRefId());
                frame.setRefId(ctx.getRefId());
                frame.getMeta().setExecutedQueryString(sql);
                frame.getMeta().getCustom().put("duration_ms", duration);
                out.add(shouldResample(ctx) ? resample(ctx, frame) : frame);
            }

            log.info("Query completed: ref_id={}, frames={}, duration_ms={}", ctx.getRefId(), out.size(), duration);
            return out;
        } finally {
            MDC.remove(MDC_REF_ID);
        }
    }

    private List<Frame> execute(QueryContext ctx, String sql) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            if (connectionFlag(ctx, "read_only")) {
                conn.setReadOnly(true);
            }

            try (Statement stmt = conn.createStatement()) {
                if (queryTimeoutSeconds > 0) {
                    stmt.setQueryTimeout(queryTimeoutSeconds);
                }
                if (fetchSize > 0) {
                    stmt.setFetchSize(fetchSize);
                }

                boolean hasResultSet = stmt.execute(sql);
                int updateCount = 0;
                while (!hasResultSet) {
                    int count = stmt.getUpdateCount();
                    if (count == -1) {
                        return List.of(noResultFrame(updateCount));
                    }
                    updateCount += count;
                    hasResultSet = stmt.getMoreResults();
                }

                return frameBuilder.buildFrames(JdbcRowSource.forStatement(stmt), ctx.getMaxRows(),
                        converterConfigRegistry.getConverters());
            }
        }
    }

    private static Frame noResultFrame(int updateCount) {
        Frame frame = new Frame();
        frame.getMeta().addNotice(Notice.Severity.INFO,
                "Query executed successfully. Rows affected: " + updateCount);
        return frame;
    }

    private static boolean shouldResample(QueryContext ctx) {
        return ctx.getFormat() == FormatMode.TIME_SERIES && ctx.getFillPolicy() != null;
    }

    private static Frame resample(QueryContext ctx, Frame frame) {
        if (frame.getFields().isEmpty()) {
            return frame;
        }
        if (ctx.getTimeRange() == null || ctx.intervalOrZero().isZero()) {
            throw new IllegalArgumentException("fill_mode requires a time range and a positive interval");
        }
        return Resampler.resample(frame, ctx.getFillPolicy(), ctx.getTimeRange(), ctx.getInterval());
    }

    private static String connectionArg(QueryContext ctx, String key) {
        JsonNode args = ctx.getConnectionArgs();
        if (args == null || !args.hasNonNull(key)) {
            return null;
        }
        return args.get(key).asText();
    }

    private static boolean connectionFlag(QueryContext ctx, String key) {
        JsonNode args = ctx.getConnectionArgs();
        return args != null && args.hasNonNull(key) && args.get(key).asBoolean(false);
    }
}
