package com.sqlframe.macro;

import com.sqlframe.dialect.SqlDialect;
import com.sqlframe.error.MacroArgumentException;
import com.sqlframe.model.QueryContext;
import com.sqlframe.model.TimeRange;

import java.time.Duration;
import java.util.List;

/**
 * Implementations of the built-in macros.
 */
final class DefaultMacros {
    private static final String INTERVAL_TOKEN = "$__interval";

    private final SqlDialect dialect;

    DefaultMacros(SqlDialect dialect) {
        this.dialect = dialect;
    }

    String interval(QueryContext ctx, List<String> args) {
        noArgs("interval", args);
        return IntervalFormat.format(ctx.intervalOrZero());
    }

    String intervalMs(QueryContext ctx, List<String> args) {
        noArgs("interval_ms", args);
        return Long.toString(ctx.intervalOrZero().toMillis());
    }

    String timeFilter(QueryContext ctx, List<String> args) {
        String col = singleColumn("timeFilter", args);
        TimeRange range = range("timeFilter", ctx);
        return col + " >= " + dialect.timestampLiteral(range.getFrom())
                + " AND " + col + " <= " + dialect.timestampLiteral(range.getTo());
    }

    String timeFrom(QueryContext ctx, List<String> args) {
        String col = singleColumn("timeFrom", args);
        return col + " >= " + dialect.timestampLiteral(range("timeFrom", ctx).getFrom());
    }

    String timeTo(QueryContext ctx, List<String> args) {
        String col = singleColumn("timeTo", args);
        return col + " <= " + dialect.timestampLiteral(range("timeTo", ctx).getTo());
    }

    String timeGroup(QueryContext ctx, List<String> args) {
        if (args.size() != 2 || args.get(0).isEmpty()) {
            throw new MacroArgumentException("timeGroup", "expected 2 arguments (column, period), got " + args.size());
        }
        return dialect.timeGroup(args.get(0), period("timeGroup", ctx, args.get(1)));
    }

    String timeGroupAlias(QueryContext ctx, List<String> args) {
        if (args.size() != 2 || args.get(0).isEmpty()) {
            throw new MacroArgumentException("timeGroupAlias",
                    "expected 2 arguments (column, period), got " + args.size());
        }
        return dialect.timeGroup(args.get(0), period("timeGroupAlias", ctx, args.get(1)))
                + " AS " + dialect.quoteIdentifier("time");
    }

    String unixEpochFilter(QueryContext ctx, List<String> args) {
        String col = singleColumn("unixEpochFilter", args);
        TimeRange range = range("unixEpochFilter", ctx);
        return col + " >= " + range.getFrom().getEpochSecond() + " AND " + col + " <= " + range.getTo().getEpochSecond();
    }

    String unixEpochFrom(QueryContext ctx, List<String> args) {
        noArgs("unixEpochFrom", args);
        return Long.toString(range("unixEpochFrom", ctx).getFrom().getEpochSecond());
    }

    String unixEpochTo(QueryContext ctx, List<String> args) {
        noArgs("unixEpochTo", args);
        return Long.toString(range("unixEpochTo", ctx).getTo().getEpochSecond());
    }

    String schema(QueryContext ctx, List<String> args) {
        return field("schema", ctx.getSchema(), args);
    }

    String table(QueryContext ctx, List<String> args) {
        return field("table", ctx.getTable(), args);
    }

    String column(QueryContext ctx, List<String> args) {
        return field("column", ctx.getColumn(), args);
    }

    private static String field(String name, String value, List<String> args) {
        noArgs(name, args);
        if (value == null || value.isEmpty()) {
            throw new MacroArgumentException(name, name + " is not set on the query");
        }
        return value;
    }

    private static void noArgs(String name, List<String> args) {
        if (!args.isEmpty()) {
            throw new MacroArgumentException(name, "expected no arguments, got " + args.size());
        }
    }

    private static String singleColumn(String name, List<String> args) {
        if (args.size() != 1 || args.get(0).isEmpty()) {
            throw new MacroArgumentException(name, "expected 1 argument (column), got " + args.size());
        }
        return args.get(0);
    }

    private static TimeRange range(String name, QueryContext ctx) {
        if (ctx.getTimeRange() == null) {
            throw new MacroArgumentException(name, "query has no time range");
        }
        return ctx.getTimeRange();
    }

    private static Duration period(String name, QueryContext ctx, String raw) {
        String token = unquote(raw);
        Duration period;
        if (INTERVAL_TOKEN.equals(token)) {
            period = ctx.intervalOrZero();
        } else {
            period = IntervalFormat.parse(token);
            if (period == null) {
                throw new MacroArgumentException(name, "unrecognized period '" + raw + "'");
            }
        }
        if (period.isZero()) {
            throw new MacroArgumentException(name, "period must be greater than zero");
        }
        return period;
    }

    private static String unquote(String s) {
        if (s.length() >= 2) {
            char first = s.charAt(0);
            char last = s.charAt(s.length() - 1);
            if ((first == '\'' || first == '"') && first == last) {
                return s.substring(1, s.length() - 1).trim();
            }
        }
        return s;
    }
}
