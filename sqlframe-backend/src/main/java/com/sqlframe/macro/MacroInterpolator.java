package com.sqlframe.macro;

import com.sqlframe.error.MalformedInvocationException;
import com.sqlframe.error.UnknownMacroException;
import com.sqlframe.model.QueryContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces {@code $__name} and {@code $__name(args)} invocations in a query's SQL.
 *
 * <p>Single left-to-right pass. A macro's output is never scanned again. Arguments are split on every
 * comma, so an argument cannot itself contain a comma.
 */
public final class MacroInterpolator {
    private static final String PREFIX = "$__";

    private MacroInterpolator() {
    }

    /**
     * @param ctx query to interpolate; not modified
     * @param macros available macros
     * @return copy of {@code ctx} with the interpolated SQL
     */
    public static QueryContext interpolate(QueryContext ctx, Macros macros) {
        return ctx.withSql(interpolate(ctx, ctx.getSql(), macros));
    }

    static String interpolate(QueryContext ctx, String sql, Macros macros) {
        if (sql == null || sql.indexOf(PREFIX) < 0) {
            return sql;
        }

        int n = sql.length();
        StringBuilder out = new StringBuilder(n + 64);
        int i = 0;
        while (i < n) {
            int start = sql.indexOf(PREFIX, i);
            if (start < 0) {
                out.append(sql, i, n);
                break;
            }
            out.append(sql, i, start);

            int nameStart = start + PREFIX.length();
            int nameEnd = nameStart;
            while (nameEnd < n && isNameChar(sql.charAt(nameEnd))) {
                nameEnd++;
            }
            if (nameEnd == nameStart) {
                out.append(PREFIX);
                i = nameStart;
                continue;
            }
            String name = sql.substring(nameStart, nameEnd);

            List<String> args = List.of();
            int end = nameEnd;
            if (nameEnd < n && sql.charAt(nameEnd) == '(') {
                int close = findClosingParen(sql, nameEnd);
                if (close < 0) {
                    throw new MalformedInvocationException(name, start);
                }
                args = splitArgs(sql.substring(nameEnd + 1, close));
                end = close + 1;
            }

            Macro macro = macros.get(name);
            if (macro == null) {
                throw new UnknownMacroException(name);
            }
            out.append(macro.apply(ctx, args));
            i = end;
        }
        return out.toString();
    }

    private static boolean isNameChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }

    private static int findClosingParen(String sql, int open) {
        int depth = 0;
        for (int i = open; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static List<String> splitArgs(String inner) {
        if (inner.isBlank()) {
            return List.of();
        }
        List<String> args = new ArrayList<>();
        for (String part : inner.split(",", -1)) {
            args.add(part.trim());
        }
        return args;
    }
}
