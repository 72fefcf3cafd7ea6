package com.sqlframe.macro;

import com.sqlframe.model.QueryContext;

import java.util.List;

/**
 * A named SQL placeholder, invoked as {@code $__name} or {@code $__name(arg1,arg2)}.
 */
@FunctionalInterface
public interface Macro {

    /**
     * @param ctx query being interpolated
     * @param args raw, trimmed arguments; empty for the no-argument form
     * @return SQL fragment replacing the invocation
     * @throws com.sqlframe.error.MacroArgumentException if the arguments are rejected
     */
    String apply(QueryContext ctx, List<String> args);
}
