package com.sqlframe.macro;

import com.sqlframe.dialect.SqlDialect;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable mapping from macro name to {@link Macro}.
 */
public final class Macros {

    private final Map<String, Macro> byName;

    private Macros(Map<String, Macro> byName) {
        this.byName = Collections.unmodifiableMap(new LinkedHashMap<>(byName));
    }

    public static Macros of(Map<String, Macro> macros) {
        return new Macros(Objects.requireNonNull(macros, "macros"));
    }

    /**
     * Built-in macros rendering SQL for the given dialect.
     */
    public static Macros defaults(SqlDialect dialect) {
        DefaultMacros d = new DefaultMacros(dialect);
        Map<String, Macro> m = new LinkedHashMap<>();
        m.put("interval", d::interval);
        m.put("interval_ms", d::intervalMs);
        m.put("timeFilter", d::timeFilter);
        m.put("timeFrom", d::timeFrom);
        m.put("timeTo", d::timeTo);
        m.put("timeGroup", d::timeGroup);
        m.put("timeGroupAlias", d::timeGroupAlias);
        m.put("unixEpochFilter", d::unixEpochFilter);
        m.put("unixEpochFrom", d::unixEpochFrom);
        m.put("unixEpochTo", d::unixEpochTo);
        m.put("schema", d::schema);
        m.put("table", d::table);
        m.put("column", d::column);
        return new Macros(m);
    }

    /**
     * Returns a new mapping where {@code overrides} replace or add entries.
     */
    public Macros merge(Map<String, Macro> overrides) {
        Map<String, Macro> merged = new LinkedHashMap<>(byName);
        merged.putAll(overrides);
        return new Macros(merged);
    }

    public Macro get(String name) {
        return byName.get(name);
    }

    public Set<String> names() {
        return byName.keySet();
    }
}
