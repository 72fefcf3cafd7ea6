package com.sqlframe.convert;

import com.sqlframe.error.DuplicateColumnNameException;
import com.sqlframe.error.UnresolvedColumnTypeException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Picks one converter per result column.
 *
 * <p>Rules are evaluated top to bottom and the first match wins:
 * <ol>
 *     <li>override matching the column name</li>
 *     <li>override matching the declared type name</li>
 *     <li>override whose type name regex matches</li>
 *     <li>the single dynamic override, if exactly one is given</li>
 *     <li>the registry default for the scan kind (or the type name hint for {@link NativeKind#OTHER})</li>
 *     <li>the generic string converter</li>
 * </ol>
 */
@Slf4j
public class ColumnConverterResolver {

    private final TypeRegistry registry;

    public ColumnConverterResolver(TypeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Resolves bindings for the given columns.
     *
     * @param columns columns in result order
     * @param overrides caller converters, may be null
     * @return one binding per column, in the same order
     * @throws DuplicateColumnNameException if two columns share a name
     * @throws UnresolvedColumnTypeException if a column has no scan kind and no override matches it
     */
    public List<ColumnBinding> resolve(List<ColumnMetadata> columns, List<Converter> overrides) {
        Set<String> seen = new HashSet<>();
        for (ColumnMetadata column : columns) {
            if (!seen.add(column.getName())) {
                throw new DuplicateColumnNameException(column.getName());
            }
        }

        List<Converter> rules = matchableOverrides(overrides);
        Converter dynamic = singleDynamic(rules);

        List<ColumnBinding> bindings = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            ColumnMetadata column = columns.get(i);
            Converter converter = resolveOne(column, rules, dynamic);
            log.debug("Column '{}' ({}) bound to converter '{}' -> {}",
                    column.getName(), column.getTypeName(), converter.getName(), converter.getFieldType());
            bindings.add(new ColumnBinding(i, column, converter));
        }
        return bindings;
    }

    private Converter resolveOne(ColumnMetadata column, List<Converter> rules, Converter dynamic) {
        for (Converter c : rules) {
            if (c.matchesColumnName(column)) {
                return c;
            }
        }
        for (Converter c : rules) {
            if (c.matchesTypeName(column)) {
                return c;
            }
        }
        for (Converter c : rules) {
            if (c.matchesTypeNameRegex(column)) {
                return c;
            }
        }
        if (dynamic != null) {
            return dynamic;
        }

        NativeKind kind = column.getScanKind();
        if (kind == null) {
            throw new UnresolvedColumnTypeException(column.getName(), column.getTypeName());
        }
        if (kind == NativeKind.OTHER) {
            NativeKind hinted = registry.hintFor(column.getTypeName());
            if (hinted != null && registry.defaultFor(hinted) != null) {
                return registry.defaultFor(hinted);
            }
        }
        Converter byKind = registry.defaultFor(kind);
        if (byKind != null) {
            return byKind;
        }
        return TypeRegistry.stringFallback().toBuilder().scanKind(kind).build();
    }

    private static List<Converter> matchableOverrides(List<Converter> overrides) {
        if (overrides == null) {
            return List.of();
        }
        List<Converter> rules = new ArrayList<>(overrides.size());
        for (Converter c : overrides) {
            if (!c.isMatchRule() && !c.isDynamic()) {
                log.warn("Skipping override converter '{}': no columnName, typeName or typeNameRegex", c.getName());
                continue;
            }
            rules.add(c);
        }
        return rules;
    }

    private Converter singleDynamic(List<Converter> rules) {
        Converter found = null;
        int count = 0;
        for (Converter c : rules) {
            if (c.isDynamic()) {
                found = c;
                count++;
            }
        }
        if (count > 1) {
            log.warn("Ignoring {} dynamic converters; at most one may be supplied", count);
            return null;
        }
        return found;
    }
}
