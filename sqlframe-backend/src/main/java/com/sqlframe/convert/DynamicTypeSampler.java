package com.sqlframe.convert;

import com.sqlframe.frame.FieldType;
import com.sqlframe.source.RowSource;
import lombok.extern.slf4j.Slf4j;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides the field type of dynamically typed columns by reading ahead until each one shows a non-null
 * value.
 *
 * <p>Rows read here are handed back in {@link SampledRows} and must be replayed before reading the
 * cursor again.
 */
@Slf4j
public class DynamicTypeSampler {

    /**
     * @param source cursor positioned before the first row
     * @param bindings resolved bindings, some possibly dynamic
     * @param rowCap maximum rows to buffer; negative for no limit
     * @return bindings with dynamic converters replaced, plus buffered rows
     */
    public SampledRows sample(RowSource source, List<ColumnBinding> bindings, long rowCap) throws SQLException {
        List<Integer> dynamicColumns = new ArrayList<>();
        for (ColumnBinding b : bindings) {
            if (b.getConverter().isDynamic()) {
                dynamicColumns.add(b.getIndex());
            }
        }
        if (dynamicColumns.isEmpty()) {
            return new SampledRows(bindings, List.of(), false);
        }

        List<NativeKind> scanKinds = new ArrayList<>(bindings.size());
        for (ColumnBinding b : bindings) {
            scanKinds.add(b.getConverter().getScanKind());
        }

        NativeKind[] observed = new NativeKind[bindings.size()];
        int pending = dynamicColumns.size();
        List<List<NativeValue>> rows = new ArrayList<>();
        boolean exhausted = false;

        while (pending > 0 && (rowCap < 0 || rows.size() < rowCap)) {
            if (!source.next()) {
                exhausted = true;
                break;
            }
            List<NativeValue> row = source.read(scanKinds);
            rows.add(row);
            for (int idx : dynamicColumns) {
                if (observed[idx] == null && row.get(idx).isPresent()) {
                    observed[idx] = row.get(idx).getKind();
                    pending--;
                }
            }
        }

        List<ColumnBinding> out = new ArrayList<>(bindings);
        for (int idx : dynamicColumns) {
            ColumnBinding b = bindings.get(idx);
            Converter inferred = inferConverter(observed[idx]);
            log.debug("Column '{}' sampled {} rows, inferred {} from {}",
                    b.getColumn().getName(), rows.size(), inferred.getFieldType(), observed[idx]);
            out.set(idx, b.withConverter(inferred));
        }
        return new SampledRows(out, rows, exhausted);
    }

    /**
     * Maps the first observed kind to a converter; null means every sampled value was null.
     */
    static Converter inferConverter(NativeKind kind) {
        FieldType type;
        ValueConverter conversion;
        if (kind == null) {
            type = FieldType.STRING;
            conversion = TypeRegistry.conversionFor(FieldType.STRING);
        } else {
            switch (kind) {
                case TEMPORAL:
                    type = FieldType.TIME;
                    conversion = TypeRegistry.conversionFor(FieldType.TIME);
                    break;
                case INTEGER:
                case FLOATING:
                    type = FieldType.FLOAT64;
                    conversion = TypeRegistry.conversionFor(FieldType.FLOAT64);
                    break;
                case TEXT:
                case BYTES:
                    type = FieldType.STRING;
                    conversion = TypeRegistry.conversionFor(FieldType.STRING);
                    break;
                default:
                    type = FieldType.STRING;
                    conversion = String::valueOf;
                    break;
            }
        }
        return Converter.builder()
                .name("dynamic-" + type.name().toLowerCase(java.util.Locale.ROOT))
                .scanKind(NativeKind.OTHER)
                .fieldType(type)
                .nullable(true)
                .conversion(conversion)
                .build();
    }
}
