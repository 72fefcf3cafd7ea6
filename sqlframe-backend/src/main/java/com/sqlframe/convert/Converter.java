package com.sqlframe.convert;

import com.sqlframe.frame.FieldType;
import lombok.Builder;
import lombok.Value;

import java.util.regex.Pattern;

/**
 * Describes how one scanned column becomes a frame field.
 *
 * <p>As an override, a converter matches on column name, type name or type name regex. Default and
 * dynamic converters apply unconditionally.
 */
@Value
@Builder(toBuilder = true)
public class Converter {
    String name;
    @Builder.Default
    NativeKind scanKind = NativeKind.OTHER;
    String typeName;
    Pattern typeNameRegex;
    String columnName;
    FieldType fieldType;
    @Builder.Default
    boolean nullable = true;
    ValueConverter conversion;
    ColumnValueConverter columnConversion;
    boolean dynamic;

    public boolean isMatchRule() {
        return columnName != null || typeName != null || typeNameRegex != null;
    }

    public boolean matchesColumnName(ColumnMetadata column) {
        return columnName != null && columnName.equals(column.getName());
    }

    public boolean matchesTypeName(ColumnMetadata column) {
        return typeName != null && typeName.equals(column.getTypeName());
    }

    public boolean matchesTypeNameRegex(ColumnMetadata column) {
        return typeNameRegex != null && column.getTypeName() != null
                && typeNameRegex.matcher(column.getTypeName()).find();
    }

    /**
     * Applies the conversion to a present value, preferring {@link #getColumnConversion()}.
     */
    public Object apply(Object value, ColumnMetadata column) throws Exception {
        if (columnConversion != null) {
            return columnConversion.convert(value, column);
        }
        return conversion.convert(value);
    }

    /**
     * Marker converter whose field type is decided by sampling rows.
     */
    public static Converter dynamic() {
        return Converter.builder()
                .name("dynamic")
                .scanKind(NativeKind.OTHER)
                .fieldType(FieldType.STRING)
                .conversion(String::valueOf)
                .dynamic(true)
                .build();
    }
}
