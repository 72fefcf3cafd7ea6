package com.sqlframe.convert;

/**
 * Variant of {@link ValueConverter} that also sees the column's reported metadata.
 */
@FunctionalInterface
public interface ColumnValueConverter {
    Object convert(Object value, ColumnMetadata column) throws Exception;
}
