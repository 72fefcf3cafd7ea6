package com.sqlframe.convert;

import lombok.Value;

/**
 * Resolved pairing of a result column and its converter.
 */
@Value
public class ColumnBinding {
    int index;
    ColumnMetadata column;
    Converter converter;

    public ColumnBinding withConverter(Converter replacement) {
        return new ColumnBinding(index, column, replacement);
    }
}
