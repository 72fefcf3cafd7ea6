package com.sqlframe.convert;

import lombok.Value;

/**
 * Column as reported by the row source before iteration.
 */
@Value
public class ColumnMetadata {
    String name;
    /** Declared database type name, e.g. {@code VARCHAR} or {@code NUMERIC}. */
    String typeName;
    /** Suggested scan kind; null when the driver reports nothing usable. */
    NativeKind scanKind;
}
