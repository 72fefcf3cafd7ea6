package com.sqlframe.convert;

import java.time.temporal.Temporal;
import java.util.Date;

/**
 * Tag carried with every scanned cell. Row sources pick the kind; the conversion core only reads it.
 */
public enum NativeKind {
    TEMPORAL,
    INTEGER,
    FLOATING,
    TEXT,
    BYTES,
    BOOLEAN,
    OTHER;

    /**
     * Classifies a driver object. Intended for row source adapters that read untyped values.
     *
     * @param value driver value, not null
     * @return kind of the value
     */
    public static NativeKind classify(Object value) {
        if (value instanceof Temporal || value instanceof Date) {
            return TEMPORAL;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte || value instanceof java.math.BigInteger) {
            return INTEGER;
        }
        if (value instanceof Number) {
            return FLOATING;
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return TEXT;
        }
        if (value instanceof byte[]) {
            return BYTES;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        return OTHER;
    }
}
