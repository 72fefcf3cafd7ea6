package com.sqlframe.frame;

import java.time.Instant;

/**
 * Value types a {@link Field} can hold, each bound to exactly one Java representation.
 */
public enum FieldType {
    INT32(Integer.class, 0),
    INT64(Long.class, 0L),
    FLOAT64(Double.class, 0.0d),
    STRING(String.class, ""),
    BOOL(Boolean.class, Boolean.FALSE),
    TIME(Instant.class, Instant.EPOCH);

    private final Class<?> javaType;
    private final Object zeroValue;

    FieldType(Class<?> javaType, Object zeroValue) {
        this.javaType = javaType;
        this.zeroValue = zeroValue;
    }

    public Class<?> getJavaType() {
        return javaType;
    }

    /**
     * Value written in place of a null when the field is not nullable.
     */
    public Object getZeroValue() {
        return zeroValue;
    }

    public boolean accepts(Object value) {
        return value == null || javaType.isInstance(value);
    }

    /**
     * Coerces a loosely typed value (for example a number parsed from JSON) into this type.
     *
     * @param value value to coerce, may be null
     * @return value of {@link #getJavaType()} or null
     * @throws IllegalArgumentException if the value cannot represent this type
     */
    public Object coerce(Object value) {
        if (value == null || javaType.isInstance(value)) {
            return value;
        }
        switch (this) {
            case INT32:
                if (value instanceof Number n) {
                    return n.intValue();
                }
                return Integer.parseInt(value.toString().trim());
            case INT64:
                if (value instanceof Number n) {
                    return n.longValue();
                }
                return Long.parseLong(value.toString().trim());
            case FLOAT64:
                if (value instanceof Number n) {
                    return n.doubleValue();
                }
                return Double.parseDouble(value.toString().trim());
            case BOOL:
                if (value instanceof Number n) {
                    return n.doubleValue() != 0;
                }
                return Boolean.parseBoolean(value.toString().trim());
            case TIME:
                if (value instanceof Number n) {
                    return Instant.ofEpochMilli(n.longValue());
                }
                return Instant.parse(value.toString().trim());
            case STRING:
            default:
                return String.valueOf(value);
        }
    }
}
