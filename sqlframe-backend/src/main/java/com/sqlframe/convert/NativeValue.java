package com.sqlframe.convert;

import java.util.Objects;

/**
 * One scanned cell: either a present value with its kind, or an absent (SQL NULL) value.
 */
public final class NativeValue {
    private final NativeKind kind;
    private final Object value;

    private NativeValue(NativeKind kind, Object value) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.value = value;
    }

    public static NativeValue present(NativeKind kind, Object value) {
        return new NativeValue(kind, Objects.requireNonNull(value, "value"));
    }

    public static NativeValue absent(NativeKind kind) {
        return new NativeValue(kind, null);
    }

    /**
     * Wraps a possibly-null driver value, classifying it with {@link NativeKind#classify(Object)}.
     */
    public static NativeValue of(Object value) {
        return value == null ? absent(NativeKind.OTHER) : present(NativeKind.classify(value), value);
    }

    public NativeKind getKind() {
        return kind;
    }

    public boolean isPresent() {
        return value != null;
    }

    /**
     * Present value.
     *
     * @throws IllegalStateException if the cell is absent
     */
    public Object get() {
        if (value == null) {
            throw new IllegalStateException("value is absent");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NativeValue other)) {
            return false;
        }
        return kind == other.kind && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return value == null ? kind + ":absent" : kind + ":" + value;
    }
}
