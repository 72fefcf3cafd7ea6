package com.sqlframe.frame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named, typed column of a {@link Frame}.
 */
public class Field {
    private final String name;
    private final FieldType type;
    private final boolean nullable;
    private final List<Object> values;

    public Field(String name, FieldType type, boolean nullable) {
        this(name, type, nullable, 16);
    }

    public Field(String name, FieldType type, boolean nullable, int initialCapacity) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.nullable = nullable;
        this.values = new ArrayList<>(Math.max(initialCapacity, 0));
    }

    public String getName() {
        return name;
    }

    public FieldType getType() {
        return type;
    }

    public boolean isNullable() {
        return nullable;
    }

    public int size() {
        return values.size();
    }

    public Object get(int index) {
        return values.get(index);
    }

    public List<Object> getValues() {
        return Collections.unmodifiableList(values);
    }

    /**
     * Appends a value.
     *
     * <p>A null on a non-nullable field is replaced by the type's zero value.
     *
     * @param value value matching {@link FieldType#getJavaType()}, or null
     * @throws IllegalArgumentException if the value has the wrong Java type
     */
    public void append(Object value) {
        if (value == null) {
            values.add(nullable ? null : type.getZeroValue());
            return;
        }
        if (!type.accepts(value)) {
            throw new IllegalArgumentException("field '" + name + "' of type " + type
                    + " cannot hold a value of " + value.getClass().getName());
        }
        values.add(value);
    }

    /**
     * Creates an empty field with the same name and type.
     */
    public Field emptyCopy(boolean nullable) {
        return new Field(name, type, nullable);
    }

    @Override
    public String toString() {
        return "Field{" + name + " " + type + (nullable ? "?" : "") + ", " + values.size() + " values}";
    }
}
