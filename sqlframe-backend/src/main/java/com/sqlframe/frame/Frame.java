package com.sqlframe.frame;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered collection of equal-length {@link Field}s plus {@link FrameMeta}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Frame {
    private String name;
    private String refId;
    private final List<Field> fields = new ArrayList<>();
    private FrameMeta meta = new FrameMeta();

    public Frame() {
    }

    public Frame(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getRefId() {
        return refId;
    }

    public void setRefId(String refId) {
        this.refId = refId;
    }

    public FrameMeta getMeta() {
        return meta;
    }

    public void setMeta(FrameMeta meta) {
        this.meta = meta != null ? meta : new FrameMeta();
    }

    public List<Field> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public Frame addField(Field field) {
        fields.add(field);
        return this;
    }

    public Field getField(int index) {
        return fields.get(index);
    }

    /**
     * Returns the field with the given name, or null.
     */
    public Field getField(String fieldName) {
        for (Field f : fields) {
            if (f.getName().equals(fieldName)) {
                return f;
            }
        }
        return null;
    }

    /**
     * Index of the first field of the given type, or -1.
     */
    public int indexOfFirst(FieldType type) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).getType() == type) {
                return i;
            }
        }
        return -1;
    }

    public int rowCount() {
        return fields.isEmpty() ? 0 : fields.get(0).size();
    }

    /**
     * Checks that every field has the same length.
     *
     * @throws IllegalStateException on unequal lengths
     */
    public void validate() {
        int expected = rowCount();
        for (Field f : fields) {
            if (f.size() != expected) {
                throw new IllegalStateException("frame '" + name + "' field '" + f.getName() + "' has "
                        + f.size() + " values, expected " + expected);
            }
        }
    }
}
