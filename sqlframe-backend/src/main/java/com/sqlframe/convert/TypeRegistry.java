package com.sqlframe.convert;

import com.sqlframe.frame.FieldType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable table of default converters keyed by {@link NativeKind}, plus type name hints for columns
 * the driver scans as {@link NativeKind#OTHER}.
 *
 * <p>Built once and shared; safe for concurrent reads.
 */
public final class TypeRegistry {

    private static final Converter STRING_FALLBACK = Converter.builder()
            .name("string")
            .scanKind(NativeKind.OTHER)
            .fieldType(FieldType.STRING)
            .conversion(Conversions::toText)
            .build();

    private final Map<NativeKind, Converter> defaults;
    private final Map<String, NativeKind> typeNameHints;

    private TypeRegistry(Map<NativeKind, Converter> defaults, Map<String, NativeKind> typeNameHints) {
        this.defaults = Collections.unmodifiableMap(new EnumMap<>(defaults));
        this.typeNameHints = Collections.unmodifiableMap(new LinkedHashMap<>(typeNameHints));
    }

    /**
     * Registry with the standard converter for every native kind.
     */
    public static TypeRegistry defaults() {
        return builder()
                .register(NativeKind.TEMPORAL, FieldType.TIME)
                .register(NativeKind.INTEGER, FieldType.INT64)
                .register(NativeKind.FLOATING, FieldType.FLOAT64)
                .register(NativeKind.TEXT, FieldType.STRING)
                .register(NativeKind.BYTES, FieldType.STRING)
                .register(NativeKind.BOOLEAN, FieldType.BOOL)
                .register(NativeKind.OTHER, FieldType.STRING)
                .hint("DECIMAL", NativeKind.FLOATING)
                .hint("NUMERIC", NativeKind.FLOATING)
                .hint("MONEY", NativeKind.FLOATING)
                .hint("JSON", NativeKind.TEXT)
                .hint("JSONB", NativeKind.TEXT)
                .hint("UUID", NativeKind.TEXT)
                .hint("INET", NativeKind.TEXT)
                .hint("TIMESTAMPTZ", NativeKind.TEMPORAL)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Converter that renders any value as a string.
     */
    public static Converter stringFallback() {
        return STRING_FALLBACK;
    }

    /**
     * Standard conversion function producing values of the given field type.
     */
    public static ValueConverter conversionFor(FieldType type) {
        return Conversions.forFieldType(type);
    }

    /**
     * Default converter for a scan kind, or null if none is registered.
     */
    public Converter defaultFor(NativeKind kind) {
        return kind == null ? null : defaults.get(kind);
    }

    /**
     * Kind hinted for a declared type name, or null. Matching ignores case.
     */
    public NativeKind hintFor(String typeName) {
        if (typeName == null) {
            return null;
        }
        return typeNameHints.get(typeName.trim().toUpperCase(Locale.ROOT));
    }

    public static final class Builder {
        private final Map<NativeKind, Converter> defaults = new EnumMap<>(NativeKind.class);
        private final Map<String, NativeKind> hints = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(NativeKind kind, FieldType type) {
            return register(kind, Converter.builder()
                    .name(kind.name().toLowerCase(Locale.ROOT))
                    .scanKind(kind)
                    .fieldType(type)
                    .conversion(Conversions.forFieldType(type))
                    .build());
        }

        public Builder register(NativeKind kind, Converter converter) {
            defaults.put(kind, converter);
            return this;
        }

        public Builder hint(String typeName, NativeKind kind) {
            hints.put(typeName.toUpperCase(Locale.ROOT), kind);
            return this;
        }

        public TypeRegistry build() {
            return new TypeRegistry(defaults, hints);
        }
    }
}
