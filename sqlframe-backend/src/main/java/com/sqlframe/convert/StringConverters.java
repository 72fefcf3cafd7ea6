package com.sqlframe.convert;

import com.sqlframe.frame.FieldType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Factory for converters that scan a column as text and parse it into a typed field.
 *
 * <p>Useful for drivers that report numbers or timestamps as strings.
 */
public final class StringConverters {

    private StringConverters() {
    }

    public static Converter forColumn(String columnName, FieldType target) {
        return forColumn(columnName, target, Map.of());
    }

    /**
     * @param columnName column to match
     * @param target field type to parse into
     * @param replacements literal replacements applied before parsing, in order
     */
    public static Converter forColumn(String columnName, FieldType target, Map<String, String> replacements) {
        return parsing("string-" + columnName, target, replacements).columnName(columnName).build();
    }

    public static Converter forTypeName(String typeName, FieldType target) {
        return parsing("string-" + typeName, target, Map.of()).typeName(typeName).build();
    }

    public static Converter forTypeNameRegex(String regex, FieldType target) {
        return parsing("string-" + regex, target, Map.of()).typeNameRegex(Pattern.compile(regex)).build();
    }

    /**
     * Builder preset to scan as text and parse into {@code target}; the caller adds the match key.
     */
    public static Converter.ConverterBuilder parsing(String name, FieldType target, Map<String, String> replacements) {
        ValueConverter parse = TypeRegistry.conversionFor(target);
        Map<String, String> ordered = new LinkedHashMap<>(replacements);
        return Converter.builder()
                .name(name)
                .scanKind(NativeKind.TEXT)
                .fieldType(target)
                .conversion(value -> {
                    String text = value.toString();
                    for (Map.Entry<String, String> r : ordered.entrySet()) {
                        text = text.replace(r.getKey(), r.getValue());
                    }
                    return parse.convert(text);
                });
    }
}
