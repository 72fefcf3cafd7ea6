package com.sqlframe.model;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Root of the converter override YAML file.
 */
@Data
public class ConverterConfigFile {
    private List<ConverterEntry> converters;

    @Data
    public static class ConverterEntry {
        private String name;
        private String columnName;
        private String typeName;
        private String typeNameRegex;
        private String fieldType;
        /** Scan kind; defaults to TEXT, which parses the column's text into {@code fieldType}. */
        private String scanKind;
        private Boolean nullable;
        private Boolean dynamic;
        private Map<String, String> replacements;
    }
}
