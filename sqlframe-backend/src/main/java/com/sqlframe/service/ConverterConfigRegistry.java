package com.sqlframe.service;

import com.sqlframe.convert.Converter;
import com.sqlframe.convert.NativeKind;
import com.sqlframe.convert.StringConverters;
import com.sqlframe.convert.TypeRegistry;
import com.sqlframe.frame.FieldType;
import com.sqlframe.model.ConverterConfigFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Loads override converters declared in a YAML file.
 *
 * <p>Entries that cannot be turned into a converter are logged and skipped; the rest stay usable.
 */
@Slf4j
@Component
public class ConverterConfigRegistry {

    private final String configPath;

    private volatile List<Converter> converters = List.of();

    public ConverterConfigRegistry(@Value("${sqlframe.converters.path:}") String configPath) {
        this.configPath = configPath;
    }

    @PostConstruct
    public void loadConfigs() {
        reloadConfigs();
    }

    /**
     * Re-reads the YAML file and swaps the converter list atomically.
     */
    public void reloadConfigs() {
        if (configPath == null || configPath.isBlank()) {
            converters = List.of();
            return;
        }
        Path path = Paths.get(configPath);
        if (!Files.exists(path)) {
            log.warn("Converter config not found: {}", configPath);
            converters = List.of();
            return;
        }

        ConverterConfigFile file;
        try (InputStream in = Files.newInputStream(path)) {
            file = new Yaml(new Constructor(ConverterConfigFile.class, new LoaderOptions())).load(in);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to load converter config: {}", configPath, e);
            converters = List.of();
            return;
        }

        List<Converter> loaded = new ArrayList<>();
        if (file != null && file.getConverters() != null) {
            for (ConverterConfigFile.ConverterEntry entry : file.getConverters()) {
                Converter c = toConverter(entry);
                if (c != null) {
                    loaded.add(c);
                }
            }
        }
        converters = List.copyOf(loaded);
        log.info("Loaded {} override converters from {}", loaded.size(), configPath);
    }

    public List<Converter> getConverters() {
        return converters;
    }

    static Converter toConverter(ConverterConfigFile.ConverterEntry entry) {
        if (entry == null) {
            return null;
        }
        String name = entry.getName() != null ? entry.getName() : "unnamed";
        if (Boolean.TRUE.equals(entry.getDynamic())) {
            return Converter.dynamic().toBuilder().name(name).build();
        }

        if (entry.getColumnName() == null && entry.getTypeName() == null && entry.getTypeNameRegex() == null) {
            log.warn("Skipping converter '{}': no columnName, typeName or typeNameRegex", name);
            return null;
        }

        FieldType fieldType;
        NativeKind scanKind;
        Pattern regex = null;
        try {
            fieldType = FieldType.valueOf(required(entry.getFieldType(), "fieldType").toUpperCase(Locale.ROOT));
            scanKind = entry.getScanKind() != null
                    ? NativeKind.valueOf(entry.getScanKind().toUpperCase(Locale.ROOT))
                    : NativeKind.TEXT;
            if (entry.getTypeNameRegex() != null) {
                regex = Pattern.compile(entry.getTypeNameRegex());
            }
        } catch (IllegalArgumentException e) {
            // also covers PatternSyntaxException
            log.warn("Skipping converter '{}': {}", name, e.getMessage());
            return null;
        }

        Converter.ConverterBuilder builder;
        if (scanKind == NativeKind.TEXT) {
            Map<String, String> replacements = entry.getReplacements() != null ? entry.getReplacements() : Map.of();
            builder = StringConverters.parsing(name, fieldType, replacements);
        } else {
            builder = Converter.builder()
                    .name(name)
                    .scanKind(scanKind)
                    .fieldType(fieldType)
                    .conversion(TypeRegistry.conversionFor(fieldType));
        }
        return builder
                .columnName(entry.getColumnName())
                .typeName(entry.getTypeName())
                .typeNameRegex(regex)
                .nullable(entry.getNullable() == null || entry.getNullable())
                .build();
    }

    private static String required(String value, String key) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(key + " is required");
        }
        return value;
    }
}
