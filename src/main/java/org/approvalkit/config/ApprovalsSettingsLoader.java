package org.approvalkit.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link ApprovalsSettings} from an optional {@code approvals.yaml} (or {@code approvals.yml}) at
 * the classpath root. {@code approvals.<key>} system properties override file values; list properties
 * are comma separated.
 */
public final class ApprovalsSettingsLoader {
    static final List<String> RESOURCE_NAMES = List.of("approvals.yaml", "approvals.yml");
    private static final String PROPERTY_PREFIX = "approvals.";

    private ApprovalsSettingsLoader() {}

    public static ApprovalsSettings load() {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = ApprovalsSettingsLoader.class.getClassLoader();
        }
        return load(classLoader, System.getProperties());
    }

    public static ApprovalsSettings load(final ClassLoader classLoader, final Properties systemProperties) {
        Objects.requireNonNull(classLoader, "classLoader");
        Objects.requireNonNull(systemProperties, "systemProperties");
        final Map<String, Object> values = new LinkedHashMap<>();
        for (final String resourceName : RESOURCE_NAMES) {
            try (InputStream input = classLoader.getResourceAsStream(resourceName)) {
                if (input != null) {
                    values.putAll(parseYaml(new String(input.readAllBytes(), StandardCharsets.UTF_8), resourceName));
                    break;
                }
            } catch (final IOException e) {
                throw new UncheckedIOException("Failed to read " + resourceName, e);
            }
        }
        for (final String key : systemProperties.stringPropertyNames()) {
            if (key.startsWith(PROPERTY_PREFIX)) {
                values.put(key.substring(PROPERTY_PREFIX.length()), systemProperties.getProperty(key));
            }
        }
        return fromMap(values);
    }

    static Map<String, Object> parseYaml(final String content, final String sourceName) {
        final Object root = new Yaml().load(Objects.requireNonNull(content, "content"));
        if (root == null) {
            return Map.of();
        }
        if (!(root instanceof Map<?, ?> rawMap)) {
            throw new ApprovalsSettingsException(List.of(sourceName + ": root must be a mapping"));
        }
        final Map<String, Object> normalized = new LinkedHashMap<>();
        for (final Map.Entry<?, ?> entry : rawMap.entrySet()) {
            normalized.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return normalized;
    }

    static ApprovalsSettings fromMap(final Map<String, Object> values) {
        final List<String> errors = new ArrayList<>();
        final ApprovalsSettings.Builder builder = ApprovalsSettings.builder();
        for (final Map.Entry<String, Object> entry : values.entrySet()) {
            final Object value = entry.getValue();
            switch (entry.getKey()) {
                case "subdirectory" -> builder.subdirectory(value == null ? "" : String.valueOf(value));
                case "reporter" -> builder.reporter(value == null ? null : String.valueOf(value));
                case "frontLoadedReporters" -> builder.frontLoadedReporters(stringList(value));
                case "testSourceRoots" -> builder.testSourceRoots(stringList(value));
                case "log" -> builder.log(value == null ? null : String.valueOf(value));
                case "journalCapacity" -> {
                    try {
                        builder.journalCapacity(Integer.parseInt(String.valueOf(value).trim()));
                    } catch (final NumberFormatException e) {
                        errors.add("journalCapacity must be an integer: " + value);
                    }
                }
                default -> errors.add("unknown setting: " + entry.getKey());
            }
        }
        if (!errors.isEmpty()) {
            throw new ApprovalsSettingsException(errors);
        }
        return builder.build();
    }

    private static List<String> stringList(final Object value) {
        if (value == null) {
            return List.of();
        }
        final List<String> result = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (final Object item : collection) {
                result.add(String.valueOf(item).trim());
            }
            return result;
        }
        for (final String part : String.valueOf(value).split(",")) {
            if (!part.isBlank()) {
                result.add(part.trim());
            }
        }
        return result;
    }
}
