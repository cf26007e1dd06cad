package com.comparechain.config;

import com.comparechain.comparator.ComparatorRef;
import com.comparechain.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads Compare Chain configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String ROOT_KEY = "compare-chain";

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static CompareChainConfig load(String path) {
        log.info("Loading Compare Chain configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parse(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    /**
     * Parse configuration from a YAML stream.
     *
     * @param inputStream YAML content
     * @return Parsed configuration
     */
    @SuppressWarnings("unchecked")
    public static CompareChainConfig parse(InputStream inputStream) {
        Map<String, Object> root;
        try {
            root = new Yaml().load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML: " + e.getMessage(), e);
        }

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The section may be at root or under 'compare-chain'
        Map<String, Object> section = root.containsKey(ROOT_KEY)
                ? (Map<String, Object>) root.get(ROOT_KEY)
                : root;

        String name = getString(section, "name", "default");
        String defaultComparator = getString(section, "default-comparator", ComparatorRef.NATURAL_NAME);
        DiagnosticsConfig diagnostics = parseDiagnostics((Map<String, Object>) section.get("diagnostics"));
        List<ComparatorConfig> comparators = parseComparators((List<Map<String, Object>>) section.get("comparators"));
        List<NamedExpressionConfig> expressions = parseExpressions((List<Map<String, Object>>) section.get("expressions"));
        long cacheSize = getLong(section, "cache-size", CompareChainConfig.DEFAULT_CACHE_SIZE);
        if (cacheSize < 0) {
            throw new ConfigurationException("cache-size must not be negative: " + cacheSize);
        }

        CompareChainConfig config = new CompareChainConfig(
                name, defaultComparator, diagnostics, comparators, expressions, cacheSize);

        log.info("Loaded Compare Chain configuration: {} with {} comparators, {} expressions, default comparator: {}",
                name, comparators.size(), expressions.size(), defaultComparator);

        return config;
    }

    private static DiagnosticsConfig parseDiagnostics(Map<String, Object> map) {
        if (map == null) {
            return DiagnosticsConfig.defaults();
        }
        return new DiagnosticsConfig(getBoolean(map, "enabled", true));
    }

    private static List<ComparatorConfig> parseComparators(List<Map<String, Object>> list) {
        if (list == null) {
            return List.of();
        }
        List<ComparatorConfig> comparators = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (int i = 0; i < list.size(); i++) {
            Map<String, Object> item = list.get(i);
            String name = getString(item, "name", null);
            String className = getString(item, "class", null);
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("Comparator " + i + " has no name");
            }
            if (className == null || className.isBlank()) {
                throw new ConfigurationException("Comparator '" + name + "' has no class");
            }
            if (!names.add(name)) {
                throw new ConfigurationException("Comparator '" + name + "' is defined twice");
            }
            comparators.add(new ComparatorConfig(name, className));
            log.debug("Parsed comparator: name={}, class={}", name, className);
        }
        return comparators;
    }

    private static List<NamedExpressionConfig> parseExpressions(List<Map<String, Object>> list) {
        if (list == null) {
            return List.of();
        }
        List<NamedExpressionConfig> expressions = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (int i = 0; i < list.size(); i++) {
            Map<String, Object> item = list.get(i);
            String name = getString(item, "name", "expression-" + i);
            String expr = getString(item, "expr", null);
            if (expr == null || expr.isBlank()) {
                throw new ConfigurationException("Expression '" + name + "' has no expr");
            }
            if (!names.add(name)) {
                throw new ConfigurationException("Expression '" + name + "' is defined twice");
            }
            expressions.add(new NamedExpressionConfig(name, expr, getString(item, "comparator", null)));
            log.debug("Parsed expression: name={}, expr={}", name, expr);
        }
        return expressions;
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).longValue();
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid " + key + ": " + value, e);
        }
    }
}
