package com.comparechain.config;

import com.comparechain.comparator.ComparatorRef;

import java.util.List;

/**
 * Root configuration.
 *
 * @param name              Configuration name, for logs
 * @param defaultComparator Comparator used when an expression names none
 * @param diagnostics       Runtime notice settings
 * @param comparators       Comparator domains to register
 * @param expressions       Predefined expressions
 * @param cacheSize         Most compiled expressions the engine keeps; 0 disables caching
 */
public record CompareChainConfig(
        String name,
        String defaultComparator,
        DiagnosticsConfig diagnostics,
        List<ComparatorConfig> comparators,
        List<NamedExpressionConfig> expressions,
        long cacheSize
) {
    public static final long DEFAULT_CACHE_SIZE = 1000;

    public CompareChainConfig {
        comparators = comparators == null ? List.of() : List.copyOf(comparators);
        expressions = expressions == null ? List.of() : List.copyOf(expressions);
        diagnostics = diagnostics == null ? DiagnosticsConfig.defaults() : diagnostics;
    }

    /**
     * Natural ordering, notices on, nothing registered.
     */
    public static CompareChainConfig defaults() {
        return new CompareChainConfig("default", ComparatorRef.NATURAL_NAME,
                DiagnosticsConfig.defaults(), List.of(), List.of(), DEFAULT_CACHE_SIZE);
    }

    public CompareChainConfig(String name, String defaultComparator, DiagnosticsConfig diagnostics,
                              List<ComparatorConfig> comparators, List<NamedExpressionConfig> expressions) {
        this(name, defaultComparator, diagnostics, comparators, expressions, DEFAULT_CACHE_SIZE);
    }
}
