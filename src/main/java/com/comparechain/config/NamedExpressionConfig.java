package com.comparechain.config;

/**
 * Configuration for a predefined expression.
 *
 * @param name       Name used to evaluate it
 * @param expression Expression text (e.g., "start <= now < end")
 * @param comparator Comparator name, or null for the configured default
 */
public record NamedExpressionConfig(String name, String expression, String comparator) {
}
