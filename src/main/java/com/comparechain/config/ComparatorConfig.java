package com.comparechain.config;

/**
 * Configuration for a comparator domain registered by class name.
 *
 * @param name      Name expressions refer to
 * @param className Fully qualified class implementing ComparatorDomain, with a no-arg constructor
 */
public record ComparatorConfig(String name, String className) {
}
