package com.comparechain.comparator;

import com.comparechain.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named comparator references, shared by everything that compiles expressions.
 * Thread-safe.
 */
public class ComparatorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ComparatorRegistry.class);

    public static final String TEMPORAL = "temporal";
    public static final String CASE_INSENSITIVE = "case-insensitive";

    private final Map<String, ComparatorRef> comparators = new ConcurrentHashMap<>();

    public ComparatorRegistry() {
        comparators.put(ComparatorRef.NATURAL_NAME, ComparatorRef.NATURAL);
    }

    /**
     * Registry holding natural, temporal and case-insensitive comparators.
     */
    public static ComparatorRegistry withDefaults() {
        ComparatorRegistry registry = new ComparatorRegistry();
        registry.register(TEMPORAL, ComparatorDomains.temporal());
        registry.register(CASE_INSENSITIVE, ComparatorDomains.caseInsensitive());
        return registry;
    }

    /**
     * Register a semantic comparator under a unique name.
     *
     * @return The reference rewritten expressions will call
     * @throws ConfigurationException if the name is blank or already taken
     */
    public ComparatorRef register(String name, ComparatorDomain domain) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Comparator name cannot be blank");
        }
        if (domain == null) {
            throw new ConfigurationException("Comparator '" + name + "' has no domain");
        }
        ComparatorRef ref = ComparatorRef.semantic(name, domain);
        if (comparators.putIfAbsent(name, ref) != null) {
            throw new ConfigurationException("Comparator '" + name + "' is already registered");
        }
        log.info("Registered comparator '{}' ({})", name, domain.getClass().getName());
        return ref;
    }

    public Optional<ComparatorRef> find(String name) {
        return Optional.ofNullable(comparators.get(name));
    }

    /**
     * Resolve a comparator by name. A null or blank name means natural ordering.
     *
     * @throws ConfigurationException if no comparator has that name
     */
    public ComparatorRef resolve(String name) {
        if (name == null || name.isBlank()) {
            return ComparatorRef.NATURAL;
        }
        return find(name).orElseThrow(() -> new ConfigurationException(
                "Unknown comparator '" + name + "'. Registered: " + names()));
    }

    public Set<String> names() {
        return new TreeSet<>(comparators.keySet());
    }
}
