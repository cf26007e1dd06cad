package com.comparechain.comparator;

import java.util.Objects;

/**
 * Handle on the comparator a rewritten expression calls into.
 *
 * @param name   Name used in diagnostics and for registry lookup
 * @param domain Ordering function
 * @param mode   STRUCTURAL for natural ordering, SEMANTIC for a supplied domain
 */
public record ComparatorRef(String name, ComparatorDomain domain, ComparisonMode mode) {

    public static final String NATURAL_NAME = "natural";

    public static final ComparatorRef NATURAL =
            new ComparatorRef(NATURAL_NAME, NaturalOrdering.INSTANCE, ComparisonMode.STRUCTURAL);

    public ComparatorRef {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(mode, "mode");
    }

    /**
     * Reference to a caller-supplied domain.
     */
    public static ComparatorRef semantic(String name, ComparatorDomain domain) {
        return new ComparatorRef(name, domain, ComparisonMode.SEMANTIC);
    }

    public boolean isStructural() {
        return mode == ComparisonMode.STRUCTURAL;
    }

    @Override
    public String toString() {
        return name;
    }
}
