package com.comparechain.comparator;

import com.comparechain.exception.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ComparatorRegistry.
 */
class ComparatorRegistryTest {

    private ComparatorRegistry registry;

    @BeforeEach
    void setUp() {
        registry = ComparatorRegistry.withDefaults();
    }

    @Test
    @DisplayName("Defaults hold natural, temporal and case-insensitive")
    void defaults() {
        assertEquals(Set.of("natural", "temporal", "case-insensitive"), registry.names());
        assertSame(ComparatorRef.NATURAL, registry.resolve("natural"));
        assertEquals(ComparisonMode.SEMANTIC, registry.resolve("temporal").mode());
    }

    @Test
    @DisplayName("Null or blank name resolves to natural ordering")
    void blankResolvesToNatural() {
        assertSame(ComparatorRef.NATURAL, registry.resolve(null));
        assertSame(ComparatorRef.NATURAL, registry.resolve(" "));
    }

    @Test
    @DisplayName("Registered domain is resolvable by name")
    void registerAndResolve() {
        ComparatorDomain domain = ComparatorDomains.comparable(Integer.class);

        ComparatorRef ref = registry.register("ints", domain);

        assertSame(ref, registry.resolve("ints"));
        assertSame(domain, ref.domain());
        assertFalse(ref.isStructural());
    }

    @Test
    @DisplayName("Duplicate and blank names are rejected")
    void rejectsBadNames() {
        assertThrows(ConfigurationException.class, () -> registry.register("natural", (l, r) -> Ordering.EQUAL));
        assertThrows(ConfigurationException.class, () -> registry.register("", (l, r) -> Ordering.EQUAL));
        assertThrows(ConfigurationException.class, () -> registry.register("none", null));
    }

    @Test
    @DisplayName("Unknown name fails with the registered names in the message")
    void unknownName() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> registry.resolve("money"));

        assertTrue(e.getMessage().contains("money"));
        assertTrue(e.getMessage().contains("temporal"));
        assertTrue(registry.find("money").isEmpty());
    }
}
