package com.comparechain.config;

import com.comparechain.comparator.ComparatorDomain;
import com.comparechain.comparator.ComparatorRegistry;
import com.comparechain.exception.ConfigurationException;

/**
 * Builds a comparator registry from configuration: the built-in comparators plus one
 * instance of every configured class.
 */
public final class ComparatorRegistryFactory {

    private ComparatorRegistryFactory() {
    }

    public static ComparatorRegistry create(CompareChainConfig config) {
        ComparatorRegistry registry = ComparatorRegistry.withDefaults();
        for (ComparatorConfig comparator : config.comparators()) {
            registry.register(comparator.name(), instantiate(comparator));
        }
        return registry;
    }

    private static ComparatorDomain instantiate(ComparatorConfig comparator) {
        Class<?> type;
        try {
            type = Class.forName(comparator.className());
        } catch (ClassNotFoundException e) {
            throw new ConfigurationException("Comparator '" + comparator.name()
                    + "': class not found: " + comparator.className(), e);
        }
        if (!ComparatorDomain.class.isAssignableFrom(type)) {
            throw new ConfigurationException("Comparator '" + comparator.name() + "': "
                    + comparator.className() + " does not implement " + ComparatorDomain.class.getName());
        }
        try {
            return (ComparatorDomain) type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new ConfigurationException("Comparator '" + comparator.name()
                    + "': cannot instantiate " + comparator.className(), e);
        }
    }
}
