package com.comparechain.engine;

import com.comparechain.comparator.ComparatorRegistry;
import com.comparechain.config.ComparatorRegistryFactory;
import com.comparechain.config.CompareChainConfig;
import com.comparechain.diagnostics.DiagnosticsSink;
import com.comparechain.diagnostics.LoggingDiagnosticsSink;

/**
 * Factory for creating a CompareChainEngine from config.
 */
public final class CompareChainEngineFactory {

    private CompareChainEngineFactory() {
    }

    public static CompareChainEngine create(CompareChainConfig config) {
        ComparatorRegistry registry = ComparatorRegistryFactory.create(config);
        return new CompareChainEngine(config, registry, diagnosticsSink(config));
    }

    public static DiagnosticsSink diagnosticsSink(CompareChainConfig config) {
        return config.diagnostics().enabled() ? new LoggingDiagnosticsSink() : DiagnosticsSink.DISCARD;
    }
}
