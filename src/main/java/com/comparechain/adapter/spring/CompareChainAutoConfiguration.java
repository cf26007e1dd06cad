package com.comparechain.adapter.spring;

import com.comparechain.comparator.ComparatorRegistry;
import com.comparechain.config.ComparatorRegistryFactory;
import com.comparechain.config.CompareChainConfig;
import com.comparechain.config.ConfigLoader;
import com.comparechain.diagnostics.DiagnosticsSink;
import com.comparechain.engine.CompareChainEngine;
import com.comparechain.engine.CompareChainEngineFactory;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for Compare Chain.
 * Each bean backs off when the application defines its own, so a custom
 * {@link DiagnosticsSink} or {@link ComparatorRegistry} replaces the configured one.
 */
@Configuration
@ConditionalOnProperty(prefix = "compare-chain", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(CompareChainProperties.class)
public class CompareChainAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CompareChainAutoConfiguration.class);

    private CompareChainEngine engine;

    @Bean
    @ConditionalOnMissingBean
    public CompareChainConfig compareChainConfig(CompareChainProperties properties) {
        log.info("Loading Compare Chain configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public ComparatorRegistry comparatorRegistry(CompareChainConfig config) {
        return ComparatorRegistryFactory.create(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public DiagnosticsSink diagnosticsSink(CompareChainConfig config) {
        return CompareChainEngineFactory.diagnosticsSink(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public CompareChainEngine compareChainEngine(CompareChainConfig config, ComparatorRegistry registry,
                                                 DiagnosticsSink diagnosticsSink) {
        log.info("Creating CompareChainEngine: {}", config.name());
        this.engine = new CompareChainEngine(config, registry, diagnosticsSink);
        return this.engine;
    }

    @PreDestroy
    public void shutdown() {
        if (engine != null) {
            log.info("Releasing {} compiled expressions", engine.cacheSize());
            engine.clearCache();
        }
    }
}
