package com.comparechain.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for Compare Chain.
 */
@ConfigurationProperties(prefix = "compare-chain")
public class CompareChainProperties {

    /**
     * Whether Compare Chain is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the Compare Chain configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:compare-chain.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
