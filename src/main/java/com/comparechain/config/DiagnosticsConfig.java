package com.comparechain.config;

/**
 * Configuration for runtime notices.
 *
 * @param enabled Whether notices are logged; when false they are dropped
 */
public record DiagnosticsConfig(boolean enabled) {

    public static DiagnosticsConfig defaults() {
        return new DiagnosticsConfig(true);
    }
}
