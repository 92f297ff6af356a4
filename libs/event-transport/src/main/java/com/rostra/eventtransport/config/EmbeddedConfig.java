package com.rostra.eventtransport.config;

/**
 * Settings for the in-process engine.
 *
 * @param retentionPerPartition records kept per partition before the oldest are discarded
 */
public record EmbeddedConfig(int retentionPerPartition) {

    public static final int DEFAULT_RETENTION = 10_000;

    public EmbeddedConfig {
        if (retentionPerPartition <= 0) {
            throw new IllegalArgumentException(
                    "retentionPerPartition must be positive, was " + retentionPerPartition);
        }
    }

    public static EmbeddedConfig defaults() {
        return new EmbeddedConfig(DEFAULT_RETENTION);
    }
}
