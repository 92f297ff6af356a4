package com.rostra.eventservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity of the running service, bound from {@code rostra.service.*}.
 *
 * <pre>
 * rostra:
 *   service:
 *     name: event-service
 *     environment: production
 *     description: Domain event pipeline
 * </pre>
 *
 * @param name service name used for logging and the metrics {@code service} tag. Required.
 * @param environment deployment environment (development, staging, production)
 * @param description human-readable description for {@code /api/v1/info}
 */
@ConfigurationProperties(prefix = "rostra.service")
@Validated
public record EventServiceProperties(@NotBlank String name, String environment, String description) {

    public EventServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (description == null) {
            description = "";
        }
    }
}
