package com.rostra.eventservice.api;

import com.rostra.eventservice.config.EventServiceProperties;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight service identity endpoint. Build metadata stays on {@code /actuator/info}.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final EventServiceProperties properties;

    public ServiceInfoController(EventServiceProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "description", properties.description(),
                "status", "running",
                "timestamp", Instant.now().toString());
    }
}
