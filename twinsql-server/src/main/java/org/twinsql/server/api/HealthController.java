package org.twinsql.server.api;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Plain health status for callers that do not speak actuator: the overall status plus the database
 * check's engine, identity and error, if any.
 */
@RestController
@RequestMapping("/api")
public class HealthController {

    // contributor name of DatabaseHealthIndicator
    static final String DATABASE_COMPONENT = "database";

    private final HealthEndpoint healthEndpoint;

    public HealthController(HealthEndpoint healthEndpoint) {
        this.healthEndpoint = Objects.requireNonNull(healthEndpoint);
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", healthEndpoint.health().getStatus().getCode());

        HealthComponent db = healthEndpoint.healthForPath(DATABASE_COMPONENT);
        if (db instanceof Health dbHealth) {
            Map<String, Object> database = new LinkedHashMap<>();
            database.put("status", dbHealth.getStatus().getCode());
            database.putAll(dbHealth.getDetails());
            out.put("database", database);
        }
        return out;
    }
}
