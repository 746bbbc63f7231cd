package com.knowledgecenter.backend.health;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and readiness probes plus the root greeting.
 */
@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, @Qualifier("utcClock") Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("message", "Hello World");
    }

    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse(Status.UP.getCode(), Instant.now(clock).toString());
    }

    /**
     * Reports the database indicator when one is registered, otherwise the aggregate status.
     */
    @GetMapping("/readyz")
    public ResponseEntity<HealthResponse> readyz() {
        String status = readinessStatus();
        HttpStatus httpStatus = Status.UP.getCode().equals(status) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(httpStatus).body(new HealthResponse(status, Instant.now(clock).toString()));
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return healthz();
    }

    private String readinessStatus() {
        try {
            HealthComponent health = healthEndpoint.health();
            if (health instanceof CompositeHealth composite) {
                HealthComponent db = composite.getComponents().get("db");
                if (db != null) {
                    return db.getStatus().getCode();
                }
            }
            return health.getStatus().getCode();
        } catch (RuntimeException ex) {
            log.warn("Readiness check failed", ex);
            return Status.DOWN.getCode();
        }
    }

    public record HealthResponse(
            String status,
            String timestamp
    ) {
    }
}
