package com.layeredapi.backend.health;

import java.time.Clock;
import java.time.Instant;

import com.layeredapi.backend.global.cache.CacheClient;
import com.layeredapi.backend.global.common.response.ApiEnvelope;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and readiness probes.
 */
@Tag(name = "Health")
@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    static final String CACHE_DISABLED = "DISABLED";

    private final HealthEndpoint healthEndpoint;
    private final CacheClient cacheClient;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, CacheClient cacheClient, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.cacheClient = cacheClient;
        this.clock = clock;
    }

    /**
     * Liveness: the process is up and serving requests.
     */
    @Operation(summary = "Health check")
    @GetMapping("/health")
    public ResponseEntity<ApiEnvelope<HealthResponse>> health() {
        HealthResponse body = new HealthResponse("healthy", null, null, Instant.now(clock).toString());
        return ResponseEntity.ok(ApiEnvelope.ok("Service is running", body));
    }

    /**
     * Readiness: the database answers. The cache is reported but never blocks readiness.
     */
    @Operation(summary = "Readiness check")
    @GetMapping("/ready")
    public ResponseEntity<ApiEnvelope<HealthResponse>> ready() {
        String database = databaseStatus();
        String cache = cacheClient.isEnabled()
                ? (cacheClient.ping() ? Status.UP.getCode() : Status.DOWN.getCode())
                : CACHE_DISABLED;
        String timestamp = Instant.now(clock).toString();

        if (!Status.UP.getCode().equals(database)) {
            HealthResponse body = new HealthResponse("not ready", database, cache, timestamp);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(new ApiEnvelope<>(false, "Service is not ready", body, "DATABASE_UNAVAILABLE", null));
        }
        return ResponseEntity.ok(ApiEnvelope.ok("Service is ready",
                new HealthResponse("ready", database, cache, timestamp)));
    }

    private String databaseStatus() {
        try {
            HealthComponent db = healthEndpoint.healthForPath("db");
            return db != null ? db.getStatus().getCode() : Status.UNKNOWN.getCode();
        } catch (RuntimeException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return Status.DOWN.getCode();
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record HealthResponse(
            String status,
            String database,
            String cache,
            String timestamp
    ) {}
}
