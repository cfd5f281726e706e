package com.sessiongate.backend.health;

import java.time.Clock;
import java.time.Instant;

import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * /healthz 는 프로세스 생존 여부만, /readyz 는 DB 와 Redis 연결까지 확인한다.
 */
@RestController
public class HealthController {

    private static final String[] READINESS_COMPONENTS = {"db", "redis"};

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse(Status.UP.getCode(), Instant.now(clock).toString());
    }

    @GetMapping("/readyz")
    public ResponseEntity<HealthResponse> readyz() {
        String status = readinessStatus();
        HttpStatus httpStatus = Status.UP.getCode().equals(status) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(httpStatus).body(new HealthResponse(status, Instant.now(clock).toString()));
    }

    private String readinessStatus() {
        HealthComponent health = healthEndpoint.health();
        if (!(health instanceof CompositeHealth composite)) {
            return health.getStatus().getCode();
        }
        for (String name : READINESS_COMPONENTS) {
            HealthComponent component = composite.getComponents().get(name);
            if (component != null && !Status.UP.equals(component.getStatus())) {
                return component.getStatus().getCode();
            }
        }
        return Status.UP.getCode();
    }

    public record HealthResponse(String status, String timestamp) {
    }
}
