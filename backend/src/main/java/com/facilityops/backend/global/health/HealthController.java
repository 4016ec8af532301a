package com.facilityops.backend.global.health;

import java.time.Clock;
import java.time.OffsetDateTime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 인증 없이 열린 헬스체크. DB 상태가 있으면 그 상태를 우선한다.
 */
@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        String status;
        try {
            HealthComponent health = healthEndpoint.health();
            status = health.getStatus().getCode();
            if (health instanceof CompositeHealth composite && composite.getComponents() != null) {
                HealthComponent db = composite.getComponents().get("db");
                if (db != null) {
                    status = db.getStatus().getCode();
                }
            }
        } catch (RuntimeException ex) {
            log.warn("Health probe failed: {}", ex.toString());
            status = "DOWN";
        }
        return new HealthResponse(status, OffsetDateTime.now(clock).toString());
    }

    public record HealthResponse(String status, String timestamp) {
    }
}
