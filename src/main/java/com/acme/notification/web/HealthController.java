package com.acme.notification.web;

import com.acme.notification.core.BrokerUnavailableException;
import com.acme.notification.health.HealthService;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import java.util.Map;

@Controller("/health")
public class HealthController {
    private final HealthService health;

    public HealthController(HealthService health) {
        this.health = health;
    }

    @Get("/live")
    public HttpResponse<Map<String, String>> live() {
        return HttpResponse.ok(Map.of("status", "UP"));
    }

    @Get("/ready")
    public HttpResponse<Map<String, String>> ready() {
        try {
            health.checkHealth();
            return HttpResponse.ok(Map.of("status", "UP"));
        } catch (BrokerUnavailableException e) {
            return HttpResponse.<Map<String, String>>status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("status", "DOWN", "error", e.getMessage()));
        }
    }
}
