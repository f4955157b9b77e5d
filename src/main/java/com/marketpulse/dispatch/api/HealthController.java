package com.marketpulse.dispatch.api;

import com.marketpulse.core.health.HealthCheckService;
import com.marketpulse.core.health.HealthStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for pipeline health: checkpoint store and provider categories.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health: 200 unless a component is DOWN, then 503.
     * A DEGRADED provider category still serves requests through fallback.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        boolean anyDown = false;
        boolean anyDegraded = false;

        Map<String, Object> components = new LinkedHashMap<>();
        for (HealthStatus check : healthCheckService.checkAll()) {
            Map<String, String> componentInfo = new LinkedHashMap<>();
            componentInfo.put("status", check.status().name());
            componentInfo.put("detail", check.detail());
            components.put(check.component(), componentInfo);
            anyDown |= check.status() == HealthStatus.Status.DOWN;
            anyDegraded |= check.status() == HealthStatus.Status.DEGRADED;
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", anyDown ? "DOWN" : anyDegraded ? "DEGRADED" : "UP");
        result.put("components", components);

        return anyDown ? ResponseEntity.status(503).body(result)
                       : ResponseEntity.ok(result);
    }
}
