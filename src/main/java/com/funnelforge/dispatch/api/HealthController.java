package com.funnelforge.dispatch.api;

import com.funnelforge.core.health.HealthCheckService;
import com.funnelforge.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for engine health: scheduler, spend governor and arm registry.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health: 503 when a component is DOWN, 200 otherwise (DEGRADED included).
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        List<HealthStatus> checks = healthCheckService != null ? healthCheckService.checkAll() : List.of();
        HealthStatus.Status overall = healthCheckService != null
                ? HealthCheckService.overallStatus(checks)
                : HealthStatus.Status.DOWN;

        Map<String, Object> components = new LinkedHashMap<>();
        for (HealthStatus check : checks) {
            components.put(check.component(), describe(check));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", overall.name());
        body.put("components", components);
        HttpStatus code = overall == HealthStatus.Status.DOWN ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(code).body(body);
    }

    private static Map<String, String> describe(HealthStatus check) {
        Map<String, String> info = new LinkedHashMap<>();
        info.put("status", check.status().name());
        info.put("detail", check.detail());
        info.putAll(check.metadata());
        return info;
    }
}
