package com.photonlab.backend.api;

import com.photonlab.backend.config.PhotonLabProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final PhotonLabProperties properties;

    public HealthController(PhotonLabProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of(
                "status", "healthy",
                "cpu_count", Runtime.getRuntime().availableProcessors()
        );
    }

    @GetMapping("/info")
    public Map<String, Object> info() {
        PhotonLabProperties.Sweep sweep = properties.getSweep();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("cpu_count", Runtime.getRuntime().availableProcessors());
        out.put("max_workers_per_job", sweep.resolvedWorkersPerJob());
        out.put("max_concurrent_solves", sweep.resolvedConcurrentSolves());
        out.put("task_timeout_seconds", sweep.getTaskTimeout().toSeconds());
        out.put("solver_url", properties.getSolver().getBaseUrl());
        return out;
    }
}
