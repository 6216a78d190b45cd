package com.nicedentist.manager.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final Clock clock;

    @Value("${spring.application.name:nicedentist-manager}")
    private String serviceName;

    public HealthController(Clock clock) {
        this.clock = clock;
    }

    @GetMapping("/api/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "Healthy");
        body.put("service", serviceName);
        body.put("timestamp", Instant.now(clock));
        return body;
    }
}
