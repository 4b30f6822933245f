package com.infergate.controller;

import com.infergate.model.HealthStatus;
import com.infergate.service.HealthService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
public class HealthController {

    private final HealthService healthService;

    public HealthController(HealthService healthService) {
        this.healthService = healthService;
    }

    @GetMapping("/health")
    public Mono<HealthStatus> health() {
        return healthService.snapshot();
    }
}
