package com.infergate.service;

import com.infergate.backend.BackendClient;
import com.infergate.model.HealthStatus;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Liveness snapshot built from the shared counters plus a fresh backend probe.
 */
@Service
public class HealthService {

    private final BackendClient backendClient;
    private final ServerState serverState;

    public HealthService(BackendClient backendClient, ServerState serverState) {
        this.backendClient = backendClient;
        this.serverState = serverState;
    }

    /**
     * Status stays "healthy" while the process serves requests; backend reachability
     * is reported separately in {@code vllm_connected}.
     */
    public Mono<HealthStatus> snapshot() {
        return backendClient.healthCheck()
                .onErrorReturn(false)
                .defaultIfEmpty(false)
                .map(connected -> HealthStatus.builder()
                        .status(HealthStatus.HEALTHY)
                        .uptimeSeconds(round(serverState.uptime().toMillis() / 1000.0, 100))
                        .totalRequests(serverState.getTotalRequests())
                        .errorRate(round(serverState.errorRate(), 10_000))
                        .vllmConnected(connected)
                        .build());
    }

    private static double round(double value, int scale) {
        return Math.round(value * scale) / (double) scale;
    }
}
