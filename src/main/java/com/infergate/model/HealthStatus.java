package com.infergate.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code GET /health}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthStatus {

    public static final String HEALTHY = "healthy";

    @JsonProperty("status")
    private String status;

    @JsonProperty("uptime_seconds")
    private double uptimeSeconds;

    @JsonProperty("total_requests")
    private long totalRequests;

    @JsonProperty("error_rate")
    private double errorRate;

    @JsonProperty("vllm_connected")
    private boolean vllmConnected;
}
