package com.infergate.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.infergate.backend.BackendClient;
import com.infergate.backend.SimulatedBackendClient;
import com.infergate.backend.VllmBackendClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the backend client. The connection pool is released on context shutdown.
 */
@Slf4j
@Configuration
public class BackendClientConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "infergate.backend", name = "simulated", havingValue = "false", matchIfMissing = true)
    public BackendClient vllmBackendClient(InfergateProperties properties, ObjectMapper objectMapper) {
        log.info("Using vLLM backend at {} (request timeout {})",
                properties.getBackend().normalizedBaseUrl(), properties.getBackend().getRequestTimeout());
        return new VllmBackendClient(properties.getBackend(), objectMapper);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "infergate.backend", name = "simulated", havingValue = "true")
    public BackendClient simulatedBackendClient() {
        log.warn("Using simulated backend - completions are canned echoes, no inference is performed");
        return new SimulatedBackendClient();
    }
}
