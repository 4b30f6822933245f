package com.infergate.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for Infergate.
 */
@Data
@Component
@ConfigurationProperties(prefix = "infergate")
public class InfergateProperties {

    private BackendConfig backend = new BackendConfig();
    private ModelConfig model = new ModelConfig();
    private PricingConfig pricing = new PricingConfig();
    private StreamingConfig streaming = new StreamingConfig();

    @Data
    public static class BackendConfig {
        private String baseUrl = "http://localhost:8080";

        /**
         * Shared by single-shot and streaming calls. Generous to fit long-context generation.
         * Bare numbers are seconds.
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration requestTimeout = Duration.ofSeconds(300);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration healthTimeout = Duration.ofSeconds(5);
        private Duration maxIdleTime = Duration.ofSeconds(60);

        /**
         * Serve canned completions instead of calling the backend.
         */
        private boolean simulated = false;

        /**
         * Base URL without trailing slashes.
         */
        public String normalizedBaseUrl() {
            String url = baseUrl == null ? "" : baseUrl.trim();
            while (url.endsWith("/")) {
                url = url.substring(0, url.length() - 1);
            }
            return url;
        }
    }

    @Data
    public static class ModelConfig {
        private String id = "your-org/your-model";
        private String displayName = "Your Model Display Name";
        private String organizationId = "your-org";
        private int contextLength = 131072;
        private String quantization = "fp16";
        private List<String> supportedFeatures = new ArrayList<>(List.of("tools", "json_mode", "streaming"));
    }

    @Data
    public static class PricingConfig {
        private String prompt = "0.000008";
        private String completion = "0.000024";
    }

    @Data
    public static class StreamingConfig {
        private Duration keepAliveInterval = Duration.ofSeconds(15);
    }
}
