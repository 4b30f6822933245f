package com.infergate.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Model metadata for aggregator discovery, returned by {@code /api/v1/models}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelInfo {

    @JsonProperty("id")
    private String id;

    @JsonProperty("object")
    private String object;

    @JsonProperty("created")
    private long created;

    @JsonProperty("owned_by")
    private String ownedBy;

    @JsonProperty("name")
    private String name;

    @JsonProperty("context_length")
    private int contextLength;

    @JsonProperty("pricing")
    private Pricing pricing;

    @JsonProperty("quantization")
    private String quantization;

    @JsonProperty("supported_features")
    private List<String> supportedFeatures;

    /**
     * Per-token prices in USD, kept as strings to avoid float formatting drift.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Pricing {

        @JsonProperty("prompt")
        private String prompt;

        @JsonProperty("completion")
        private String completion;
    }
}
