package com.infergate.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat completion request model.
 * Absent generation parameters fall back to the backend defaults applied in
 * {@link com.infergate.backend.BackendRequest#from(ChatCompletionRequest)}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatCompletionRequest {

    @NotBlank(message = "model is required")
    @JsonProperty("model")
    private String model;

    @NotNull(message = "messages is required")
    @JsonProperty("messages")
    private List<@Valid @NotNull ChatMessage> messages;

    @Min(1)
    @Max(131072)
    @JsonProperty("max_tokens")
    private Integer maxTokens;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    @JsonProperty("temperature")
    private Double temperature;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @JsonProperty("top_p")
    private Double topP;

    @Min(1)
    @JsonProperty("top_k")
    private Integer topK;

    @DecimalMin("-2.0")
    @DecimalMax("2.0")
    @JsonProperty("frequency_penalty")
    private Double frequencyPenalty;

    @DecimalMin("-2.0")
    @DecimalMax("2.0")
    @JsonProperty("presence_penalty")
    private Double presencePenalty;

    @DecimalMin("0.0")
    @JsonProperty("repetition_penalty")
    private Double repetitionPenalty;

    // "stop": "x" arrives as ["x"]
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    @JsonProperty("stop")
    private List<String> stop;

    @JsonProperty("stream")
    private Boolean stream;

    @JsonProperty("tools")
    private List<Map<String, Object>> tools;

    @JsonProperty("tool_choice")
    private Object toolChoice;

    @JsonProperty("response_format")
    private Map<String, Object> responseFormat;

    @JsonProperty("user")
    private String user;

    @JsonProperty("best_of")
    private Integer bestOf;

    @JsonProperty("use_beam_search")
    private Boolean useBeamSearch;

    @JsonProperty("skip_special_tokens")
    private Boolean skipSpecialTokens;

    @JsonIgnore
    public boolean isStreaming() {
        return Boolean.TRUE.equals(stream);
    }
}
