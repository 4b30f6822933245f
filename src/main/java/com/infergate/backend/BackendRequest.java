package com.infergate.backend;

import com.infergate.model.ChatCompletionRequest;
import com.infergate.model.ChatMessage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request handed to a {@link BackendClient}, with gateway defaults applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackendRequest {

    public static final int DEFAULT_MAX_TOKENS = 4096;
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final double DEFAULT_TOP_P = 1.0;

    private List<ChatMessage> messages;
    private String model;
    private Integer maxTokens;
    private Double temperature;
    private Double topP;
    private List<String> stop;

    /**
     * Extra sampling and tool parameters forwarded under their wire names.
     */
    private Map<String, Object> extra;

    public static BackendRequest from(ChatCompletionRequest request) {
        Map<String, Object> extra = new LinkedHashMap<>();
        putIfPresent(extra, "top_k", request.getTopK());
        putIfPresent(extra, "frequency_penalty", request.getFrequencyPenalty());
        putIfPresent(extra, "presence_penalty", request.getPresencePenalty());
        putIfPresent(extra, "repetition_penalty", request.getRepetitionPenalty());
        putIfPresent(extra, "tools", request.getTools());
        putIfPresent(extra, "tool_choice", request.getToolChoice());
        putIfPresent(extra, "response_format", request.getResponseFormat());
        putIfPresent(extra, "user", request.getUser());
        putIfPresent(extra, "best_of", request.getBestOf());
        putIfPresent(extra, "use_beam_search", request.getUseBeamSearch());
        putIfPresent(extra, "skip_special_tokens", request.getSkipSpecialTokens());

        List<String> stop = request.getStop();

        return BackendRequest.builder()
                .messages(request.getMessages())
                .model(request.getModel())
                .maxTokens(request.getMaxTokens() != null ? request.getMaxTokens() : DEFAULT_MAX_TOKENS)
                .temperature(request.getTemperature() != null ? request.getTemperature() : DEFAULT_TEMPERATURE)
                .topP(request.getTopP() != null ? request.getTopP() : DEFAULT_TOP_P)
                .stop(stop == null || stop.isEmpty() ? null : List.copyOf(stop))
                .extra(extra)
                .build();
    }

    private static void putIfPresent(Map<String, Object> extra, String key, Object value) {
        if (value != null) {
            extra.put(key, value);
        }
    }
}
