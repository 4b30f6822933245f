package com.infergate.backend;

import com.infergate.model.FinishReason;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Normalised single-shot reply from the backend.
 * Carries no total token count: the total is always derived downstream.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackendReply {

    private String content;
    private FinishReason finishReason;
    private int promptTokens;
    private int completionTokens;

    /**
     * Present only on tool-invocation turns.
     */
    private List<Map<String, Object>> toolCalls;
}
