package com.infergate.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Chat message in OpenAI format.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatMessage {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    @NotNull(message = "role is required")
    @Pattern(regexp = "system|user|assistant|tool", message = "role must be one of system, user, assistant, tool")
    @JsonProperty("role")
    private String role;

    @JsonProperty("content")
    private String content;

    @JsonProperty("name")
    private String name;

    @JsonProperty("tool_calls")
    private List<Map<String, Object>> toolCalls;

    @JsonProperty("tool_call_id")
    private String toolCallId;

    /**
     * Only a tool-invocation turn may omit content.
     */
    @JsonIgnore
    @AssertTrue(message = "content is required unless tool_calls is present")
    public boolean isContentPresentOrToolCall() {
        return content != null || (toolCalls != null && !toolCalls.isEmpty());
    }

    public static ChatMessage assistant(String content) {
        return ChatMessage.builder()
                .role(ROLE_ASSISTANT)
                .content(content)
                .build();
    }
}
