package com.infergate.service;

import com.infergate.backend.BackendReply;
import com.infergate.model.ChatCompletionResponse;
import com.infergate.model.ChatMessage;
import com.infergate.model.Choice;
import com.infergate.model.FinishReason;
import com.infergate.model.Usage;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Maps a backend reply onto the OpenAI completion shape. Pure apart from the id and clock read.
 */
@Component
public class ResponseTranslator {

    private final Clock clock;

    public ResponseTranslator(Clock clock) {
        this.clock = clock;
    }

    public ChatCompletionResponse translate(BackendReply reply, String model) {
        ChatMessage message = ChatMessage.assistant(reply.getContent());
        message.setToolCalls(reply.getToolCalls());

        return ChatCompletionResponse.builder()
                .id(RequestIds.newId())
                .object(ChatCompletionResponse.OBJECT)
                .created(clock.instant().getEpochSecond())
                .model(model)
                .choices(List.of(Choice.builder()
                        .index(0)
                        .message(message)
                        .finishReason(reply.getFinishReason() != null ? reply.getFinishReason() : FinishReason.STOP)
                        .build()))
                .usage(Usage.of(reply.getPromptTokens(), reply.getCompletionTokens()))
                .build();
    }
}
