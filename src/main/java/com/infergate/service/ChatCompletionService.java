package com.infergate.service;

import com.infergate.backend.BackendClient;
import com.infergate.backend.BackendRequest;
import com.infergate.exception.BackendErrorException;
import com.infergate.exception.InvalidRequestException;
import com.infergate.model.ChatCompletionRequest;
import com.infergate.model.ChatCompletionResponse;
import com.infergate.model.ChatMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Entry point for chat completion requests: checks conversation invariants,
 * dispatches to the backend and keeps the shared counters in step.
 *
 * <p>There is a single backend, so failures are reported without retry.
 */
@Slf4j
@Service
public class ChatCompletionService {

    private final BackendClient backendClient;
    private final ResponseTranslator responseTranslator;
    private final StreamingService streamingService;
    private final ServerState serverState;

    public ChatCompletionService(BackendClient backendClient,
                                 ResponseTranslator responseTranslator,
                                 StreamingService streamingService,
                                 ServerState serverState) {
        this.backendClient = backendClient;
        this.responseTranslator = responseTranslator;
        this.streamingService = streamingService;
        this.serverState = serverState;
    }

    /**
     * Single-shot completion.
     */
    public Mono<ChatCompletionResponse> complete(ChatCompletionRequest request) {
        return Mono.defer(() -> {
                    serverState.recordRequest();
                    validate(request);
                    log.debug("Dispatching completion to {} backend: model={}", backendClient.getName(), request.getModel());

                    return backendClient.generate(BackendRequest.from(request))
                            .switchIfEmpty(Mono.error(() -> new BackendErrorException(200, "Backend returned no reply")))
                            .map(reply -> responseTranslator.translate(reply, request.getModel()));
                })
                .doOnNext(response -> log.info("Completed {} (finish_reason={}, completion_tokens={})",
                        response.getId(),
                        response.getChoices().get(0).getFinishReason().getValue(),
                        response.getUsage().getCompletionTokens()))
                .doOnError(error -> serverState.recordError());
    }

    /**
     * Accept a streaming completion. The request is counted and validated when the
     * returned Mono is subscribed; backend failures during the stream are counted
     * once, when the frame sequence ends abnormally.
     */
    public Mono<StreamingCompletion> stream(ChatCompletionRequest request) {
        return Mono.defer(() -> {
                    serverState.recordRequest();
                    validate(request);

                    String requestId = RequestIds.newId();
                    log.debug("Opening stream {} to {} backend: model={}",
                            requestId, backendClient.getName(), request.getModel());

                    Flux<String> frames = streamingService
                            .frame(requestId, request.getModel(),
                                    backendClient.generateStream(BackendRequest.from(request)),
                                    error -> serverState.recordError())
                            .doOnComplete(() -> log.info("Stream {} completed", requestId))
                            .doOnCancel(() -> log.debug("Client disconnected from stream {}", requestId));

                    return Mono.just(new StreamingCompletion(requestId, frames));
                })
                .doOnError(error -> serverState.recordError());
    }

    /**
     * Messages must be non-empty and a user turn must follow the last system message.
     */
    void validate(ChatCompletionRequest request) {
        List<ChatMessage> messages = request.getMessages();
        if (messages == null || messages.isEmpty()) {
            throw new InvalidRequestException("messages must contain at least one message");
        }

        int lastSystem = -1;
        for (int i = 0; i < messages.size(); i++) {
            if (ChatMessage.ROLE_SYSTEM.equals(messages.get(i).getRole())) {
                lastSystem = i;
            }
        }

        for (int i = lastSystem + 1; i < messages.size(); i++) {
            if (ChatMessage.ROLE_USER.equals(messages.get(i).getRole())) {
                return;
            }
        }
        throw new InvalidRequestException("messages must include a user message after any system messages");
    }
}
