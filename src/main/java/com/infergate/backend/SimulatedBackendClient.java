package com.infergate.backend;

import com.infergate.model.ChatMessage;
import com.infergate.model.FinishReason;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.List;

/**
 * Backend stand-in that never touches the network.
 * Echoes the last user message, deterministic for the same input.
 */
@Slf4j
public class SimulatedBackendClient implements BackendClient {

    static final String PREFIX = "Mock response to: ";
    static final String FALLBACK_PROMPT = "Hello!";
    static final int ECHO_LIMIT = 50;
    static final int PROMPT_TOKENS = 10;

    @Override
    public String getName() {
        return "simulated";
    }

    @Override
    public Mono<Boolean> healthCheck() {
        return Mono.just(true);
    }

    @Override
    public Mono<BackendReply> generate(BackendRequest request) {
        return Mono.fromSupplier(() -> reply(request));
    }

    @Override
    public Flux<StreamFragment> generateStream(BackendRequest request) {
        return Flux.defer(() -> {
            BackendReply reply = reply(request);
            return Flux.concat(
                    Flux.just(StreamFragment.role()),
                    Flux.fromIterable(words(reply.getContent())).map(StreamFragment::text),
                    Flux.just(StreamFragment.finish(reply.getFinishReason())));
        });
    }

    @Override
    public void close() {
        log.debug("Simulated backend closed");
    }

    BackendReply reply(BackendRequest request) {
        List<String> words = words(PREFIX + echo(lastUserContent(request.getMessages())));

        FinishReason finishReason = FinishReason.STOP;
        Integer maxTokens = request.getMaxTokens();
        if (maxTokens != null && words.size() > maxTokens) {
            words = words.subList(0, maxTokens);
            finishReason = FinishReason.LENGTH;
        }

        String content = String.join("", words).stripTrailing();
        return BackendReply.builder()
                .content(content)
                .finishReason(finishReason)
                .promptTokens(PROMPT_TOKENS)
                .completionTokens(words.size())
                .build();
    }

    /**
     * Split into word-sized pieces, each keeping its trailing whitespace, so the
     * pieces concatenate back to the exact input.
     */
    static List<String> words(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(content.split("(?<=\\s)(?=\\S)"));
    }

    private static String lastUserContent(List<ChatMessage> messages) {
        if (messages != null) {
            for (int i = messages.size() - 1; i >= 0; i--) {
                ChatMessage message = messages.get(i);
                if (ChatMessage.ROLE_USER.equals(message.getRole())) {
                    return message.getContent() != null ? message.getContent() : "";
                }
            }
        }
        return FALLBACK_PROMPT;
    }

    private static String echo(String content) {
        int end = content.offsetByCodePoints(0, Math.min(ECHO_LIMIT, content.codePointCount(0, content.length())));
        return content.substring(0, end);
    }
}
