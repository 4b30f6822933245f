package com.infergate.backend;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.infergate.config.InfergateProperties;
import com.infergate.exception.BackendErrorException;
import com.infergate.exception.BackendUnavailableException;
import com.infergate.exception.InferenceException;
import com.infergate.exception.StreamInterruptedException;
import com.infergate.model.FinishReason;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Client for vLLM's OpenAI-compatible server.
 *
 * <p>The pooled connection resource is created on first use and recreated
 * transparently after {@link #close()}. Broken pooled connections are evicted
 * by the pool itself, so a request never reuses an errored channel.
 */
@Slf4j
public class VllmBackendClient implements BackendClient {

    static final String COMPLETIONS_PATH = "/v1/chat/completions";
    static final String HEALTH_PATH = "/health";

    private static final String DONE = "[DONE]";
    private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;
    private static final TypeReference<List<Map<String, Object>>> TOOL_CALLS_TYPE = new TypeReference<>() {
    };

    private final InfergateProperties.BackendConfig config;
    private final ObjectMapper objectMapper;
    private final AtomicInteger openStreams = new AtomicInteger();

    // guarded by this
    private ConnectionProvider connectionProvider;
    private WebClient webClient;
    private boolean closed = true;

    public VllmBackendClient(InfergateProperties.BackendConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return "vllm";
    }

    @Override
    public Mono<Boolean> healthCheck() {
        return Mono.defer(() -> client().get()
                        .uri(HEALTH_PATH)
                        .exchangeToMono(response -> response.releaseBody()
                                .thenReturn(response.statusCode().is2xxSuccessful())))
                .timeout(config.getHealthTimeout())
                .onErrorResume(error -> {
                    log.debug("Backend health probe failed: {}", error.toString());
                    return Mono.just(false);
                });
    }

    @Override
    public Mono<BackendReply> generate(BackendRequest request) {
        return Mono.defer(() -> {
                    log.debug("Forwarding completion to backend: model={}", request.getModel());
                    return client().post()
                            .uri(COMPLETIONS_PATH)
                            .contentType(MediaType.APPLICATION_JSON)
                            .bodyValue(payload(request, false))
                            .retrieve()
                            .bodyToMono(JsonNode.class);
                })
                .switchIfEmpty(Mono.error(() -> new BackendErrorException(200, "Backend returned an empty body")))
                .map(this::toReply)
                .onErrorMap(this::translateError)
                .doOnError(error -> log.error("Backend completion failed: {}", error.getMessage()));
    }

    @Override
    public Flux<StreamFragment> generateStream(BackendRequest request) {
        return Flux.defer(() -> {
            StreamCursor cursor = new StreamCursor();
            log.debug("Opening backend stream: model={}", request.getModel());

            return client().post()
                    .uri(COMPLETIONS_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(payload(request, true))
                    .retrieve()
                    .bodyToFlux(String.class)
                    .takeWhile(cursor::notDone)
                    .concatMapIterable(cursor::advance)
                    .concatWith(Flux.defer(cursor::complete))
                    .onErrorMap(error -> cursor.isStarted() && !(error instanceof InferenceException)
                            ? new StreamInterruptedException("Backend stream interrupted: " + error.getMessage(), error)
                            : translateError(error))
                    .doOnSubscribe(subscription -> openStreams.incrementAndGet())
                    .doFinally(signal -> {
                        openStreams.decrementAndGet();
                        if (signal == SignalType.CANCEL) {
                            log.debug("Backend stream cancelled by consumer, connection released");
                        }
                    });
        });
    }

    /**
     * Number of backend streams currently holding a connection.
     */
    public int openStreams() {
        return openStreams.get();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        if (!closed && connectionProvider != null) {
            log.info("Releasing backend connection pool for {}", config.normalizedBaseUrl());
            connectionProvider.dispose();
        }
        closed = true;
    }

    /**
     * Get the shared WebClient, (re)creating the pool if it was never opened or has been closed.
     */
    synchronized WebClient client() {
        if (webClient == null || closed) {
            connectionProvider = ConnectionProvider.builder("vllm-backend")
                    .maxIdleTime(config.getMaxIdleTime())
                    .build();

            HttpClient httpClient = HttpClient.create(connectionProvider)
                    .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.getConnectTimeout().toMillis())
                    .responseTimeout(config.getRequestTimeout());

            webClient = WebClient.builder()
                    .baseUrl(config.normalizedBaseUrl())
                    .clientConnector(new ReactorClientHttpConnector(httpClient))
                    .codecs(codecs -> {
                        codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE);
                        codecs.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(objectMapper));
                        codecs.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(objectMapper));
                    })
                    .build();
            closed = false;

            log.info("Opened backend connection pool for {}", config.normalizedBaseUrl());
        }
        return webClient;
    }

    ObjectNode payload(BackendRequest request, boolean stream) {
        ObjectNode body = objectMapper.createObjectNode();

        if (request.getExtra() != null) {
            request.getExtra().forEach((key, value) -> body.set(key, objectMapper.valueToTree(value)));
        }

        body.put("model", request.getModel());
        body.set("messages", objectMapper.valueToTree(request.getMessages()));
        body.put("max_tokens", request.getMaxTokens());
        body.put("temperature", request.getTemperature());
        body.put("top_p", request.getTopP());
        body.put("stream", stream);
        if (request.getStop() != null && !request.getStop().isEmpty()) {
            body.set("stop", objectMapper.valueToTree(request.getStop()));
        }
        return body;
    }

    private BackendReply toReply(JsonNode root) {
        JsonNode choice = root.path("choices").path(0);
        if (choice.isMissingNode()) {
            throw new BackendErrorException(200, "Backend returned no choices");
        }

        JsonNode message = choice.path("message");
        JsonNode usage = root.path("usage");
        JsonNode toolCalls = message.path("tool_calls");

        return BackendReply.builder()
                .content(message.path("content").isTextual() ? message.path("content").asText() : null)
                .finishReason(finishReason(choice.path("finish_reason")))
                .promptTokens(usage.path("prompt_tokens").asInt(0))
                .completionTokens(usage.path("completion_tokens").asInt(0))
                .toolCalls(toolCalls.isArray() && !toolCalls.isEmpty()
                        ? objectMapper.convertValue(toolCalls, TOOL_CALLS_TYPE)
                        : null)
                .build();
    }

    private FinishReason finishReason(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return FinishReason.STOP;
        }
        FinishReason reason = FinishReason.fromValue(node.asText());
        if (reason == null) {
            log.debug("Unrecognised backend finish_reason '{}', reporting stop", node.asText());
            return FinishReason.STOP;
        }
        return reason;
    }

    private Throwable translateError(Throwable error) {
        if (error instanceof InferenceException) {
            return error;
        }
        if (error instanceof WebClientResponseException responseError) {
            int status = responseError.getStatusCode().value();
            return new BackendErrorException(status, backendMessage(responseError.getResponseBodyAsString(), status));
        }
        return new BackendUnavailableException("Backend request failed: " + error, error);
    }

    /**
     * Pull the human-readable message out of a vLLM or OpenAI style error body.
     */
    String backendMessage(String body, int status) {
        String fallback = "Backend returned HTTP " + status;
        if (body == null || body.isBlank()) {
            return fallback;
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            for (JsonNode candidate : List.of(root.path("message"), root.path("error").path("message"),
                    root.path("detail"), root.path("error"))) {
                if (candidate.isTextual() && !candidate.asText().isBlank()) {
                    return candidate.asText();
                }
            }
        } catch (Exception e) {
            log.debug("Backend error body is not JSON: {}", e.getMessage());
        }
        return fallback;
    }

    /**
     * Per-subscription state turning backend SSE data payloads into fragments.
     */
    private final class StreamCursor {

        private boolean started;
        private boolean contentSeen;
        private boolean terminated;
        private boolean done;

        boolean notDone(String data) {
            if (DONE.equals(data.trim())) {
                done = true;
                return false;
            }
            return true;
        }

        boolean isStarted() {
            return started;
        }

        List<StreamFragment> advance(String data) {
            List<StreamFragment> fragments = new ArrayList<>(3);
            if (terminated || data.isBlank()) {
                return fragments;
            }

            JsonNode root;
            try {
                root = objectMapper.readTree(data);
            } catch (Exception e) {
                log.warn("Skipping malformed backend stream chunk: {}", e.getMessage());
                return fragments;
            }
            if (isErrorEvent(root)) {
                throw streamError(root, data);
            }

            if (!started) {
                started = true;
                fragments.add(StreamFragment.role());
            }

            JsonNode choice = root.path("choices").path(0);
            JsonNode content = choice.path("delta").path("content");
            if (content.isTextual() && !content.asText().isEmpty()) {
                contentSeen = true;
                fragments.add(StreamFragment.text(content.asText()));
            }

            JsonNode finish = choice.path("finish_reason");
            if (!finish.isMissingNode() && !finish.isNull()) {
                terminated = true;
                fragments.add(StreamFragment.finish(finishReason(finish)));
            }
            return fragments;
        }

        /**
         * vLLM reports generation failures in-band as {@code {"error": {...}}}
         * or an {@code "object": "error"} body, followed by {@code [DONE]}.
         */
        private boolean isErrorEvent(JsonNode root) {
            return root.path("error").isObject() || "error".equals(root.path("object").asText());
        }

        private InferenceException streamError(JsonNode root, String data) {
            terminated = true;
            JsonNode code = root.path("error").path("code");
            if (code.isMissingNode()) {
                code = root.path("code");
            }
            int status = code.canConvertToInt() && code.asInt() > 0 ? code.asInt() : 500;
            String message = backendMessage(data, status);

            if (contentSeen) {
                log.warn("Backend reported an error after partial content: {}", message);
                return new StreamInterruptedException("Backend stream failed: " + message);
            }
            log.warn("Backend reported an error before any content: {}", message);
            return new BackendErrorException(status, message);
        }

        Flux<StreamFragment> complete() {
            if (terminated) {
                return Flux.empty();
            }
            if (done) {
                terminated = true;
                return started
                        ? Flux.just(StreamFragment.finish(FinishReason.STOP))
                        : Flux.just(StreamFragment.role(), StreamFragment.finish(FinishReason.STOP));
            }
            return Flux.error(new StreamInterruptedException("Backend stream ended without a finish reason"));
        }
    }
}
