package com.infergate.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.infergate.config.InfergateProperties;
import com.infergate.exception.BackendErrorException;
import com.infergate.exception.BackendUnavailableException;
import com.infergate.exception.StreamInterruptedException;
import com.infergate.model.ChatMessage;
import com.infergate.model.FinishReason;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for VllmBackendClient against a throwaway HTTP server standing in for vLLM.
 */
class VllmBackendClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final AtomicInteger healthStatus = new AtomicInteger(200);
    private final AtomicReference<Duration> healthDelay = new AtomicReference<>(Duration.ZERO);
    private final AtomicReference<BiFunction<HttpServerRequest, HttpServerResponse, Publisher<Void>>> completions =
            new AtomicReference<>();

    private DisposableServer server;
    private InfergateProperties.BackendConfig config;
    private VllmBackendClient client;

    @BeforeEach
    void setUp() {
        server = HttpServer.create()
                .host("localhost")
                .port(0)
                .route(routes -> routes
                        .get("/health", (request, response) -> Mono.delay(healthDelay.get())
                                .then(response.status(healthStatus.get()).send().then()))
                        .post("/v1/chat/completions", (request, response) -> completions.get().apply(request, response)))
                .bindNow();

        config = new InfergateProperties.BackendConfig();
        config.setBaseUrl("http://localhost:" + server.port() + "/");
        config.setRequestTimeout(Duration.ofSeconds(5));
        config.setHealthTimeout(Duration.ofMillis(500));
        client = new VllmBackendClient(config, objectMapper);
    }

    @AfterEach
    void tearDown() {
        client.close();
        if (server != null) {
            server.disposeNow();
        }
    }

    @Test
    void testHealthCheckSucceeds() {
        StepVerifier.create(client.healthCheck())
                .expectNext(true)
                .verifyComplete();
    }

    @Test
    void testHealthCheckFalseOnServerError() {
        healthStatus.set(500);

        StepVerifier.create(client.healthCheck())
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void testHealthCheckFalseWhenSlow() {
        healthDelay.set(Duration.ofSeconds(3));

        StepVerifier.create(client.healthCheck())
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void testHealthCheckFalseWhenUnreachable() {
        server.disposeNow();
        server = null;

        StepVerifier.create(client.healthCheck())
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void testGenerateParsesReply() {
        respondJson(200, """
                {"id":"cmpl-1","object":"chat.completion","created":1,"model":"m",
                 "choices":[{"index":0,"message":{"role":"assistant","content":"Hi there"},"finish_reason":"length"}],
                 "usage":{"prompt_tokens":7,"completion_tokens":2,"total_tokens":999}}
                """);

        StepVerifier.create(client.generate(request()))
                .assertNext(reply -> {
                    assertEquals("Hi there", reply.getContent());
                    assertEquals(FinishReason.LENGTH, reply.getFinishReason());
                    assertEquals(7, reply.getPromptTokens());
                    assertEquals(2, reply.getCompletionTokens());
                    assertNull(reply.getToolCalls());
                })
                .verifyComplete();
    }

    @Test
    void testGenerateCopiesToolCalls() {
        respondJson(200, """
                {"choices":[{"index":0,"message":{"role":"assistant","content":null,
                  "tool_calls":[{"id":"call_1","type":"function","function":{"name":"lookup","arguments":"{}"}}]},
                  "finish_reason":"tool_calls"}],
                 "usage":{"prompt_tokens":3,"completion_tokens":4}}
                """);

        StepVerifier.create(client.generate(request()))
                .assertNext(reply -> {
                    assertNull(reply.getContent());
                    assertEquals(FinishReason.TOOL_CALLS, reply.getFinishReason());
                    assertEquals(1, reply.getToolCalls().size());
                    assertEquals("call_1", reply.getToolCalls().get(0).get("id"));
                })
                .verifyComplete();
    }

    @Test
    void testUnknownOrMissingFinishReasonMapsToStop() {
        respondJson(200, """
                {"choices":[{"index":0,"message":{"role":"assistant","content":"x"},"finish_reason":"abort"}]}
                """);
        StepVerifier.create(client.generate(request()))
                .assertNext(reply -> assertEquals(FinishReason.STOP, reply.getFinishReason()))
                .verifyComplete();

        respondJson(200, """
                {"choices":[{"index":0,"message":{"role":"assistant","content":"x"},"finish_reason":null}]}
                """);
        StepVerifier.create(client.generate(request()))
                .assertNext(reply -> assertEquals(FinishReason.STOP, reply.getFinishReason()))
                .verifyComplete();
    }

    @Test
    void testGenerateMapsBackendErrorStatus() {
        respondJson(400, """
                {"object":"error","message":"max_tokens is too large","type":"BadRequestError","code":400}
                """);

        StepVerifier.create(client.generate(request()))
                .expectErrorSatisfies(error -> {
                    BackendErrorException backendError = assertInstanceOf(BackendErrorException.class, error);
                    assertEquals(400, backendError.getBackendStatus());
                    assertEquals("max_tokens is too large", backendError.getMessage());
                })
                .verify();
    }

    @Test
    void testGenerateMapsTransportFailure() {
        server.disposeNow();
        server = null;

        StepVerifier.create(client.generate(request()))
                .expectError(BackendUnavailableException.class)
                .verify();
    }

    @Test
    void testGenerateTimesOut() {
        config.setRequestTimeout(Duration.ofMillis(300));
        completions.set((request, response) -> Mono.delay(Duration.ofSeconds(3))
                .then(response.sendString(Mono.just("{}")).then()));

        StepVerifier.create(client.generate(request()))
                .expectError(BackendUnavailableException.class)
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void testPayloadAppliesCoreFieldsOverExtras() {
        BackendRequest request = BackendRequest.builder()
                .model("m")
                .messages(List.of(ChatMessage.builder().role("user").content("Hello").build()))
                .maxTokens(64)
                .temperature(0.2)
                .topP(0.9)
                .stop(List.of("###"))
                .extra(Map.of("top_k", 5, "stream", true))
                .build();

        ObjectNode body = client.payload(request, false);

        assertEquals("m", body.get("model").asText());
        assertEquals(64, body.get("max_tokens").asInt());
        assertEquals(0.2, body.get("temperature").asDouble());
        assertEquals(0.9, body.get("top_p").asDouble());
        assertEquals(5, body.get("top_k").asInt());
        assertFalse(body.get("stream").asBoolean());
        assertEquals("###", body.get("stop").get(0).asText());
        assertEquals("Hello", body.get("messages").get(0).get("content").asText());
    }

    @Test
    void testPayloadOmitsEmptyStop() {
        ObjectNode body = client.payload(request(), true);

        assertFalse(body.has("stop"));
        assertTrue(body.get("stream").asBoolean());
    }

    @Test
    void testBackendMessageFallsBackToStatus() {
        assertEquals("Backend returned HTTP 502", client.backendMessage("<html>bad gateway</html>", 502));
        assertEquals("Backend returned HTTP 503", client.backendMessage("", 503));
        assertEquals("nested", client.backendMessage("{\"error\":{\"message\":\"nested\"}}", 500));
        assertEquals("detail text", client.backendMessage("{\"detail\":\"detail text\"}", 422));
    }

    @Test
    void testStreamProducesFragments() {
        respondStream(Flux.just(
                data(chunk("assistant", null, null)),
                data(chunk(null, "Hel", null)),
                data(chunk(null, "", null)),
                data(chunk(null, "lo", null)),
                data(chunk(null, null, "stop")),
                "data: [DONE]\n\n"), false);

        StepVerifier.create(client.generateStream(request()))
                .expectNext(StreamFragment.role())
                .expectNext(StreamFragment.text("Hel"))
                .expectNext(StreamFragment.text("lo"))
                .expectNext(StreamFragment.finish(FinishReason.STOP))
                .verifyComplete();

        assertEquals(0, client.openStreams());
    }

    @Test
    void testStreamSkipsMalformedChunks() {
        respondStream(Flux.just(
                data(chunk(null, "ok", null)),
                "data: {not json\n\n",
                data(chunk(null, null, "length")),
                "data: [DONE]\n\n"), false);

        StepVerifier.create(client.generateStream(request()))
                .expectNext(StreamFragment.role())
                .expectNext(StreamFragment.text("ok"))
                .expectNext(StreamFragment.finish(FinishReason.LENGTH))
                .verifyComplete();
    }

    @Test
    void testStreamSynthesizesStopOnDoneWithoutFinishReason() {
        respondStream(Flux.just(
                data(chunk(null, "partial", null)),
                "data: [DONE]\n\n"), false);

        StepVerifier.create(client.generateStream(request()))
                .expectNext(StreamFragment.role())
                .expectNext(StreamFragment.text("partial"))
                .expectNext(StreamFragment.finish(FinishReason.STOP))
                .verifyComplete();
    }

    @Test
    void testStreamInterruptedWhenConnectionEndsEarly() {
        respondStream(Flux.just(data(chunk(null, "partial", null))), false);

        StepVerifier.create(client.generateStream(request()))
                .expectNext(StreamFragment.role())
                .expectNext(StreamFragment.text("partial"))
                .expectError(StreamInterruptedException.class)
                .verify(Duration.ofSeconds(5));

        assertEquals(0, client.openStreams());
    }

    @Test
    void testStreamMapsErrorStatusBeforeStart() {
        respondJson(503, "{\"message\":\"model is loading\"}");

        StepVerifier.create(client.generateStream(request()))
                .expectErrorSatisfies(error -> {
                    BackendErrorException backendError = assertInstanceOf(BackendErrorException.class, error);
                    assertEquals(503, backendError.getBackendStatus());
                    assertEquals("model is loading", backendError.getMessage());
                })
                .verify();
    }

    @Test
    void testGenerateRejectsEmptyBody() {
        respondJson(200, "");

        StepVerifier.create(client.generate(request()))
                .expectErrorSatisfies(error -> {
                    BackendErrorException backendError = assertInstanceOf(BackendErrorException.class, error);
                    assertEquals(200, backendError.getBackendStatus());
                    assertEquals("Backend returned an empty body", backendError.getMessage());
                })
                .verify();
    }

    @Test
    void testStreamErrorEventBeforeContentIsBackendError() {
        respondStream(Flux.just(
                data("{\"error\":{\"message\":\"prompt too long\",\"type\":\"BadRequestError\",\"code\":400}}"),
                "data: [DONE]\n\n"), false);

        StepVerifier.create(client.generateStream(request()))
                .expectErrorSatisfies(error -> {
                    BackendErrorException backendError = assertInstanceOf(BackendErrorException.class, error);
                    assertEquals(400, backendError.getBackendStatus());
                    assertEquals("prompt too long", backendError.getMessage());
                })
                .verify(Duration.ofSeconds(5));

        assertEquals(0, client.openStreams());
    }

    @Test
    void testStreamErrorEventAfterRoleOnlyIsBackendError() {
        respondStream(Flux.just(
                data(chunk("assistant", null, null)),
                data("{\"object\":\"error\",\"message\":\"engine dead\",\"code\":503}"),
                "data: [DONE]\n\n"), false);

        StepVerifier.create(client.generateStream(request()))
                .expectNext(StreamFragment.role())
                .expectErrorSatisfies(error -> {
                    BackendErrorException backendError = assertInstanceOf(BackendErrorException.class, error);
                    assertEquals(503, backendError.getBackendStatus());
                    assertEquals("engine dead", backendError.getMessage());
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void testStreamErrorEventAfterContentIsInterruption() {
        respondStream(Flux.just(
                data(chunk(null, "partial", null)),
                data("{\"error\":{\"message\":\"out of memory\",\"code\":500}}"),
                "data: [DONE]\n\n"), false);

        StepVerifier.create(client.generateStream(request()))
                .expectNext(StreamFragment.role())
                .expectNext(StreamFragment.text("partial"))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(StreamInterruptedException.class, error);
                    assertTrue(error.getMessage().contains("out of memory"));
                })
                .verify(Duration.ofSeconds(5));

        assertEquals(0, client.openStreams());
    }

    @Test
    void testCancellationReleasesStream() {
        respondStream(Flux.just(data(chunk(null, "first", null))), true);

        StepVerifier.create(client.generateStream(request()))
                .expectNext(StreamFragment.role())
                .expectNext(StreamFragment.text("first"))
                .then(() -> assertEquals(1, client.openStreams()))
                .thenCancel()
                .verify(Duration.ofSeconds(5));

        assertEquals(0, client.openStreams());

        // the pool still serves later requests
        respondJson(200, """
                {"choices":[{"index":0,"message":{"role":"assistant","content":"after"},"finish_reason":"stop"}]}
                """);
        StepVerifier.create(client.generate(request()))
                .assertNext(reply -> assertEquals("after", reply.getContent()))
                .verifyComplete();
    }

    @Test
    void testCloseAndReacquire() {
        respondJson(200, """
                {"choices":[{"index":0,"message":{"role":"assistant","content":"x"},"finish_reason":"stop"}]}
                """);
        assertTrue(client.isClosed());

        StepVerifier.create(client.generate(request())).expectNextCount(1).verifyComplete();
        assertFalse(client.isClosed());

        client.close();
        client.close();
        assertTrue(client.isClosed());

        StepVerifier.create(client.generate(request())).expectNextCount(1).verifyComplete();
        assertFalse(client.isClosed());
    }

    private BackendRequest request() {
        return BackendRequest.builder()
                .model("m")
                .messages(List.of(ChatMessage.builder().role("user").content("Hello").build()))
                .maxTokens(16)
                .temperature(0.7)
                .topP(1.0)
                .build();
    }

    private void respondJson(int status, String body) {
        completions.set((request, response) -> request.receive().aggregate().then(
                response.status(status)
                        .header("Content-Type", "application/json")
                        .sendString(Mono.just(body))
                        .then()));
    }

    private void respondStream(Flux<String> frames, boolean holdOpen) {
        Flux<String> body = holdOpen ? frames.concatWith(Flux.never()) : frames;
        completions.set((request, response) -> request.receive().aggregate().then(
                response.status(200)
                        .header("Content-Type", "text/event-stream")
                        .send(body.map(VllmBackendClientTest::buffer), buf -> true)
                        .then()));
    }

    private static ByteBuf buffer(String text) {
        return Unpooled.copiedBuffer(text, StandardCharsets.UTF_8);
    }

    private static String data(String json) {
        return "data: " + json + "\n\n";
    }

    private String chunk(String role, String content, String finishReason) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("id", "cmpl-1");
        root.put("object", "chat.completion.chunk");
        ObjectNode choice = root.putArray("choices").addObject();
        choice.put("index", 0);
        ObjectNode delta = choice.putObject("delta");
        if (role != null) {
            delta.put("role", role);
        }
        if (content != null) {
            delta.put("content", content);
        }
        if (finishReason != null) {
            choice.put("finish_reason", finishReason);
        } else {
            choice.putNull("finish_reason");
        }
        return root.toString();
    }
}
