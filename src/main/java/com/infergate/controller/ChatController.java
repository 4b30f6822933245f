package com.infergate.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infergate.model.ChatCompletionRequest;
import com.infergate.model.ChatCompletionResponse;
import com.infergate.service.ChatCompletionService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * OpenAI-compatible chat completions controller.
 * Supports both regular JSON responses and SSE streaming.
 *
 * <p>Both shapes are written as raw bytes: the stream frames are already
 * SSE-formatted and must not pass through the server-sent-event encoder.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
public class ChatController {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    private final ChatCompletionService chatCompletionService;
    private final ObjectMapper objectMapper;

    public ChatController(ChatCompletionService chatCompletionService, ObjectMapper objectMapper) {
        this.chatCompletionService = chatCompletionService;
        this.objectMapper = objectMapper;
    }

    @PostMapping(value = "/chat/completions",
                 consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Flux<DataBuffer>>> createChatCompletion(@Valid @RequestBody ChatCompletionRequest request) {
        log.info("Received chat completion request for model: {}, stream: {}",
                request.getModel(), request.isStreaming());

        if (request.isStreaming()) {
            return handleStreamingRequest(request);
        }
        return handleRegularRequest(request);
    }

    private Mono<ResponseEntity<Flux<DataBuffer>>> handleRegularRequest(ChatCompletionRequest request) {
        return chatCompletionService.complete(request)
                .map(response -> ResponseEntity.ok()
                        .header(REQUEST_ID_HEADER, response.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(Flux.just(wrap(toJson(response)))));
    }

    private Mono<ResponseEntity<Flux<DataBuffer>>> handleStreamingRequest(ChatCompletionRequest request) {
        return chatCompletionService.stream(request)
                .map(completion -> {
                    HttpHeaders headers = new HttpHeaders();
                    headers.setContentType(MediaType.TEXT_EVENT_STREAM);
                    headers.setCacheControl("no-cache");
                    headers.setConnection("keep-alive");
                    headers.add(REQUEST_ID_HEADER, completion.getRequestId());

                    Flux<DataBuffer> body = completion.getFrames()
                            .map(ChatController::wrapFrame);

                    return ResponseEntity.ok()
                            .headers(headers)
                            .body(body);
                });
    }

    private byte[] toJson(ChatCompletionResponse response) {
        try {
            return objectMapper.writeValueAsBytes(response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize completion " + response.getId(), e);
        }
    }

    private static DataBuffer wrap(byte[] bytes) {
        return DefaultDataBufferFactory.sharedInstance.wrap(bytes);
    }

    private static DataBuffer wrapFrame(String frame) {
        return wrap(frame.getBytes(StandardCharsets.UTF_8));
    }
}
