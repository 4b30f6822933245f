package com.infergate.service;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Flux;

/**
 * An accepted streaming request: its correlation id and the lazy, single-use SSE frames.
 */
@Getter
@RequiredArgsConstructor
public class StreamingCompletion {

    private final String requestId;
    private final Flux<String> frames;
}
