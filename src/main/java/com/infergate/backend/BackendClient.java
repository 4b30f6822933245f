package com.infergate.backend;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Contract for the single downstream inference backend.
 * Implementations handle transport, request mapping and reply normalisation;
 * callers never branch on which implementation they hold.
 */
public interface BackendClient extends AutoCloseable {

    /**
     * Get client name for logging (e.g., "vllm", "simulated").
     *
     * @return client name
     */
    String getName();

    /**
     * Short-timeout liveness probe. Never errors: any transport failure or
     * non-success status yields {@code false}.
     *
     * @return true if the backend answered the probe successfully
     */
    Mono<Boolean> healthCheck();

    /**
     * Single blocking-style generation.
     *
     * @param request normalised backend request
     * @return full reply, or an error signal of
     *         {@link com.infergate.exception.BackendUnavailableException} /
     *         {@link com.infergate.exception.BackendErrorException}
     */
    Mono<BackendReply> generate(BackendRequest request);

    /**
     * Chunked generation. The sequence is cold and single-use: a role
     * announcement first, non-empty text deltas next, exactly one finish
     * fragment last. Cancelling the subscription releases the underlying
     * connection without raising.
     *
     * @param request normalised backend request
     * @return lazy fragment sequence
     */
    Flux<StreamFragment> generateStream(BackendRequest request);

    /**
     * Release transport resources. Safe to call more than once.
     */
    @Override
    void close();
}
