package com.infergate.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infergate.backend.StreamFragment;
import com.infergate.config.InfergateProperties;
import com.infergate.exception.InferenceException;
import com.infergate.exception.StreamInterruptedException;
import com.infergate.model.ChatCompletionChunk;
import com.infergate.model.ChatMessage;
import com.infergate.model.Delta;
import com.infergate.model.ErrorResponse;
import com.infergate.model.FinishReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Turns backend stream fragments into OpenAI-compatible SSE frames.
 *
 * <p>Every frame of one stream shares the request id and the {@code created}
 * timestamp read when the stream starts. The role announcement is held back
 * until the next fragment arrives, so a backend that fails before producing
 * anything leaves the response uncommitted and the failure can still be
 * reported as an error envelope.
 *
 * <p>Abnormal endings:
 * <ul>
 *   <li>content already delivered: a synthetic {@code stop} chunk and {@code [DONE]} close the stream</li>
 *   <li>only keep-alives or the role frame written: an error frame and {@code [DONE]}</li>
 *   <li>nothing written: the failure propagates to the caller</li>
 * </ul>
 */
@Slf4j
@Service
public class StreamingService {

    public static final String DONE_FRAME = "data: [DONE]\n\n";
    public static final String KEEP_ALIVE_FRAME = ": keep-alive\n\n";

    private final InfergateProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public StreamingService(InfergateProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Frame a fragment sequence as SSE.
     *
     * @param requestId     correlation id stamped on every chunk
     * @param model         model name echoed on every chunk
     * @param fragments     backend fragments, consumed once
     * @param onInterrupted notified once if the fragment sequence ends abnormally
     * @return finite, single-use frame sequence ending with {@link #DONE_FRAME}
     */
    public Flux<String> frame(String requestId, String model, Flux<StreamFragment> fragments,
                              Consumer<Throwable> onInterrupted) {
        return Flux.defer(() -> {
            FrameWriter writer = new FrameWriter(requestId, model, clock.instant().getEpochSecond());

            Flux<String> content = fragments
                    .concatMapIterable(writer::accept)
                    .concatWith(Flux.defer(() -> writer.isFinished()
                            ? Flux.empty()
                            : Flux.error(new StreamInterruptedException("Backend stream ended without a finish reason"))));

            return withKeepAlive(content, writer)
                    .onErrorResume(error -> recover(writer, error, onInterrupted))
                    .takeUntil(DONE_FRAME::equals);
        });
    }

    /**
     * Interleave keep-alive comments whenever no frame has gone out for one interval.
     */
    private Flux<String> withKeepAlive(Flux<String> content, FrameWriter writer) {
        Duration interval = properties.getStreaming().getKeepAliveInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            return content;
        }

        return content.publish(shared -> {
            // Failures reach the caller through the content branch only
            Flux<String> observed = shared.onErrorResume(error -> Flux.empty());
            Mono<Boolean> contentEnded = observed.then(Mono.just(Boolean.TRUE));

            // Each content frame restarts the idle timer; the seed arms the first one.
            Flux<String> keepAlives = observed
                    .startWith(KEEP_ALIVE_FRAME)
                    .switchMap(frame -> Flux.interval(interval, interval).onBackpressureDrop())
                    .map(tick -> KEEP_ALIVE_FRAME)
                    .doOnNext(frame -> writer.markCommitted())
                    .takeUntilOther(contentEnded);

            return Flux.merge(shared, keepAlives);
        });
    }

    private Flux<String> recover(FrameWriter writer, Throwable error, Consumer<Throwable> onInterrupted) {
        if (writer.isFinished()) {
            return Flux.empty();
        }
        onInterrupted.accept(error);

        if (writer.isContentDelivered()) {
            log.warn("Backend stream {} interrupted after partial content, closing with stop: {}",
                    writer.requestId, error.getMessage());
            return Flux.fromIterable(writer.interrupt());
        }

        InferenceException failure = error instanceof InferenceException inferenceError
                ? inferenceError
                : new StreamInterruptedException("Backend stream failed: " + error.getMessage(), error);

        if (writer.isCommitted()) {
            log.warn("Backend stream {} failed before any content: {}", writer.requestId, error.getMessage());
            return Flux.just(errorFrame(failure), DONE_FRAME);
        }

        log.debug("Backend stream {} failed before any frame was written", writer.requestId);
        return Flux.error(failure);
    }

    private String errorFrame(InferenceException failure) {
        ErrorResponse body = ErrorResponse.of(failure.getClientMessage(), failure.getStatus().value());
        return "data: " + serializeToJson(body) + "\n\n";
    }

    /**
     * Serialize to JSON using ObjectMapper.
     */
    private String serializeToJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize stream frame", e);
        }
    }

    /**
     * Per-stream framing state.
     */
    private final class FrameWriter {

        private final String requestId;
        private final String model;
        private final long created;

        private boolean roleSent;
        private boolean contentDelivered;
        private volatile boolean finished;
        private volatile boolean committed;

        FrameWriter(String requestId, String model, long created) {
            this.requestId = requestId;
            this.model = model;
            this.created = created;
        }

        List<String> accept(StreamFragment fragment) {
            List<String> frames = new ArrayList<>(3);
            if (finished) {
                return frames;
            }

            if (fragment.getKind() == StreamFragment.Kind.ROLE) {
                // held until the next fragment, see flushRole
                return frames;
            }

            if (fragment.getKind() == StreamFragment.Kind.TEXT) {
                flushRole(frames);
                frames.add(chunk(Delta.builder().content(fragment.getText()).build(), null));
                contentDelivered = true;
            } else {
                flushRole(frames);
                frames.add(chunk(new Delta(), fragment.getFinishReason()));
                frames.add(DONE_FRAME);
                finished = true;
            }

            if (!frames.isEmpty()) {
                committed = true;
            }
            return frames;
        }

        List<String> interrupt() {
            List<String> frames = new ArrayList<>(2);
            frames.add(chunk(new Delta(), FinishReason.STOP));
            frames.add(DONE_FRAME);
            finished = true;
            return frames;
        }

        /**
         * The role frame always leads, even if the backend skipped its announcement.
         */
        private void flushRole(List<String> frames) {
            if (!roleSent) {
                roleSent = true;
                frames.add(chunk(Delta.builder().role(ChatMessage.ROLE_ASSISTANT).build(), null));
            }
        }

        private String chunk(Delta delta, FinishReason finishReason) {
            ChatCompletionChunk chunk = ChatCompletionChunk.builder()
                    .id(requestId)
                    .object(ChatCompletionChunk.OBJECT)
                    .created(created)
                    .model(model)
                    .choices(List.of(ChatCompletionChunk.ChunkChoice.builder()
                            .index(0)
                            .delta(delta)
                            .finishReason(finishReason)
                            .build()))
                    .build();
            return "data: " + serializeToJson(chunk) + "\n\n";
        }

        void markCommitted() {
            committed = true;
        }

        boolean isFinished() {
            return finished;
        }

        boolean isContentDelivered() {
            return contentDelivered;
        }

        boolean isCommitted() {
            return committed;
        }
    }
}
