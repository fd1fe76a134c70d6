package com.linlay.calendarassistant.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.function.Function;

/**
 * Turns a {@link ChatChannelSet} into one Server-Sent-Events stream.
 * <p>
 * Every channel value becomes an event named after its channel with a JSON data line. Events
 * carry a per-stream sequence id in emission order, and a {@code done} event closes the stream
 * once all six channels have completed. Each event is flushed on its own.
 */
@Component
public class ChannelSseWriter {

    public static final String MESSAGE_EVENT = "message";
    public static final String DONE_EVENT = "done";

    private final ObjectMapper objectMapper;

    public ChannelSseWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Flux<ServerSentEvent<String>> channelEvents(ChatChannelSet channels, String threadId) {
        Flux<ServerSentEvent<String>> merged = Flux.merge(
                valuesOf(channels.statusChannel(), Function.identity()),
                valuesOf(channels.textChannel(), Function.identity()),
                valuesOf(channels.guiChannel(), Function.identity()),
                valuesOf(channels.threadIdChannel(), Function.identity()),
                valuesOf(channels.mutationCountChannel(), Function.identity()),
                valuesOf(channels.extractedRangeChannel(), RangeUpdate::range)
        );
        return numbered(merged.concatWith(Mono.fromSupplier(
                () -> event(DONE_EVENT, Map.of("threadId", threadId))
        )));
    }

    public Flux<ServerSentEvent<String>> singleMessage(Object payload) {
        return numbered(Flux.just(event(MESSAGE_EVENT, payload)));
    }

    public Mono<Void> write(ServerHttpResponse response, Flux<ServerSentEvent<String>> events) {
        response.getHeaders().setContentType(MediaType.TEXT_EVENT_STREAM);
        response.getHeaders().set("X-Accel-Buffering", "no");
        response.getHeaders().set("Cache-Control", "no-cache, no-transform");

        return response.writeAndFlushWith(
                events.map(ChannelSseWriter::encode)
                        .map(response.bufferFactory()::wrap)
                        .map(Mono::just)
        );
    }

    private <T> Flux<ServerSentEvent<String>> valuesOf(StreamChannel<T> channel, Function<? super T, ?> payload) {
        return channel.asFlux().map(value -> event(channel.name(), payload.apply(value)));
    }

    private Flux<ServerSentEvent<String>> numbered(Flux<ServerSentEvent<String>> events) {
        return events.index((sequence, event) -> ServerSentEvent.<String>builder()
                .id(Long.toString(sequence + 1))
                .event(event.event())
                .data(event.data())
                .build());
    }

    private ServerSentEvent<String> event(String name, Object payload) {
        return ServerSentEvent.<String>builder()
                .event(name)
                .data(toJson(payload))
                .build();
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize " + payload.getClass().getSimpleName() + " for the event stream", ex);
        }
    }

    static byte[] encode(ServerSentEvent<String> event) {
        StringBuilder frame = new StringBuilder();
        if (StringUtils.hasText(event.id())) {
            frame.append("id:").append(event.id()).append('\n');
        }
        if (StringUtils.hasText(event.event())) {
            frame.append("event:").append(event.event()).append('\n');
        }
        if (event.data() != null) {
            for (String line : event.data().split("\\R", -1)) {
                frame.append("data:").append(line).append('\n');
            }
        }
        return frame.append('\n').toString().getBytes(StandardCharsets.UTF_8);
    }
}
