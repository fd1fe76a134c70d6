package com.linlay.calendarassistant.stream;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Objects;

/**
 * Append-only, replaying output stream. Completion happens at most once; writes after completion
 * are ignored rather than failing, so a producer never has to know whether anyone is listening.
 */
public final class StreamChannel<T> {

    private final String name;
    private final Sinks.Many<T> sink = Sinks.many().replay().all();
    private boolean completed;

    public StreamChannel(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    public synchronized boolean emit(T value) {
        if (completed || value == null) {
            return false;
        }
        return sink.tryEmitNext(value).isSuccess();
    }

    public synchronized boolean complete() {
        if (completed) {
            return false;
        }
        completed = true;
        sink.tryEmitComplete();
        return true;
    }

    public synchronized boolean isCompleted() {
        return completed;
    }

    public Flux<T> asFlux() {
        return sink.asFlux();
    }
}
