package io.ringbridge.telemetry;

import io.ringbridge.core.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Fans fetch events out to attached handlers.
 * <p>
 * A handler that throws is detached so that a broken sink cannot stall the producer.
 */
@Slf4j
public final class Telemetry {

    private final ConcurrentMap<String, TelemetryHandler> handlers = new ConcurrentHashMap<>();

    public static Telemetry noop() {
        return new Telemetry();
    }

    /**
     * Attach {@code handler} under {@code id}, replacing any handler already there.
     */
    public Telemetry attach(final String id, final TelemetryHandler handler) {
        handlers.put(Objects.requireNonNull(id, "id"), Objects.requireNonNull(handler, "handler"));
        return this;
    }

    public void detach(final String id) {
        handlers.remove(id);
    }

    public boolean isAttached(final String id) {
        return handlers.containsKey(id);
    }

    /**
     * Runs {@code fetch} between a {@link FetchEvent.Start} and a {@link FetchEvent.Stop}.
     * The stop event is emitted on every exit path; a failure from {@code fetch} is rethrown after it.
     */
    public <T> List<Message<T>> span(final String producer, final long demand, final Supplier<List<Message<T>>> fetch) {
        final long startNanos = System.nanoTime();
        emit(new FetchEvent.Start(producer, demand, System.currentTimeMillis(), startNanos));

        List<Message<T>> messages = List.of();
        Throwable error = null;
        try {
            messages = fetch.get();
            return messages;
        } catch (final RuntimeException | Error e) {
            error = e;
            throw e;
        } finally {
            final long stopNanos = System.nanoTime();
            emit(new FetchEvent.Stop(producer, demand, messages,
                    Duration.ofNanos(stopNanos - startNanos), stopNanos, error));
        }
    }

    private void emit(final FetchEvent event) {
        for (final Map.Entry<String, TelemetryHandler> e : handlers.entrySet()) {
            try {
                e.getValue().handle(event);
            } catch (final RuntimeException ex) {
                log.error("Telemetry handler {} failed on {}, detaching it", e.getKey(), event.name(), ex);
                handlers.remove(e.getKey(), e.getValue());
            }
        }
    }
}
