package io.ringbridge.producer;

import io.ringbridge.buffer.Buffer;

import java.time.Duration;
import java.util.Objects;

/**
 * Demand bookkeeping of one producer. Only the producer's own thread ever sees a given instance.
 *
 * @param name                  producer identity, also the ack reference of its messages
 * @param buffer                where items are popped from
 * @param pendingDemand         demand accepted from the pipeline but not satisfied yet
 * @param resolvePendingTimeout delay between two re-attempts at satisfying pending demand
 */
public record ProducerState<T>(String name, Buffer<T> buffer, long pendingDemand, Duration resolvePendingTimeout) {

    public ProducerState {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(buffer, "buffer");
        Objects.requireNonNull(resolvePendingTimeout, "resolvePendingTimeout");
        if (pendingDemand < 0) {
            throw new IllegalArgumentException("pendingDemand must be >= 0, got " + pendingDemand);
        }
    }

    public static <T> ProducerState<T> initial(final String name, final Buffer<T> buffer, final Duration timeout) {
        return new ProducerState<>(name, buffer, 0L, timeout);
    }

    public ProducerState<T> withPendingDemand(final long demand) {
        return new ProducerState<>(name, buffer, demand, resolvePendingTimeout);
    }
}
