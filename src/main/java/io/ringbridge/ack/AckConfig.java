package io.ringbridge.ack;

import io.ringbridge.buffer.Buffer;

import java.util.Objects;

/**
 * What an acknowledger needs to know about a producer: where to requeue and the default policy.
 */
public record AckConfig<T>(Buffer<T> buffer, FailurePolicy onFailure) {
    public AckConfig {
        Objects.requireNonNull(buffer, "buffer");
        Objects.requireNonNull(onFailure, "onFailure");
    }
}
