package io.ringbridge.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * A buffered item handed to the pipeline, together with the token used to acknowledge it.
 * <p>
 * Every message must be acknowledged exactly once; acknowledging twice requeues twice.
 *
 * @param data          the item exactly as it was popped from the buffer
 * @param ackToken      where the ack goes
 * @param failureReason {@code null} unless the message was marked {@link #failed(String)}
 */
public record Message<T>(T data, AckToken<T> ackToken, String failureReason) {

    public Message {
        Objects.requireNonNull(ackToken, "ackToken");
    }

    public Message(final T data, final AckToken<T> ackToken) {
        this(data, ackToken, null);
    }

    public boolean isFailed() {
        return failureReason != null;
    }

    public Message<T> failed(final String reason) {
        return new Message<>(data, ackToken, Objects.requireNonNull(reason, "reason"));
    }

    /**
     * Merges {@code options} into this message's ack data through its acknowledger.
     */
    public Message<T> configureAck(final Map<String, ?> options) {
        final Map<String, Object> merged = ackToken.acknowledger()
                .configure(ackToken.ackRef(), ackToken.ackData(), options);
        return new Message<>(data, ackToken.withAckData(merged), failureReason);
    }
}
