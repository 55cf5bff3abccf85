package io.ringbridge.producer;

import io.ringbridge.core.model.Message;

import java.util.List;

/**
 * Downstream side of a producer, called on the producer's thread with every non-empty batch.
 */
@FunctionalInterface
public interface MessageSink<T> {
    void accept(List<Message<T>> messages);
}
