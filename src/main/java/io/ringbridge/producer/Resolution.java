package io.ringbridge.producer;

import io.ringbridge.core.model.Message;

import java.util.List;

/**
 * Outcome of one resolve cycle: the messages to emit and the state to keep.
 */
public record Resolution<T>(List<Message<T>> messages, ProducerState<T> state) {
}
