package io.ringbridge.ack;

import io.ringbridge.core.model.Message;

import java.util.List;
import java.util.Map;

/**
 * Contract between the pipeline host and the component that produced its messages.
 *
 * @param <T> the message payload type
 */
public interface Acknowledger<T> {

    /**
     * Reports the outcome of a finished batch. Every message reaches this method once.
     *
     * @param ackRef     the producer identity carried by the messages
     * @param successful messages processed without error
     * @param failed     messages the pipeline gave up on
     */
    void ack(String ackRef, List<Message<T>> successful, List<Message<T>> failed);

    /**
     * Merges {@code options} into a message's ack data, options winning on collision.
     *
     * @return a new map, {@code ackData} is left untouched
     */
    Map<String, Object> configure(String ackRef, Map<String, Object> ackData, Map<String, ?> options);
}
