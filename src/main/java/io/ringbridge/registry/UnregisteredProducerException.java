package io.ringbridge.registry;

import lombok.Getter;

/**
 * An ack arrived for a producer that never registered, or that has already shut down.
 */
@Getter
public final class UnregisteredProducerException extends IllegalStateException {
    private final String ackRef;

    public UnregisteredProducerException(final String ackRef) {
        super("no producer registered under ack reference: " + ackRef);
        this.ackRef = ackRef;
    }
}
