package io.ringbridge.host;

import io.ringbridge.core.model.Message;

/**
 * User processing step of a {@link Pipeline}.
 * <p>
 * Return the message, optionally {@link Message#failed(String) failed} or
 * {@link Message#configureAck(java.util.Map) re-configured}. Throwing marks it failed.
 */
@FunctionalInterface
public interface MessageHandler<T> {
    Message<T> handle(Message<T> message) throws Exception;
}
