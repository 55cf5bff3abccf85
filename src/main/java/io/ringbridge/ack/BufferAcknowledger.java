package io.ringbridge.ack;

import io.ringbridge.config.InvalidConfigurationException;
import io.ringbridge.core.model.AckToken;
import io.ringbridge.core.model.Message;
import io.ringbridge.registry.AckRegistry;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Acknowledges messages popped from a buffer by requeueing the failed ones that ask for it.
 * <p>
 * The buffer and default policy are looked up in the {@link AckRegistry} on every call, so this
 * class holds no per-producer state and may be called from any number of threads at once.
 */
@Slf4j
@RequiredArgsConstructor
public final class BufferAcknowledger<T> implements Acknowledger<T> {

    @Getter
    private final AckRegistry registry;

    @Override
    public void ack(final String ackRef, final List<Message<T>> successful, final List<Message<T>> failed) {
        final AckConfig<T> config = registry.lookup(ackRef);

        final List<T> requeue = new ArrayList<>(failed.size());
        for (final Message<T> message : failed) {
            if (policyOf(message, config.onFailure()) == FailurePolicy.REQUEUE) {
                requeue.add(message.data());
            }
        }

        if (!requeue.isEmpty()) {
            config.buffer().push(requeue);
        }

        if (log.isDebugEnabled()) {
            log.debug("Acked {}: {} successful, {} failed, {} requeued",
                    ackRef, successful.size(), failed.size(), requeue.size());
        }
    }

    @Override
    public Map<String, Object> configure(final String ackRef,
                                         final Map<String, Object> ackData,
                                         final Map<String, ?> options) {
        final Object onFailure = options.get(AckToken.ON_FAILURE);
        if (onFailure != null && FailurePolicy.from(onFailure) == null) {
            throw new InvalidConfigurationException("BufferAcknowledger", AckToken.ON_FAILURE,
                    "expected one of [discard, requeue], got: " + onFailure);
        }

        final Map<String, Object> merged = new HashMap<>(ackData);
        for (final Map.Entry<String, ?> e : options.entrySet()) {
            merged.put(e.getKey(), Objects.requireNonNull(e.getValue(), e.getKey()));
        }
        return Map.copyOf(merged);
    }

    private static FailurePolicy policyOf(final Message<?> message, final FailurePolicy fallback) {
        final FailurePolicy override = message.ackToken().onFailure();
        return override != null ? override : fallback;
    }
}
